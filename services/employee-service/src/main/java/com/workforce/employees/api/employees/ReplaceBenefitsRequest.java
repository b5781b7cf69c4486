package com.workforce.employees.api.employees;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code PUT /api/v1/employees/{id}/benefits}: the complete new set of enrolments.
 *
 * @param benefitIds benefits to enrol in; duplicates collapse to one enrolment
 * @param costOverrides optional per-benefit cost replacing the catalogue cost
 */
public record ReplaceBenefitsRequest(List<Long> benefitIds, Map<Long, BigDecimal> costOverrides) {}
