package com.workforce.employees.api.employees;

import com.workforce.employees.application.AssignedBenefit;
import java.math.BigDecimal;

/**
 * One benefit enrolment of an employee.
 *
 * @param id enrolment id
 * @param benefitId benefit id
 * @param name benefit name
 * @param description benefit description
 * @param baseCost catalogue cost
 * @param costOverride enrolment-specific cost, if any
 * @param cost effective cost: the override when present, otherwise the catalogue cost
 */
public record EmployeeBenefitResponse(
        Long id,
        Long benefitId,
        String name,
        String description,
        BigDecimal baseCost,
        BigDecimal costOverride,
        BigDecimal cost) {

    public static EmployeeBenefitResponse from(AssignedBenefit assigned) {
        return new EmployeeBenefitResponse(
                assigned.enrolment().getId(),
                assigned.benefit().getId(),
                assigned.benefit().getName(),
                assigned.benefit().getDescription(),
                assigned.benefit().getBaseCost(),
                assigned.enrolment().getCostOverride(),
                assigned.effectiveCost());
    }
}
