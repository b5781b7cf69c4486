package com.workforce.employees.application;

import com.workforce.employees.domain.Benefit;
import com.workforce.employees.domain.EmployeeBenefit;
import java.math.BigDecimal;

/**
 * An enrolment joined with its benefit.
 *
 * @param enrolment the link row
 * @param benefit the referenced benefit
 * @param effectiveCost override-first cost of the enrolment
 */
public record AssignedBenefit(EmployeeBenefit enrolment, Benefit benefit, BigDecimal effectiveCost) {

    static AssignedBenefit of(EmployeeBenefit enrolment, Benefit benefit) {
        return new AssignedBenefit(enrolment, benefit, enrolment.effectiveCost(benefit));
    }
}
