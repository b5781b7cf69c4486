package com.workforce.employees.domain;

import java.math.BigDecimal;

/**
 * Enrolment of one employee in one benefit. The pair ({@code employeeId}, {@code benefitId}) is
 * unique.
 */
public class EmployeeBenefit {

    private Long id;
    private Long employeeId;
    private Long benefitId;
    private BigDecimal costOverride;

    public EmployeeBenefit() {}

    public EmployeeBenefit(Long employeeId, Long benefitId, BigDecimal costOverride) {
        this.employeeId = employeeId;
        this.benefitId = benefitId;
        this.costOverride = costOverride;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getEmployeeId() {
        return employeeId;
    }

    public void setEmployeeId(Long employeeId) {
        this.employeeId = employeeId;
    }

    public Long getBenefitId() {
        return benefitId;
    }

    public void setBenefitId(Long benefitId) {
        this.benefitId = benefitId;
    }

    public BigDecimal getCostOverride() {
        return costOverride;
    }

    public void setCostOverride(BigDecimal costOverride) {
        this.costOverride = costOverride;
    }

    /**
     * Cost charged for this enrolment: the override when present, otherwise the benefit's base
     * cost.
     *
     * @param benefit the benefit this enrolment references
     * @throws IllegalArgumentException if {@code benefit} is not the referenced benefit
     */
    public BigDecimal effectiveCost(Benefit benefit) {
        if (benefit == null || !benefit.getId().equals(benefitId)) {
            throw new IllegalArgumentException(
                    "Benefit " + (benefit == null ? null : benefit.getId())
                            + " is not referenced by this enrolment (" + benefitId + ")");
        }
        return costOverride != null ? costOverride : benefit.getBaseCost();
    }
}
