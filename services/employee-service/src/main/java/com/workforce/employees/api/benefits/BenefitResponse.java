package com.workforce.employees.api.benefits;

import com.workforce.employees.domain.Benefit;
import java.math.BigDecimal;

public record BenefitResponse(Long id, String name, String description, BigDecimal baseCost) {

    public static BenefitResponse from(Benefit benefit) {
        return new BenefitResponse(
                benefit.getId(), benefit.getName(), benefit.getDescription(), benefit.getBaseCost());
    }
}
