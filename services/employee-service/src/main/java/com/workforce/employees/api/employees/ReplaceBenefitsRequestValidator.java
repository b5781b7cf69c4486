package com.workforce.employees.api.employees;

import com.workforce.validation.AbstractValidator;
import com.workforce.validation.Rules;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class ReplaceBenefitsRequestValidator extends AbstractValidator<ReplaceBenefitsRequest> {

    public ReplaceBenefitsRequestValidator() {
        super(ReplaceBenefitsRequest.class);
        ruleFor("BenefitIds", ReplaceBenefitsRequest::benefitIds)
                .must(Rules.notNull(), "Benefit ids are required.")
                .must(ids -> ids == null || ids.stream().allMatch(Objects::nonNull),
                        "Benefit ids must not contain empty values.");
        ruleFor("CostOverrides", ReplaceBenefitsRequest::costOverrides)
                .must(overrides -> overrides == null || overrides.values().stream().allMatch(Rules.notNegative()),
                        "Cost override must not be negative.");
    }
}
