package com.workforce.employees.api.employees;

import com.workforce.employees.api.PagingRules;
import com.workforce.validation.AbstractValidator;
import com.workforce.validation.Rules;
import org.springframework.stereotype.Component;

@Component
public class GetAllEmployeesRequestValidator extends AbstractValidator<GetAllEmployeesRequest> {

    public GetAllEmployeesRequestValidator() {
        super(GetAllEmployeesRequest.class);
        ruleFor("Page", GetAllEmployeesRequest::page)
                .must(Rules.atLeast(1), PagingRules.PAGE_MESSAGE);
        ruleFor("RecordsPerPage", GetAllEmployeesRequest::recordsPerPage)
                .must(Rules.atLeast(1), PagingRules.MIN_RECORDS_MESSAGE)
                .must(Rules.atMost(PagingRules.MAX_RECORDS_PER_PAGE), PagingRules.MAX_RECORDS_MESSAGE);
    }
}
