package com.workforce.employees.api.users;

import com.workforce.employees.api.PagingRules;
import com.workforce.validation.AbstractValidator;
import com.workforce.validation.Rules;
import org.springframework.stereotype.Component;

@Component
public class GetAllUsersRequestValidator extends AbstractValidator<GetAllUsersRequest> {

    public GetAllUsersRequestValidator() {
        super(GetAllUsersRequest.class);
        ruleFor("Page", GetAllUsersRequest::page).must(Rules.atLeast(1), PagingRules.PAGE_MESSAGE);
        ruleFor("RecordsPerPage", GetAllUsersRequest::recordsPerPage)
                .must(Rules.atLeast(1), PagingRules.MIN_RECORDS_MESSAGE)
                .must(Rules.atMost(PagingRules.MAX_RECORDS_PER_PAGE), PagingRules.MAX_RECORDS_MESSAGE);
    }
}
