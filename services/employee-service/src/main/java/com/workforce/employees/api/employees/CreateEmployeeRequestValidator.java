package com.workforce.employees.api.employees;

import com.workforce.validation.AbstractValidator;
import com.workforce.validation.Rules;
import org.springframework.stereotype.Component;

@Component
public class CreateEmployeeRequestValidator extends AbstractValidator<CreateEmployeeRequest> {

    public CreateEmployeeRequestValidator() {
        super(CreateEmployeeRequest.class);
        ruleFor("FirstName", CreateEmployeeRequest::firstName)
                .must(Rules.notEmpty(), "First name is required.");
        ruleFor("LastName", CreateEmployeeRequest::lastName)
                .must(Rules.notEmpty(), "Last name is required.");
        ruleFor("Email", CreateEmployeeRequest::email)
                .must(Rules.blankOr(Rules.emailAddress()), "A valid email is required.");
    }
}
