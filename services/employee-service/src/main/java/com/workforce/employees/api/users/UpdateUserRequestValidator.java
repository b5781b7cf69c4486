package com.workforce.employees.api.users;

import static com.workforce.employees.api.users.UserFieldRules.FIRST_NAME_TOO_LONG;
import static com.workforce.employees.api.users.UserFieldRules.LAST_NAME_TOO_LONG;
import static com.workforce.employees.api.users.UserFieldRules.MAX_NAME_LENGTH;
import static com.workforce.employees.api.users.UserFieldRules.MAX_PROFILE_PICTURE_LENGTH;
import static com.workforce.employees.api.users.UserFieldRules.PROFILE_PICTURE_INVALID;
import static com.workforce.employees.api.users.UserFieldRules.PROFILE_PICTURE_TOO_LONG;

import com.workforce.validation.AbstractValidator;
import com.workforce.validation.Rules;
import org.springframework.stereotype.Component;

@Component
public class UpdateUserRequestValidator extends AbstractValidator<UpdateUserRequest> {

    public UpdateUserRequestValidator() {
        super(UpdateUserRequest.class);
        ruleFor("FirstName", UpdateUserRequest::firstName)
                .must(Rules.maxLength(MAX_NAME_LENGTH), FIRST_NAME_TOO_LONG);
        ruleFor("LastName", UpdateUserRequest::lastName)
                .must(Rules.maxLength(MAX_NAME_LENGTH), LAST_NAME_TOO_LONG);
        ruleFor("ProfilePicture", UpdateUserRequest::profilePicture)
                .must(Rules.maxLength(MAX_PROFILE_PICTURE_LENGTH), PROFILE_PICTURE_TOO_LONG)
                .must(Rules.blankOr(Rules.absoluteUri()), PROFILE_PICTURE_INVALID);
    }
}
