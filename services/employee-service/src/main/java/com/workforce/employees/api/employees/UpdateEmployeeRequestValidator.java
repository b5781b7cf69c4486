package com.workforce.employees.api.employees;

import com.workforce.employees.domain.Employee;
import com.workforce.employees.infrastructure.persistence.EmployeeRepository;
import com.workforce.validation.AbstractValidator;
import com.workforce.validation.RuleContext;
import com.workforce.validation.Rules;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

/**
 * Validates employee updates.
 *
 * <p>The Address1 rule consults the stored employee identified by the {@code id} route value: an
 * address that is already set cannot be cleared. When the route id is absent or malformed, or the
 * employee does not exist, there is nothing to contradict and the rule passes.
 */
@Component
public class UpdateEmployeeRequestValidator extends AbstractValidator<UpdateEmployeeRequest> {

    public static final String ADDRESS1_MESSAGE = "Address1 must not be empty as an address was already set on the employee.";

    private final EmployeeRepository employees;

    public UpdateEmployeeRequestValidator(EmployeeRepository employees) {
        super(UpdateEmployeeRequest.class);
        this.employees = employees;
        ruleFor("Address1", UpdateEmployeeRequest::address1)
                .mustAsync((address1, payload, context) -> keepsExistingAddress(address1, context), ADDRESS1_MESSAGE);
        ruleFor("Email", UpdateEmployeeRequest::email)
                .must(Rules.blankOr(Rules.emailAddress()), "A valid email is required.");
    }

    private CompletableFuture<Boolean> keepsExistingAddress(String address1, RuleContext context) {
        if (address1 != null && !address1.isBlank()) {
            return CompletableFuture.completedFuture(true);
        }
        OptionalLong id = context.routeId("id");
        if (id.isEmpty()) {
            return CompletableFuture.completedFuture(true);
        }
        return context.supplyAsync(() -> employees.findById(id.getAsLong()).map(Employee::getAddress1).isEmpty());
    }
}
