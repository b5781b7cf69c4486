package com.workforce.employees.api.employees;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.workforce.employees.domain.Employee;
import com.workforce.employees.infrastructure.persistence.EmployeeRepository;
import com.workforce.validation.RuleContext;
import com.workforce.validation.ValidationOutcome;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * The Address1 rule reads the stored employee named by the {@code id} route value. Storage is
 * mocked; the lookup runs on a real executor.
 */
@DisplayName("UpdateEmployeeRequestValidator")
class UpdateEmployeeRequestValidatorTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final EmployeeRepository employees = mock(EmployeeRepository.class);
    private final UpdateEmployeeRequestValidator validator =
            new UpdateEmployeeRequestValidator(employees);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private static UpdateEmployeeRequest withAddress(String address1) {
        return new UpdateEmployeeRequest(address1, null, null, null, null, null, null);
    }

    private static Employee employeeWithAddress(String address1) {
        Employee employee = new Employee();
        employee.setId(1L);
        employee.setFirstName("John");
        employee.setLastName("Doe");
        employee.setAddress1(address1);
        return employee;
    }

    private ValidationOutcome validate(UpdateEmployeeRequest request, Map<String, String> route) {
        return validator.validate(request, RuleContext.of(route, executor)).join();
    }

    @Nested
    @DisplayName("Address1")
    class Address1 {

        @Test
        @DisplayName("cannot be cleared once set on the stored employee")
        void cannotClearExistingAddress() {
            when(employees.findById(1L)).thenReturn(Optional.of(employeeWithAddress("123 Main St")));

            ValidationOutcome outcome = validate(withAddress(""), Map.of("id", "1"));

            assertThat(outcome.errors())
                    .containsExactly(
                            Map.entry(
                                    "Address1",
                                    List.of(UpdateEmployeeRequestValidator.ADDRESS1_MESSAGE)));
        }

        @Test
        @DisplayName("may stay empty when the stored employee has no address")
        void mayStayEmptyWithoutStoredAddress() {
            when(employees.findById(2L)).thenReturn(Optional.of(employeeWithAddress(null)));

            assertThat(validate(withAddress(null), Map.of("id", "2")).valid()).isTrue();
        }

        @Test
        @DisplayName("passes without a lookup when a new address is given")
        void newAddressSkipsLookup() {
            assertThat(validate(withAddress("9 New Rd"), Map.of("id", "1")).valid()).isTrue();
            verify(employees, never()).findById(anyLong());
        }

        @Test
        @DisplayName("passes when the employee does not exist")
        void passesForMissingEmployee() {
            when(employees.findById(9999L)).thenReturn(Optional.empty());

            assertThat(validate(withAddress(""), Map.of("id", "9999")).valid()).isTrue();
        }

        @Test
        @DisplayName("passes without a lookup when the route id is malformed")
        void malformedRouteIdPasses() {
            assertThat(validate(withAddress(""), Map.of("id", "abc")).valid()).isTrue();
            verify(employees, never()).findById(anyLong());
        }

        @Test
        @DisplayName("passes without a lookup when there is no route id")
        void missingRouteIdPasses() {
            assertThat(validate(withAddress(""), Map.of()).valid()).isTrue();
            verify(employees, never()).findById(anyLong());
        }
    }

    @Test
    @DisplayName("rejects a malformed email")
    void rejectsMalformedEmail() {
        var request = new UpdateEmployeeRequest("1 Road", null, null, null, null, null, "nope");

        assertThat(validate(request, Map.of()).errors())
                .containsOnlyKeys("Email")
                .containsEntry("Email", List.of("A valid email is required."));
    }
}
