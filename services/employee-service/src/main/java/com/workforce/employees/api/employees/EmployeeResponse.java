package com.workforce.employees.api.employees;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.workforce.employees.domain.Employee;
import java.time.Instant;

/**
 * Employee as returned by the API. The social security number is never exposed; audit fields are
 * omitted until they are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmployeeResponse(
        Long id,
        String firstName,
        String lastName,
        String address1,
        String address2,
        String city,
        String state,
        String zipCode,
        String phoneNumber,
        String email,
        String createdBy,
        Instant createdAt,
        String modifiedBy,
        Instant modifiedAt) {

    public static EmployeeResponse from(Employee employee) {
        return new EmployeeResponse(
                employee.getId(),
                employee.getFirstName(),
                employee.getLastName(),
                employee.getAddress1(),
                employee.getAddress2(),
                employee.getCity(),
                employee.getState(),
                employee.getZipCode(),
                employee.getPhoneNumber(),
                employee.getEmail(),
                employee.getCreatedBy(),
                employee.getCreatedAt(),
                employee.getModifiedBy(),
                employee.getModifiedAt());
    }
}
