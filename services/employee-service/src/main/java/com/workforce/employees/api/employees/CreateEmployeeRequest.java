package com.workforce.employees.api.employees;

/** Body of {@code POST /api/v1/employees}. */
public record CreateEmployeeRequest(
        String firstName,
        String lastName,
        String socialSecurityNumber,
        String address1,
        String address2,
        String city,
        String state,
        String zipCode,
        String phoneNumber,
        String email) {}
