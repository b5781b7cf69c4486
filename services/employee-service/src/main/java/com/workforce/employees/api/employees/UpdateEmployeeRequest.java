package com.workforce.employees.api.employees;

/**
 * Body of {@code PUT /api/v1/employees/{id}}. Names and social security number cannot be changed
 * through an update.
 */
public record UpdateEmployeeRequest(
        String address1,
        String address2,
        String city,
        String state,
        String zipCode,
        String phoneNumber,
        String email) {}
