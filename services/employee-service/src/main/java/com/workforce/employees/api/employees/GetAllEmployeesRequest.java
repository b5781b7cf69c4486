package com.workforce.employees.api.employees;

/**
 * Query parameters of {@code GET /api/v1/employees}.
 *
 * @param page 1-based page number (default 1)
 * @param recordsPerPage page size (default 100)
 * @param firstNameContains optional first name fragment
 * @param lastNameContains optional last name fragment
 */
public record GetAllEmployeesRequest(
        Integer page, Integer recordsPerPage, String firstNameContains, String lastNameContains) {}
