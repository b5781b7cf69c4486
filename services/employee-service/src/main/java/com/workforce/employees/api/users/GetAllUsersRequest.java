package com.workforce.employees.api.users;

/**
 * Query parameters of the user list. Every field is optional.
 *
 * @param page 1-based page number
 * @param recordsPerPage page size, at most 100
 * @param emailContains case-insensitive email fragment
 * @param firstNameContains case-insensitive first name fragment
 * @param lastNameContains case-insensitive last name fragment
 * @param isActive activation flag
 */
public record GetAllUsersRequest(
        Integer page,
        Integer recordsPerPage,
        String emailContains,
        String firstNameContains,
        String lastNameContains,
        Boolean isActive) {}
