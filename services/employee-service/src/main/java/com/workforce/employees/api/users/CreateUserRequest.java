package com.workforce.employees.api.users;

public record CreateUserRequest(
        String email, String firstName, String lastName, String profilePicture) {}
