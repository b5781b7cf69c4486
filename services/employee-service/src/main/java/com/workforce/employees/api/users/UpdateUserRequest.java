package com.workforce.employees.api.users;

public record UpdateUserRequest(String firstName, String lastName, String profilePicture) {}
