package com.workforce.employees.api.users;

final class UserFieldRules {

    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_PROFILE_PICTURE_LENGTH = 500;

    static final String EMAIL_REQUIRED = "Email is required.";
    static final String EMAIL_INVALID = "A valid email is required.";
    static final String FIRST_NAME_TOO_LONG = "First name cannot exceed 100 characters.";
    static final String LAST_NAME_TOO_LONG = "Last name cannot exceed 100 characters.";
    static final String PROFILE_PICTURE_TOO_LONG = "Profile picture URL cannot exceed 500 characters.";
    static final String PROFILE_PICTURE_INVALID = "Profile picture must be a valid URL.";

    private UserFieldRules() {}
}
