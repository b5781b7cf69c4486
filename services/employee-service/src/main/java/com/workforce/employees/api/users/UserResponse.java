package com.workforce.employees.api.users;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.workforce.employees.domain.User;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserResponse(
        String id,
        String email,
        String userName,
        String firstName,
        String lastName,
        String fullName,
        String displayName,
        String profilePicture,
        @JsonProperty("isActive") boolean isActive,
        Instant createdAt,
        Instant modifiedAt) {

    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getEmail(),
                user.getUserName(),
                user.getFirstName(),
                user.getLastName(),
                user.getFullName(),
                user.getDisplayName(),
                user.getProfilePicture(),
                user.isActive(),
                user.getCreatedAt(),
                user.getModifiedAt());
    }
}
