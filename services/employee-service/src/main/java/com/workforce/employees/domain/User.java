package com.workforce.employees.domain;

import com.workforce.database.audit.Auditable;
import java.time.Instant;

/**
 * A user profile. Credentials and sign-in state belong to the external identity provider; this
 * record only carries the profile and its activation flag.
 */
public class User implements Auditable {

    /** Display name used when a user has neither a name, an email nor a user name. */
    public static final String UNKNOWN_USER = "Unknown User";

    private String id;
    private String email;
    private String userName;
    private String firstName;
    private String lastName;
    private String profilePicture;
    private boolean active;

    private String createdBy;
    private Instant createdAt;
    private String modifiedBy;
    private Instant modifiedAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getUserName() {
        return userName;
    }

    public void setUserName(String userName) {
        this.userName = userName;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getProfilePicture() {
        return profilePicture;
    }

    public void setProfilePicture(String profilePicture) {
        this.profilePicture = profilePicture;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    /** First and last name joined and trimmed; empty when both are missing. */
    public String getFullName() {
        String first = firstName == null ? "" : firstName;
        String last = lastName == null ? "" : lastName;
        return (first + " " + last).trim();
    }

    /** Full name, falling back to email, then user name, then {@link #UNKNOWN_USER}. */
    public String getDisplayName() {
        String fullName = getFullName();
        if (!fullName.isEmpty()) {
            return fullName;
        }
        if (email != null) {
            return email;
        }
        if (userName != null) {
            return userName;
        }
        return UNKNOWN_USER;
    }

    @Override
    public String getCreatedBy() {
        return createdBy;
    }

    @Override
    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    @Override
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String getModifiedBy() {
        return modifiedBy;
    }

    @Override
    public void setModifiedBy(String modifiedBy) {
        this.modifiedBy = modifiedBy;
    }

    @Override
    public Instant getModifiedAt() {
        return modifiedAt;
    }

    @Override
    public void setModifiedAt(Instant modifiedAt) {
        this.modifiedAt = modifiedAt;
    }
}
