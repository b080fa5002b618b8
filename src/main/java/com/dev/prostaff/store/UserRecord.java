package com.dev.prostaff.store;

import com.dev.prostaff.domain.Role;
import com.dev.prostaff.domain.User;

import java.util.UUID;

public record UserRecord(
        UUID id,
        UUID organizationId,
        Role role,
        String email,
        String fullName
) {

    public static UserRecord from(User user) {
        return new UserRecord(
                user.getId(),
                user.getOrganization() != null ? user.getOrganization().getId() : null,
                user.getRole(),
                user.getEmail(),
                user.getFullName()
        );
    }

    public boolean hasOrganization() {
        return organizationId != null;
    }

    public boolean belongsTo(UUID organization) {
        return organizationId != null && organizationId.equals(organization);
    }
}
