package com.dev.prostaff.web.dto;

import com.dev.prostaff.store.OrganizationRecord;
import com.dev.prostaff.store.UserRecord;

import java.util.UUID;

public record ProfileResponse(
        UUID id,
        String email,
        String fullName,
        String role,
        OrganizationView organization
) {

    public record OrganizationView(UUID id, String name, String region) {
    }

    public static ProfileResponse of(UserRecord user, OrganizationRecord organization) {
        return new ProfileResponse(
                user.id(),
                user.email(),
                user.fullName(),
                user.role().wireName(),
                organization == null ? null
                        : new OrganizationView(organization.id(), organization.name(), organization.region())
        );
    }
}
