package com.dev.prostaff.tenant;

import com.dev.prostaff.domain.Role;
import com.dev.prostaff.security.Identity;

import java.util.Objects;
import java.util.UUID;

public record TenantContext(UUID organizationId, UUID userId, Role role) {

    public TenantContext {
        Objects.requireNonNull(organizationId, "organizationId must not be null");
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }

    public static TenantContext of(Identity identity) {
        return new TenantContext(identity.organizationId(), identity.userId(), identity.role());
    }
}
