package com.dev.prostaff.tenant;

import java.util.UUID;

public class TenantMismatchException extends RuntimeException {

    private final UUID expectedOrganizationId;
    private final UUID actualOrganizationId;

    public TenantMismatchException(UUID expectedOrganizationId, UUID actualOrganizationId) {
        super("Tenant mismatch: context org '%s' cannot access resource of org '%s'"
                .formatted(expectedOrganizationId, actualOrganizationId));
        this.expectedOrganizationId = expectedOrganizationId;
        this.actualOrganizationId = actualOrganizationId;
    }

    public UUID expectedOrganizationId() {
        return expectedOrganizationId;
    }

    public UUID actualOrganizationId() {
        return actualOrganizationId;
    }
}
