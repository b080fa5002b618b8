package com.dev.prostaff.tenant;

import java.util.UUID;

public final class TenantIsolation {

    private TenantIsolation() {
        // utility class
    }

    public static void enforce(TenantContext context, UUID resourceOrganizationId) {
        if (!context.organizationId().equals(resourceOrganizationId)) {
            throw new TenantMismatchException(context.organizationId(), resourceOrganizationId);
        }
    }
}
