package com.dev.prostaff.tenant;

import com.dev.prostaff.domain.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TenantIsolation")
class TenantIsolationTest {

    private final UUID orgId = UUID.randomUUID();
    private final TenantContext context = new TenantContext(orgId, UUID.randomUUID(), Role.OWNER);

    @Test
    @DisplayName("allows resources of the same organization")
    void sameOrganization() {
        assertThatCode(() -> TenantIsolation.enforce(context, orgId)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("blocks resources of another organization, whatever the role")
    void otherOrganization() {
        UUID otherOrg = UUID.randomUUID();

        assertThatThrownBy(() -> TenantIsolation.enforce(context, otherOrg))
                .isInstanceOfSatisfying(TenantMismatchException.class, e -> {
                    assertThat(e.expectedOrganizationId()).isEqualTo(orgId);
                    assertThat(e.actualOrganizationId()).isEqualTo(otherOrg);
                });
    }

    @Test
    @DisplayName("a resource without organization never matches")
    void missingOrganization() {
        assertThatThrownBy(() -> TenantIsolation.enforce(context, null))
                .isInstanceOf(TenantMismatchException.class);
    }

    @Test
    @DisplayName("a context cannot be built without a tenant")
    void contextRequiresTenant() {
        assertThatThrownBy(() -> new TenantContext(null, UUID.randomUUID(), Role.VIEWER))
                .isInstanceOf(NullPointerException.class);
    }
}
