package com.dev.prostaff.store;

import java.util.Optional;
import java.util.UUID;

public interface OrganizationStore {

    Optional<OrganizationRecord> findById(UUID id);
}
