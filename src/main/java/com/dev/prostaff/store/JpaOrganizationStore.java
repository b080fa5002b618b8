package com.dev.prostaff.store;

import com.dev.prostaff.repository.OrganizationRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class JpaOrganizationStore implements OrganizationStore {

    private final OrganizationRepository organizationRepository;

    public JpaOrganizationStore(OrganizationRepository organizationRepository) {
        this.organizationRepository = organizationRepository;
    }

    @Override
    public Optional<OrganizationRecord> findById(UUID id) {
        return organizationRepository.findById(id)
                .map(org -> new OrganizationRecord(org.getId(), org.getName(), org.getRegion()));
    }
}
