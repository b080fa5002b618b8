package com.dev.prostaff.repository;

import com.dev.prostaff.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {
    Optional<User> findByEmailIgnoreCase(String email);
    Optional<User> findByIdAndOrganizationId(UUID id, UUID organizationId);
}
