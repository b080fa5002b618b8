package com.dev.prostaff.security;

import com.dev.prostaff.domain.Role;

import java.util.UUID;

public record Identity(
        UUID userId,
        UUID organizationId,
        Role role
) {
}
