package com.dev.prostaff.store;

import java.util.UUID;

public record OrganizationRecord(UUID id, String name, String region) {
}
