package com.dev.prostaff.store;

import com.dev.prostaff.domain.Role;

import java.time.OffsetDateTime;
import java.util.UUID;

public record MessageRecord(
        UUID id,
        String content,
        UUID senderId,
        String senderName,
        Role senderRole,
        UUID recipientId,
        UUID organizationId,
        OffsetDateTime createdAt,
        boolean deleted
) {

    public boolean isDirect() {
        return recipientId != null;
    }
}
