package com.dev.prostaff.store;

import com.dev.prostaff.tenant.TenantContext;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MessageStore {

    MessageRecord create(TenantContext tenant, String content, UUID senderId, UUID recipientId, UUID organizationId);

    List<MessageRecord> findConversation(TenantContext tenant, UUID otherUserId, OffsetDateTime before, int limit);

    Optional<MessageRecord> findById(TenantContext tenant, UUID messageId);

    MessageRecord softDelete(TenantContext tenant, UUID messageId);
}
