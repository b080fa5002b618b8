package com.dev.prostaff.store;

import com.dev.prostaff.domain.Message;
import com.dev.prostaff.domain.User;
import com.dev.prostaff.repository.MessageRepository;
import com.dev.prostaff.repository.UserRepository;
import com.dev.prostaff.tenant.TenantContext;
import com.dev.prostaff.tenant.TenantIsolation;
import jakarta.transaction.Transactional;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaMessageStore implements MessageStore {

    private final MessageRepository messageRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    public JpaMessageStore(MessageRepository messageRepository, UserRepository userRepository, Clock clock) {
        this.messageRepository = messageRepository;
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public MessageRecord create(TenantContext tenant, String content, UUID senderId, UUID recipientId, UUID organizationId) {
        TenantIsolation.enforce(tenant, organizationId);
        User sender = userRepository.findByIdAndOrganizationId(senderId, organizationId)
                .orElseThrow(() -> new DataIntegrityViolationException("Sender must belong to the organization"));
        User recipient = null;
        if (recipientId != null) {
            recipient = userRepository.findByIdAndOrganizationId(recipientId, organizationId)
                    .orElseThrow(() -> new DataIntegrityViolationException("Recipient must belong to the same organization"));
        }
        Message message = messageRepository.save(Message.builder()
                .id(UUID.randomUUID())
                .sender(sender)
                .recipient(recipient)
                .organizationId(organizationId)
                .content(content)
                .deleted(false)
                .createdAt(OffsetDateTime.now(clock))
                .build());
        return toRecord(message);
    }

    @Override
    @Transactional
    public List<MessageRecord> findConversation(TenantContext tenant, UUID otherUserId, OffsetDateTime before, int limit) {
        return messageRepository.findConversation(tenant.organizationId(), tenant.userId(), otherUserId,
                        before, PageRequest.of(0, limit))
                .stream()
                .map(JpaMessageStore::toRecord)
                .toList();
    }

    @Override
    @Transactional
    public Optional<MessageRecord> findById(TenantContext tenant, UUID messageId) {
        return messageRepository.findByIdAndOrganizationId(messageId, tenant.organizationId())
                .map(JpaMessageStore::toRecord);
    }

    @Override
    @Transactional
    public MessageRecord softDelete(TenantContext tenant, UUID messageId) {
        Message message = messageRepository.findByIdAndOrganizationId(messageId, tenant.organizationId())
                .orElseThrow(() -> new DataIntegrityViolationException("Message not found in organization"));
        TenantIsolation.enforce(tenant, message.getOrganizationId());
        message.setDeleted(true);
        message.setDeletedAt(OffsetDateTime.now(clock));
        return toRecord(messageRepository.save(message));
    }

    private static MessageRecord toRecord(Message message) {
        User sender = message.getSender();
        return new MessageRecord(
                message.getId(),
                message.getContent(),
                sender.getId(),
                sender.getFullName(),
                sender.getRole(),
                message.getRecipient() != null ? message.getRecipient().getId() : null,
                message.getOrganizationId(),
                message.getCreatedAt(),
                message.isDeleted()
        );
    }
}
