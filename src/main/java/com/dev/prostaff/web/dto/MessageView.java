package com.dev.prostaff.web.dto;

import com.dev.prostaff.store.MessageRecord;

import java.time.OffsetDateTime;
import java.util.UUID;

public record MessageView(
        UUID id,
        String content,
        OffsetDateTime createdAt,
        UUID recipientId,
        Sender user
) {

    public record Sender(UUID id, String fullName, String role) {
    }

    public static MessageView of(MessageRecord message) {
        return new MessageView(
                message.id(),
                message.content(),
                message.createdAt(),
                message.recipientId(),
                new Sender(message.senderId(), message.senderName(),
                        message.senderRole() != null ? message.senderRole().wireName() : null)
        );
    }
}
