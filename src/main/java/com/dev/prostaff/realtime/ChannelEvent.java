package com.dev.prostaff.realtime;

import com.dev.prostaff.store.MessageRecord;
import com.dev.prostaff.web.dto.MessageView;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelEvent(String type, MessageView message, UUID messageId) {

    public static final String NEW_MESSAGE = "new_message";
    public static final String MESSAGE_DELETED = "message_deleted";

    public static ChannelEvent newMessage(MessageRecord message) {
        return new ChannelEvent(NEW_MESSAGE, MessageView.of(message), null);
    }

    public static ChannelEvent messageDeleted(UUID messageId) {
        return new ChannelEvent(MESSAGE_DELETED, null, messageId);
    }
}
