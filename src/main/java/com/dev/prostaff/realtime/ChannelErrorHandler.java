package com.dev.prostaff.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.util.MimeTypeUtils;
import org.springframework.web.socket.messaging.StompSubProtocolErrorHandler;

@Slf4j
public class ChannelErrorHandler extends StompSubProtocolErrorHandler {

    private final ObjectMapper objectMapper;

    public ChannelErrorHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Message<byte[]> handleClientMessageProcessingError(Message<byte[]> clientMessage, Throwable ex) {
        RuntimeException rejection = findRejection(ex);
        if (rejection == null) {
            return super.handleClientMessageProcessingError(clientMessage, ex);
        }
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(new ErrorPayload(rejection.getMessage()));
        } catch (JsonProcessingException e) {
            log.error("Failed to render channel error: {}", e.getMessage());
            return super.handleClientMessageProcessingError(clientMessage, ex);
        }
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.ERROR);
        accessor.setMessage(rejection.getMessage());
        accessor.setContentType(MimeTypeUtils.APPLICATION_JSON);
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(body, accessor.getMessageHeaders());
    }

    static RuntimeException findRejection(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof SubscriptionRejectedException || current instanceof ContentRejectedException) {
                return (RuntimeException) current;
            }
        }
        return null;
    }
}
