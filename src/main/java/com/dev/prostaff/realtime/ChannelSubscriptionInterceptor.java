package com.dev.prostaff.realtime;

import com.dev.prostaff.security.Identity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ChannelSubscriptionInterceptor implements ChannelInterceptor {

    private final ChannelAuthorizer channelAuthorizer;
    private final StreamBindingRegistry bindings;

    public ChannelSubscriptionInterceptor(ChannelAuthorizer channelAuthorizer, StreamBindingRegistry bindings) {
        this.channelAuthorizer = channelAuthorizer;
        this.bindings = bindings;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
        StompCommand command = accessor.getCommand();
        if (command == StompCommand.SUBSCRIBE) {
            return subscribe(message, accessor);
        }
        if (command == StompCommand.SEND) {
            requireApplicationDestination(accessor.getDestination());
        } else if (command == StompCommand.UNSUBSCRIBE) {
            bindings.unbind(accessor.getSessionId(), accessor.getSubscriptionId());
        }
        return message;
    }

    private Message<?> subscribe(Message<?> message, StompHeaderAccessor accessor) {
        String destination = accessor.getDestination();
        if (ChannelDestinations.ERRORS.equals(destination)) {
            return message;
        }
        Identity identity = ConnectionAttributes.identityOf(accessor.getSessionAttributes())
                .orElseThrow(() -> new SubscriptionRejectedException("Connection is not authenticated"));
        ChannelRequest request = ChannelDestinations.parse(destination)
                .orElseThrow(() -> {
                    log.warn("[Cable] user={} tried to subscribe to {}", identity.userId(), destination);
                    return new SubscriptionRejectedException("Unknown channel");
                });

        StreamKey streamKey = channelAuthorizer.authorizeSubscription(identity, request);
        bindings.bind(accessor.getSessionId(), accessor.getSubscriptionId(), streamKey);
        log.info("[Cable] user={} subscribed to {}", identity.userId(), streamKey);

        accessor.setDestination(ChannelDestinations.streamDestination(streamKey));
        return MessageBuilder.createMessage(message.getPayload(), accessor.getMessageHeaders());
    }

    private static void requireApplicationDestination(String destination) {
        if (destination == null || !destination.startsWith(ChannelDestinations.APPLICATION_PREFIX + "/")) {
            throw new SubscriptionRejectedException("Clients may only send to application destinations");
        }
    }
}
