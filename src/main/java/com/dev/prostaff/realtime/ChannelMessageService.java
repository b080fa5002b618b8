package com.dev.prostaff.realtime;

import com.dev.prostaff.security.Identity;
import com.dev.prostaff.store.MessageRecord;
import com.dev.prostaff.store.MessageStore;
import com.dev.prostaff.tenant.TenantMismatchException;
import com.dev.prostaff.tenant.TenantScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ChannelMessageService {

    private final ChannelAuthorizer channelAuthorizer;
    private final StreamBindingRegistry bindings;
    private final MessageStore messageStore;
    private final SimpMessagingTemplate messagingTemplate;

    public ChannelMessageService(ChannelAuthorizer channelAuthorizer,
                                 StreamBindingRegistry bindings,
                                 MessageStore messageStore,
                                 SimpMessagingTemplate messagingTemplate) {
        this.channelAuthorizer = channelAuthorizer;
        this.bindings = bindings;
        this.messageStore = messageStore;
        this.messagingTemplate = messagingTemplate;
    }

    public MessageRecord send(String sessionId, Identity identity, ChannelRequest request, String content) {
        AuthorizedSend send = channelAuthorizer.authorizeSend(identity, request, content);
        if (!bindings.isBound(sessionId, send.streamKey())) {
            log.warn("[Cable] user={} sent to {} without a subscription", identity.userId(), send.streamKey());
            throw new SubscriptionRejectedException("Not subscribed to this channel");
        }

        MessageRecord stored;
        try (TenantScope scope = TenantScope.open(identity)) {
            stored = messageStore.create(scope.context(), send.content(), identity.userId(),
                    send.recipientId(), identity.organizationId());
        } catch (DataAccessException | TenantMismatchException e) {
            log.error("[Cable] Failed to create message for user={}: {}", identity.userId(), e.getMessage());
            throw new ContentRejectedException("Failed to send message");
        }

        messagingTemplate.convertAndSend(ChannelDestinations.streamDestination(send.streamKey()),
                ChannelEvent.newMessage(stored));
        return stored;
    }

    public void broadcastDeletion(MessageRecord message) {
        messagingTemplate.convertAndSend(ChannelDestinations.streamDestination(streamOf(message)),
                ChannelEvent.messageDeleted(message.id()));
    }

    static StreamKey streamOf(MessageRecord message) {
        return message.isDirect()
                ? StreamKey.direct(message.senderId(), message.recipientId(), message.organizationId())
                : StreamKey.team(message.organizationId());
    }
}
