package com.dev.prostaff.realtime;

import com.dev.prostaff.domain.Message;
import com.dev.prostaff.security.Identity;
import com.dev.prostaff.store.UserRecord;
import com.dev.prostaff.store.UserStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
public class ChannelAuthorizer {

    public static final int MAX_CONTENT_LENGTH = Message.MAX_CONTENT_LENGTH;

    private final UserStore userStore;

    public ChannelAuthorizer(UserStore userStore) {
        this.userStore = userStore;
    }

    public StreamKey authorizeSubscription(Identity identity, ChannelRequest request) {
        return switch (request.kind()) {
            case TEAM -> teamStream(identity);
            case DIRECT -> directStream(identity, resolveRecipient(identity, request.recipientId()));
        };
    }

    public AuthorizedSend authorizeSend(Identity identity, ChannelRequest request, String content) {
        String normalized = validateContent(content);
        return switch (request.kind()) {
            case TEAM -> new AuthorizedSend(teamStream(identity), normalized, null);
            case DIRECT -> {
                UserRecord recipient = resolveRecipient(identity, request.recipientId());
                yield new AuthorizedSend(directStream(identity, recipient), normalized, recipient.id());
            }
        };
    }

    static String validateContent(String content) {
        String normalized = content == null ? "" : content.strip();
        if (normalized.isEmpty()) {
            throw new ContentRejectedException("Message content cannot be blank");
        }
        if (normalized.codePointCount(0, normalized.length()) > MAX_CONTENT_LENGTH) {
            throw new ContentRejectedException("Message exceeds " + MAX_CONTENT_LENGTH + " characters");
        }
        return normalized;
    }

    private StreamKey teamStream(Identity identity) {
        if (identity.organizationId() == null) {
            log.warn("[TeamChannel] Rejected: no organization for user {}", identity.userId());
            throw new SubscriptionRejectedException("No organization for this user");
        }
        return StreamKey.team(identity.organizationId());
    }

    private StreamKey directStream(Identity identity, UserRecord recipient) {
        return StreamKey.direct(identity.userId(), recipient.id(), identity.organizationId());
    }

    private UserRecord resolveRecipient(Identity identity, UUID recipientId) {
        if (recipientId == null) {
            log.warn("[DM] Rejected: no recipient id from user {}", identity.userId());
            throw new SubscriptionRejectedException("Recipient id is required");
        }
        if (identity.organizationId() == null) {
            log.warn("[DM] Rejected: no organization for user {}", identity.userId());
            throw new SubscriptionRejectedException("No organization for this user");
        }
        UserRecord recipient = userStore.findById(recipientId)
                .filter(user -> user.belongsTo(identity.organizationId()))
                .orElseThrow(() -> {
                    log.warn("[DM] Recipient {} not found in org {}", recipientId, identity.organizationId());
                    return new SubscriptionRejectedException("Recipient not found in your organization");
                });
        if (recipient.id().equals(identity.userId())) {
            log.warn("[DM] User {} tried to message themselves", identity.userId());
            throw new SubscriptionRejectedException("Cannot send direct messages to yourself");
        }
        return recipient;
    }
}
