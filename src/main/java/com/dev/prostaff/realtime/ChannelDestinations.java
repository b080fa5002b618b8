package com.dev.prostaff.realtime;

import java.util.Optional;
import java.util.UUID;

public final class ChannelDestinations {

    public static final String TEAM = "/channels/team";
    public static final String DIRECT_PREFIX = "/channels/direct/";
    public static final String ERRORS = "/user/queue/errors";
    public static final String STREAM_PREFIX = "/topic/streams/";
    public static final String APPLICATION_PREFIX = "/app";

    private ChannelDestinations() {
        // utility class
    }

    public static Optional<ChannelRequest> parse(String destination) {
        if (destination == null) {
            return Optional.empty();
        }
        if (TEAM.equals(destination)) {
            return Optional.of(ChannelRequest.team());
        }
        if (destination.startsWith(DIRECT_PREFIX)) {
            return Optional.of(ChannelRequest.direct(parseRecipient(destination.substring(DIRECT_PREFIX.length()))));
        }
        return Optional.empty();
    }

    public static UUID parseRecipient(String recipientId) {
        if (recipientId == null || recipientId.isBlank()) {
            throw new SubscriptionRejectedException("Recipient id is required");
        }
        try {
            return UUID.fromString(recipientId.strip());
        } catch (IllegalArgumentException e) {
            throw new SubscriptionRejectedException("Invalid recipient id");
        }
    }

    public static String streamDestination(StreamKey key) {
        return STREAM_PREFIX + key.value();
    }
}
