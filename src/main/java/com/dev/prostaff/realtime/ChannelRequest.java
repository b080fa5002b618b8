package com.dev.prostaff.realtime;

import java.util.UUID;

public record ChannelRequest(ChannelKind kind, UUID recipientId) {

    public static ChannelRequest team() {
        return new ChannelRequest(ChannelKind.TEAM, null);
    }

    public static ChannelRequest direct(UUID recipientId) {
        return new ChannelRequest(ChannelKind.DIRECT, recipientId);
    }
}
