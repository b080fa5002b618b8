package com.dev.prostaff.realtime;

import java.util.UUID;

public record AuthorizedSend(StreamKey streamKey, String content, UUID recipientId) {
}
