package com.dev.prostaff.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Slf4j
@Component
public class StreamBindingRegistry {

    // sessionId -> (subscriptionId -> stream)
    private final ConcurrentMap<String, ConcurrentMap<String, StreamKey>> bindings = new ConcurrentHashMap<>();

    public void bind(String sessionId, String subscriptionId, StreamKey streamKey) {
        bindings.computeIfAbsent(sessionId, id -> new ConcurrentHashMap<>()).put(subscriptionId, streamKey);
    }

    public void unbind(String sessionId, String subscriptionId) {
        if (sessionId == null || subscriptionId == null) {
            return;
        }
        bindings.computeIfPresent(sessionId, (id, streams) -> {
            streams.remove(subscriptionId);
            return streams.isEmpty() ? null : streams;
        });
    }

    public void release(String sessionId) {
        Map<String, StreamKey> released = bindings.remove(sessionId);
        if (released != null) {
            log.debug("Released {} stream bindings of session {}", released.size(), sessionId);
        }
    }

    public boolean isBound(String sessionId, StreamKey streamKey) {
        Map<String, StreamKey> streams = bindings.get(sessionId);
        return streams != null && streams.containsValue(streamKey);
    }

    public Set<StreamKey> streamsOf(String sessionId) {
        Map<String, StreamKey> streams = bindings.get(sessionId);
        return streams == null ? Set.of() : Set.copyOf(streams.values());
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        release(event.getSessionId());
    }
}
