package com.comma.counseling.ws;

import com.comma.counseling.dto.events.EventType;
import com.comma.counseling.dto.events.ParticipantPresence;
import com.comma.counseling.dto.events.PresenceData;
import com.comma.counseling.dto.events.ServerEvent;
import com.comma.counseling.models.ParticipantKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory rooms of live connections, keyed by session id.
 * <p>
 * Room membership and the connection index only change inside {@code compute} on the
 * room key, and each room value is an immutable list, so readers always see a
 * consistent snapshot without locking. Sends run outside the room update through a
 * {@link ConcurrentWebSocketSessionDecorator}; a recipient whose send fails is evicted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final ObjectMapper json;
    private final Clock clock;

    private final ConcurrentMap<UUID, List<Connection>> rooms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();

    @Value("${counseling.ws.send-time-limit-ms:5000}")
    private int sendTimeLimitMs = 5000;

    @Value("${counseling.ws.buffer-size-limit-bytes:524288}")
    private int bufferSizeLimit = 512 * 1024;

    /**
     * Adds the handle to the room and tells the other members. Joining twice with the
     * same handle returns the existing connection and announces nothing.
     */
    public Connection join(UUID sessionId, UUID participantId, ParticipantKind kind, WebSocketSession handle) {
        Connection existing = connections.get(handle.getId());
        if (existing != null) {
            return existing;
        }

        Connection candidate = new Connection(handle.getId(), sessionId, participantId, kind,
                new ConcurrentWebSocketSessionDecorator(handle, sendTimeLimitMs, bufferSizeLimit),
                clock.instant());

        // index and room change together so a failed send can always find the connection to evict
        AtomicReference<Connection> registered = new AtomicReference<>();
        rooms.compute(sessionId, (id, room) -> {
            Connection previous = connections.putIfAbsent(candidate.getConnectionId(), candidate);
            if (previous != null) {
                registered.set(previous);
                return room;
            }
            registered.set(candidate);
            List<Connection> next = room == null ? new ArrayList<>() : new ArrayList<>(room);
            next.add(candidate);
            return List.copyOf(next);
        });
        if (registered.get() != candidate) {
            return registered.get();
        }
        log.info("WebSocket connected: {} {} to session {}", kind.code(), participantId, sessionId);

        broadcast(sessionId, presenceEvent(EventType.USER_JOINED, candidate, "joined"), handle);
        return candidate;
    }

    /**
     * Removes the handle and tells the remaining members. Unknown or already removed
     * handles are ignored.
     */
    public void leave(WebSocketSession handle) {
        Connection connection = connections.get(handle.getId());
        if (connection == null) {
            return;
        }

        UUID sessionId = connection.getSessionId();
        AtomicBoolean removed = new AtomicBoolean();
        rooms.compute(sessionId, (id, room) -> {
            if (!connections.remove(connection.getConnectionId(), connection)) {
                return room;
            }
            removed.set(true);
            if (room == null) {
                return null;
            }
            List<Connection> next = new ArrayList<>(room);
            next.removeIf(c -> c.getConnectionId().equals(connection.getConnectionId()));
            return next.isEmpty() ? null : List.copyOf(next);
        });
        if (!removed.get()) {
            return;
        }
        log.info("WebSocket disconnected: {} {} from session {}",
                connection.getKind().code(), connection.getParticipantId(), sessionId);

        broadcast(sessionId, presenceEvent(EventType.USER_LEFT, connection, "left"), null);
    }

    /**
     * Sends to every member of the room except {@code exclude}. Never throws; members
     * that cannot be reached are evicted.
     */
    public void broadcast(UUID sessionId, ServerEvent event, WebSocketSession exclude) {
        List<Connection> room = rooms.get(sessionId);
        if (room == null) {
            return;
        }
        TextMessage frame = serialize(event);
        if (frame == null) {
            return;
        }
        String excludedId = exclude == null ? null : exclude.getId();
        for (Connection connection : room) {
            if (!connection.getConnectionId().equals(excludedId)) {
                deliver(connection, frame);
            }
        }
    }

    public void sendToParticipant(UUID sessionId, UUID participantId, ServerEvent event) {
        List<Connection> room = rooms.get(sessionId);
        if (room == null) {
            return;
        }
        TextMessage frame = serialize(event);
        if (frame == null) {
            return;
        }
        for (Connection connection : room) {
            if (connection.getParticipantId().equals(participantId)) {
                deliver(connection, frame);
            }
        }
    }

    /**
     * Sends to one handle, registered or not. Used for the connect handshake and
     * for error replies.
     */
    public void send(WebSocketSession handle, ServerEvent event) {
        TextMessage frame = serialize(event);
        if (frame == null) {
            return;
        }
        Connection connection = connections.get(handle.getId());
        if (connection != null) {
            deliver(connection, frame);
            return;
        }
        try {
            handle.sendMessage(frame);
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send {} to unregistered socket {}: {}", event.getType(), handle.getId(), e.getMessage());
        }
    }

    public List<ParticipantPresence> listParticipants(UUID sessionId) {
        List<Connection> room = rooms.getOrDefault(sessionId, List.of());
        return room.stream()
                .map(c -> new ParticipantPresence(c.getParticipantId(), c.getKind(), c.getConnectedAt()))
                .toList();
    }

    public boolean isActive(UUID sessionId) {
        return rooms.containsKey(sessionId);
    }

    private void deliver(Connection connection, TextMessage frame) {
        try {
            connection.getHandle().sendMessage(frame);
        } catch (IOException | RuntimeException e) {
            log.warn("Evicting socket {} of {} in session {}: {}", connection.getConnectionId(),
                    connection.getParticipantId(), connection.getSessionId(), e.getMessage());
            leave(connection.getHandle());
        }
    }

    private TextMessage serialize(ServerEvent event) {
        try {
            return new TextMessage(json.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event: {}", event.getType(), e.getMessage());
            return null;
        }
    }

    private ServerEvent presenceEvent(EventType type, Connection connection, String verb) {
        String name = connection.getKind().code();
        String label = name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
        PresenceData data = new PresenceData(connection.getParticipantId(), connection.getKind(),
                label + " " + verb + " the session");
        return ServerEvent.of(type, data, clock.instant());
    }
}
