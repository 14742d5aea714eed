package com.comma.counseling.ws;

import com.comma.counseling.models.ParticipantKind;
import lombok.Value;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.UUID;

/**
 * One live socket bound to a session room. {@code handle} is already wrapped in a
 * bounded send decorator.
 */
@Value
public class Connection {
    String connectionId;
    UUID sessionId;
    UUID participantId;
    ParticipantKind kind;
    WebSocketSession handle;
    Instant connectedAt;
}
