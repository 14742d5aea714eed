package com.comma.counseling.dto.events;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outbound envelope: {@code {type, data, timestamp}}. The timestamp is stamped at emission.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServerEvent {
    private EventType type;
    private Object data;
    private Instant timestamp;

    public static ServerEvent of(EventType type, Object data, Instant timestamp) {
        return new ServerEvent(type, data, timestamp);
    }
}
