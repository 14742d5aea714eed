package com.comma.counseling.dto.events;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SessionStartedData {
    UUID sessionId;
    UUID startedBy;
    Instant startedAt;
    String message;
}
