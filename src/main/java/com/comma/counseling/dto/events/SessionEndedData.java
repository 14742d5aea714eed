package com.comma.counseling.dto.events;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SessionEndedData {
    UUID sessionId;
    UUID endedBy;
    Instant endedAt;
    Integer duration;
    String message;
}
