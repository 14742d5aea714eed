package com.comma.counseling.dto.events;

import com.comma.counseling.models.ParticipantKind;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ParticipantPresence {
    UUID userId;
    ParticipantKind userType;
    Instant connectedAt;
}
