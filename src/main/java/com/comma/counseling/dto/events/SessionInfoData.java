package com.comma.counseling.dto.events;

import com.comma.counseling.models.SessionStatus;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class SessionInfoData {
    UUID sessionId;
    SessionStatus status;
    List<ParticipantPresence> participants;
    String message;
}
