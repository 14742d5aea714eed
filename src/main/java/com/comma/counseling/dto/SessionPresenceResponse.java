package com.comma.counseling.dto;

import com.comma.counseling.dto.events.ParticipantPresence;
import com.comma.counseling.models.SessionStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionPresenceResponse {
    private UUID sessionId;
    private SessionStatus status;
    private boolean websocketActive;
    private List<ParticipantPresence> activeParticipants;
    private int totalParticipants;
}
