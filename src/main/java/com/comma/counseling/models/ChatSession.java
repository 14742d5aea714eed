package com.comma.counseling.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {
    private UUID id;
    private UUID userId;
    private UUID counselorId;
    private UUID timeSlotId;
    private SessionStatus status;
    private LocalDate scheduledDate;
    private LocalTime scheduledStartTime;
    private LocalTime scheduledEndTime;
    private Instant actualStartTime;
    private Instant actualEndTime;
    private Integer duration;
    private String category;
    private String description;
    private String counselorNotes;
    private String userFeedback;
    private Integer rating;
    private Instant reminderSentAt;
    private Instant createdAt;
    private Instant updatedAt;

    public LocalDateTime scheduledStart() {
        return LocalDateTime.of(scheduledDate, scheduledStartTime);
    }

    public LocalDateTime scheduledEnd() {
        return LocalDateTime.of(scheduledDate, scheduledEndTime);
    }

    public boolean isParticipant(UUID participantId) {
        return participantId != null
                && (participantId.equals(userId) || participantId.equals(counselorId));
    }

    /**
     * Resolves the counterpart of {@code participantId}; {@code null} when the id is not a participant.
     */
    public UUID otherParticipant(UUID participantId) {
        if (participantId == null) return null;
        if (participantId.equals(userId)) return counselorId;
        if (participantId.equals(counselorId)) return userId;
        return null;
    }
}
