package com.comma.counseling.dto;

import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.SessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatSessionResponse {
    private UUID sessionId;
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
    private Instant createdAt;

    public static ChatSessionResponse from(ChatSession session) {
        return ChatSessionResponse.builder()
                .sessionId(session.getId())
                .userId(session.getUserId())
                .counselorId(session.getCounselorId())
                .timeSlotId(session.getTimeSlotId())
                .status(session.getStatus())
                .scheduledDate(session.getScheduledDate())
                .scheduledStartTime(session.getScheduledStartTime())
                .scheduledEndTime(session.getScheduledEndTime())
                .actualStartTime(session.getActualStartTime())
                .actualEndTime(session.getActualEndTime())
                .duration(session.getDuration())
                .category(session.getCategory())
                .description(session.getDescription())
                .counselorNotes(session.getCounselorNotes())
                .userFeedback(session.getUserFeedback())
                .rating(session.getRating())
                .createdAt(session.getCreatedAt())
                .build();
    }
}
