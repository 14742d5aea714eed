package com.comma.counseling.dto;

import com.comma.counseling.models.Message;
import com.comma.counseling.models.ParticipantKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageResponse {

    private UUID id;
    private UUID sessionId;
    private UUID senderId;
    private ParticipantKind senderType;
    private String content;
    private Instant createdAt;

    public static MessageResponse from(Message message) {
        return MessageResponse.builder()
                .id(message.getId())
                .sessionId(message.getSessionId())
                .senderId(message.getSenderId())
                .senderType(message.getSenderKind())
                .content(message.getContent())
                .createdAt(message.getCreatedAt())
                .build();
    }
}
