package com.comma.counseling.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {
    private UUID id;
    private UUID sessionId;
    private UUID senderId;
    private ParticipantKind senderKind;
    private String content;
    private Instant createdAt;
}
