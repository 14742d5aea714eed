package com.comma.counseling.dto;

import com.comma.counseling.models.NotificationKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationMessage {
    private UUID recipientId;
    private NotificationKind kind;
    private Map<String, Object> payload;
    private Instant createdAt;
}
