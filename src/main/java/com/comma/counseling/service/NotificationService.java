package com.comma.counseling.service;

import com.comma.counseling.dto.NotificationMessage;
import com.comma.counseling.models.NotificationKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Fire-and-forget notification sink. Publishing failures are logged and never
 * reach the caller: a lost notification must not undo a booking or a transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final RabbitTemplate rabbitTemplate;
    private final Clock clock;

    @Value("${counseling.notifications.exchange:counseling.notifications}")
    private String exchange;

    public void notify(UUID recipientId, NotificationKind kind, Map<String, Object> payload) {
        if (recipientId == null) {
            log.warn("Dropping {} notification without recipient", kind);
            return;
        }
        NotificationMessage message = NotificationMessage.builder()
                .recipientId(recipientId)
                .kind(kind)
                .payload(payload)
                .createdAt(clock.instant())
                .build();
        try {
            rabbitTemplate.convertAndSend(exchange, kind.routingKey(), message);
            log.debug("Published {} notification for {}", kind, recipientId);
        } catch (Exception e) {
            log.error("Failed to publish {} notification for {}: {}", kind, recipientId, e.getMessage());
        }
    }
}
