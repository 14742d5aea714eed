package com.comma.counseling.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Writes privileged session actions to the {@code audit} logger.
 */
@Slf4j(topic = "audit")
@Service
public class AuditService {

    public void success(UUID actorId, String action, UUID sessionId) {
        log.info("actor={} action={} session={} outcome=success", actorId, action, sessionId);
    }

    public void rejected(UUID actorId, String action, UUID sessionId, String reason) {
        log.warn("actor={} action={} session={} outcome=rejected reason=\"{}\"", actorId, action, sessionId, reason);
    }
}
