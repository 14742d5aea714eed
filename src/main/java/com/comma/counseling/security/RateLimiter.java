package com.comma.counseling.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed one-minute window counter per participant.
 */
@Component
public class RateLimiter {

    private final Cache<String, AtomicInteger> limiter = Caffeine.newBuilder()
            .expireAfterWrite(2, TimeUnit.MINUTES)
            .build();

    private final Clock clock;

    @Value("${counseling.ws.messages-per-minute:20}")
    private int messagesPerMinute = 20;

    public RateLimiter(Clock clock) {
        this.clock = clock;
    }

    public boolean allow(UUID participantId) {
        String minuteKey = participantId + ":" + (clock.millis() / 60000);

        // get(key, mappingFunction) is atomic
        AtomicInteger count = limiter.get(minuteKey, k -> new AtomicInteger(0));
        return count.incrementAndGet() <= messagesPerMinute;
    }
}
