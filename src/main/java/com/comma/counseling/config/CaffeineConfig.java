package com.comma.counseling.config;

import com.comma.counseling.dto.ParticipantDto;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

@Configuration
public class CaffeineConfig {

    // short expiry: a deactivated account must stop connecting quickly
    @Bean
    public Cache<UUID, ParticipantDto> participantCache(
            @Value("${counseling.identity.cache-seconds:60}") long cacheSeconds) {
        return Caffeine.newBuilder()
                .expireAfterWrite(cacheSeconds, TimeUnit.SECONDS)
                .maximumSize(50_000)
                .build();
    }
}
