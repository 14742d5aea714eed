package com.comma.counseling.client;

import com.comma.counseling.dto.ParticipantDto;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.util.UUID;

@FeignClient(name = "identity", url = "${identity.base-url:http://identity:8081}")
@CircuitBreaker(name = "identity")
public interface IdentityClient {

    @GetMapping("/internal/counseling/participants/{participantId}")
    ParticipantDto getParticipant(@PathVariable UUID participantId);
}
