package com.comma.counseling.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Identity record as returned by the identity service.
 * {@code role} is one of {@code user}, {@code counselor}, or a staff role that may not chat.
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantDto {
    private UUID id;
    private String displayName;
    private String role;
    private boolean active;
}
