package com.comma.counseling.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CounselorProfile {
    private UUID counselorId;
    private String displayName;
    private boolean active;
    private boolean acceptingSessions;
    private int totalSessions;
}
