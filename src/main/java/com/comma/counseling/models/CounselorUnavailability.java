package com.comma.counseling.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CounselorUnavailability {
    private UUID id;
    private UUID counselorId;
    private UUID scheduleId;
    private LocalDate startDate;
    private LocalDate endDate;
    // both null means the whole day
    private LocalTime startTime;
    private LocalTime endTime;
    private String reason;
    private String notes;
    private Instant createdAt;

    public boolean isAllDay() {
        return startTime == null || endTime == null;
    }

    public boolean blocks(LocalTime slotStart, LocalTime slotEnd) {
        if (isAllDay()) return true;
        return slotStart.isBefore(endTime) && startTime.isBefore(slotEnd);
    }
}
