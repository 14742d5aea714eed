package com.comma.counseling.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;
import java.util.UUID;

/**
 * Recurring rule the nightly job expands into {@link TimeSlot}s.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CounselorSchedule {
    private UUID id;
    private UUID counselorId;
    private String name;
    private String description;
    private Set<DayOfWeek> daysOfWeek;
    private LocalTime startTime;
    private LocalTime endTime;
    @Builder.Default
    private int sessionDurationMinutes = 50;
    @Builder.Default
    private int breakDurationMinutes = 10;
    private LocalDate effectiveFrom;
    private LocalDate effectiveUntil;
    @Builder.Default
    private boolean active = true;
    private Instant createdAt;

    public boolean isEffectiveOn(LocalDate date) {
        if (date.isBefore(effectiveFrom)) return false;
        return effectiveUntil == null || !date.isAfter(effectiveUntil);
    }

    public boolean recursOn(LocalDate date) {
        return daysOfWeek != null && daysOfWeek.contains(date.getDayOfWeek());
    }
}
