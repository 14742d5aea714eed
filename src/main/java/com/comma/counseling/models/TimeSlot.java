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
public class TimeSlot {
    private UUID id;
    private UUID counselorId;
    private LocalDate date;
    private LocalTime startTime;
    private LocalTime endTime;
    @Builder.Default
    private boolean available = true;
    private boolean booked;
    private UUID generatedFromScheduleId;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Half-open interval overlap: [start, end) against [otherStart, otherEnd).
     */
    public boolean overlaps(LocalTime otherStart, LocalTime otherEnd) {
        return startTime.isBefore(otherEnd) && otherStart.isBefore(endTime);
    }

    public boolean matches(LocalDate date, LocalTime startTime, LocalTime endTime) {
        return this.date.equals(date) && this.startTime.equals(startTime) && this.endTime.equals(endTime);
    }
}
