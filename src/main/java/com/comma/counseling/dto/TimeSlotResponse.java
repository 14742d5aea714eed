package com.comma.counseling.dto;

import com.comma.counseling.models.TimeSlot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeSlotResponse {
    private UUID id;
    private UUID counselorId;
    private LocalDate date;
    private LocalTime startTime;
    private LocalTime endTime;
    private boolean available;
    private boolean booked;

    public static TimeSlotResponse from(TimeSlot slot) {
        return TimeSlotResponse.builder()
                .id(slot.getId())
                .counselorId(slot.getCounselorId())
                .date(slot.getDate())
                .startTime(slot.getStartTime())
                .endTime(slot.getEndTime())
                .available(slot.isAvailable())
                .booked(slot.isBooked())
                .build();
    }
}
