package com.comma.counseling.dto;

import com.comma.counseling.models.CounselorSchedule;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {
    @NotNull
    @Size(max = 100)
    private String name;
    private String description;
    @NotEmpty
    private Set<DayOfWeek> daysOfWeek;
    @NotNull
    private LocalTime startTime;
    @NotNull
    private LocalTime endTime;
    @Min(1)
    private int sessionDurationMinutes = 50;
    @Min(0)
    private int breakDurationMinutes = 10;
    @NotNull
    private LocalDate effectiveFrom;
    private LocalDate effectiveUntil;

    public CounselorSchedule toSchedule(UUID counselorId) {
        return CounselorSchedule.builder()
                .counselorId(counselorId)
                .name(name)
                .description(description)
                .daysOfWeek(daysOfWeek)
                .startTime(startTime)
                .endTime(endTime)
                .sessionDurationMinutes(sessionDurationMinutes)
                .breakDurationMinutes(breakDurationMinutes)
                .effectiveFrom(effectiveFrom)
                .effectiveUntil(effectiveUntil)
                .build();
    }
}
