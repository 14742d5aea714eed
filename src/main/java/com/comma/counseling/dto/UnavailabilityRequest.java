package com.comma.counseling.dto;

import com.comma.counseling.models.CounselorUnavailability;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnavailabilityRequest {
    @NotNull
    private LocalDate startDate;
    @NotNull
    private LocalDate endDate;
    private LocalTime startTime;
    private LocalTime endTime;
    @NotNull
    @Size(max = 100)
    private String reason;
    private String notes;

    public CounselorUnavailability toUnavailability(UUID counselorId) {
        return CounselorUnavailability.builder()
                .counselorId(counselorId)
                .startDate(startDate)
                .endDate(endDate)
                .startTime(startTime)
                .endTime(endTime)
                .reason(reason)
                .notes(notes)
                .build();
    }
}
