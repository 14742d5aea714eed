package com.comma.counseling.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
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
public class BookSessionRequest {
    @NotNull
    private UUID counselorId;
    @NotNull
    private LocalDate scheduledDate;
    @NotNull
    private LocalTime startTime;
    @NotNull
    private LocalTime endTime;
    @Size(max = 50)
    private String category;
    @Size(max = 2000)
    private String description;
    private UUID timeSlotId;
}
