package com.comma.counseling.dto;

import com.comma.counseling.models.TimeRange;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkSlotRequest {
    @NotNull
    private LocalDate startDate;
    @NotNull
    private LocalDate endDate;
    @NotEmpty
    @Valid
    private List<Range> timeSlots;
    private List<LocalDate> excludeDates;

    public List<TimeRange> toTimeRanges() {
        return timeSlots.stream().map(r -> new TimeRange(r.getStartTime(), r.getEndTime())).toList();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Range {
        @NotNull
        private LocalTime startTime;
        @NotNull
        private LocalTime endTime;
    }
}
