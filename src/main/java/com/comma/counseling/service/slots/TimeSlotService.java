package com.comma.counseling.service.slots;

import com.comma.counseling.exceptions.ConflictException;
import com.comma.counseling.exceptions.ValidationException;
import com.comma.counseling.models.CounselorSchedule;
import com.comma.counseling.models.CounselorUnavailability;
import com.comma.counseling.models.TimeRange;
import com.comma.counseling.models.TimeSlot;
import com.comma.counseling.repo.CounselorScheduleJDBCRepository;
import com.comma.counseling.repo.CounselorUnavailabilityJDBCRepository;
import com.comma.counseling.repo.TimeSlotJDBCRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class TimeSlotService {

    private final TimeSlotJDBCRepository slotRepo;
    private final CounselorScheduleJDBCRepository scheduleRepo;
    private final CounselorUnavailabilityJDBCRepository unavailabilityRepo;
    private final Clock clock;

    /**
     * Creates one slot. Rejects overlaps with existing slots on the same day and
     * any window the counselor marked as unavailable.
     */
    public TimeSlot createSlot(UUID counselorId, LocalDate date, LocalTime start, LocalTime end, boolean available) {
        validateRange(start, end);

        List<TimeSlot> overlapping = slotRepo.findOverlapping(counselorId, date, start, end);
        if (!overlapping.isEmpty()) {
            TimeSlot existing = overlapping.get(0);
            throw new ConflictException("Time slot conflicts with existing slot from "
                    + existing.getStartTime() + " to " + existing.getEndTime());
        }

        for (CounselorUnavailability u : unavailabilityRepo.findCovering(counselorId, date)) {
            if (u.blocks(start, end)) {
                throw new ConflictException(u.isAllDay()
                        ? "Counselor is unavailable all day: " + u.getReason()
                        : "Counselor is unavailable during this time: " + u.getReason());
            }
        }

        TimeSlot slot = TimeSlot.builder()
                .counselorId(counselorId)
                .date(date)
                .startTime(start)
                .endTime(end)
                .available(available)
                .build();
        return slotRepo.insert(slot, clock.instant());
    }

    /**
     * Creates the given time ranges on every date in [from, to] except the excluded ones.
     * Conflicting candidates are skipped so one clash does not sink the whole batch.
     */
    public List<TimeSlot> bulkCreate(UUID counselorId, LocalDate from, LocalDate to,
                                     List<TimeRange> timeRanges, Collection<LocalDate> excludeDates) {
        if (to.isBefore(from)) {
            throw new ValidationException("End date must not be before start date");
        }
        Set<LocalDate> excluded = excludeDates == null ? Set.of() : Set.copyOf(excludeDates);

        List<TimeSlot> created = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            if (excluded.contains(day)) continue;
            for (TimeRange range : timeRanges) {
                try {
                    created.add(createSlot(counselorId, day, range.getStart(), range.getEnd(), true));
                } catch (ConflictException e) {
                    log.info("Skipping slot on {} {}-{}: {}", day, range.getStart(), range.getEnd(), e.getMessage());
                }
            }
        }
        return created;
    }

    @Transactional(readOnly = true)
    public List<TimeSlot> listAvailable(UUID counselorId, LocalDate date) {
        return slotRepo.findAvailable(counselorId, date);
    }

    @Transactional(readOnly = true)
    public List<TimeSlot> listSlots(UUID counselorId, LocalDate from, LocalDate to, boolean includeBooked) {
        if (to.isBefore(from)) {
            throw new ValidationException("End date must not be before start date");
        }
        return slotRepo.findByCounselorBetween(counselorId, from, to, includeBooked);
    }

    public CounselorSchedule createSchedule(CounselorSchedule schedule) {
        validateRange(schedule.getStartTime(), schedule.getEndTime());
        if (schedule.getDaysOfWeek() == null || schedule.getDaysOfWeek().isEmpty()) {
            throw new ValidationException("Schedule must recur on at least one weekday");
        }
        if (schedule.getSessionDurationMinutes() <= 0 || schedule.getBreakDurationMinutes() < 0) {
            throw new ValidationException("Session duration must be positive and break duration non-negative");
        }
        if (schedule.getEffectiveUntil() != null && schedule.getEffectiveUntil().isBefore(schedule.getEffectiveFrom())) {
            throw new ValidationException("Effective until must not be before effective from");
        }
        return scheduleRepo.insert(schedule, clock.instant());
    }

    public CounselorUnavailability createUnavailability(CounselorUnavailability unavailability) {
        if (unavailability.getEndDate().isBefore(unavailability.getStartDate())) {
            throw new ValidationException("End date must not be before start date");
        }
        if ((unavailability.getStartTime() == null) != (unavailability.getEndTime() == null)) {
            throw new ValidationException("Start and end time must both be set or both be empty");
        }
        if (!unavailability.isAllDay()) {
            validateRange(unavailability.getStartTime(), unavailability.getEndTime());
        }
        return unavailabilityRepo.insert(unavailability, clock.instant());
    }

    /**
     * Materializes the slots a schedule rule defines for {@code date}. Returns an empty
     * list when the rule does not apply that day or the counselor is unavailable.
     */
    public List<TimeSlot> generateFromSchedule(CounselorSchedule schedule, LocalDate date) {
        if (!schedule.isActive() || !schedule.isEffectiveOn(date) || !schedule.recursOn(date)) {
            return List.of();
        }
        if (!unavailabilityRepo.findCovering(schedule.getCounselorId(), date).isEmpty()) {
            log.info("Counselor {} unavailable on {}, skipping schedule {}", schedule.getCounselorId(), date, schedule.getId());
            return List.of();
        }

        Instant now = clock.instant();
        List<TimeSlot> generated = new ArrayList<>();
        LocalDateTime dayEnd = LocalDateTime.of(date, schedule.getEndTime());
        LocalDateTime cursor = LocalDateTime.of(date, schedule.getStartTime());

        while (cursor.isBefore(dayEnd)) {
            LocalDateTime slotEnd = cursor.plusMinutes(schedule.getSessionDurationMinutes());
            if (slotEnd.isAfter(dayEnd)) {
                break;
            }

            LocalTime start = cursor.toLocalTime();
            if (!slotRepo.existsAtStart(schedule.getCounselorId(), date, start)) {
                TimeSlot slot = TimeSlot.builder()
                        .counselorId(schedule.getCounselorId())
                        .date(date)
                        .startTime(start)
                        .endTime(slotEnd.toLocalTime())
                        .available(true)
                        .generatedFromScheduleId(schedule.getId())
                        .build();
                generated.add(slotRepo.insert(slot, now));
            }

            cursor = cursor.plusMinutes(schedule.getSessionDurationMinutes() + schedule.getBreakDurationMinutes());
        }
        return generated;
    }

    @Transactional(readOnly = true)
    public List<CounselorSchedule> activeSchedulesOn(LocalDate date) {
        return scheduleRepo.findActiveEffectiveOn(date);
    }

    private void validateRange(LocalTime start, LocalTime end) {
        if (start == null || end == null || !end.isAfter(start)) {
            throw new ValidationException("End time must be after start time");
        }
    }
}
