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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeSlotServiceTest {

    // a Monday
    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);

    @Mock
    private TimeSlotJDBCRepository slotRepo;
    @Mock
    private CounselorScheduleJDBCRepository scheduleRepo;
    @Mock
    private CounselorUnavailabilityJDBCRepository unavailabilityRepo;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T15:00:00Z"), ZoneOffset.UTC);
    private TimeSlotService slotService;
    private final UUID counselorId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        slotService = new TimeSlotService(slotRepo, scheduleRepo, unavailabilityRepo, clock);
    }

    @Test
    @DisplayName("a slot overlapping an existing one is rejected")
    void overlappingSlotRejected() {
        TimeSlot existing = TimeSlot.builder().counselorId(counselorId).date(MONDAY)
                .startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(9, 50)).build();
        when(slotRepo.findOverlapping(counselorId, MONDAY, LocalTime.of(9, 30), LocalTime.of(10, 20)))
                .thenReturn(List.of(existing));

        ConflictException ex = assertThrows(ConflictException.class,
                () -> slotService.createSlot(counselorId, MONDAY, LocalTime.of(9, 30), LocalTime.of(10, 20), true));

        assertEquals("Time slot conflicts with existing slot from 09:00 to 09:50", ex.getMessage());
        verify(slotRepo, never()).insert(any(), any());
    }

    @Test
    @DisplayName("a slot inside an unavailability window is rejected")
    void unavailableWindowRejected() {
        when(slotRepo.findOverlapping(any(), any(), any(), any())).thenReturn(List.of());
        when(unavailabilityRepo.findCovering(counselorId, MONDAY)).thenReturn(List.of(CounselorUnavailability.builder()
                .counselorId(counselorId).startDate(MONDAY).endDate(MONDAY)
                .startTime(LocalTime.of(13, 0)).endTime(LocalTime.of(15, 0)).reason("Workshop").build()));

        assertThrows(ConflictException.class,
                () -> slotService.createSlot(counselorId, MONDAY, LocalTime.of(14, 0), LocalTime.of(14, 50), true));
    }

    @Test
    @DisplayName("end before start is a validation error")
    void invalidRange() {
        assertThrows(ValidationException.class,
                () -> slotService.createSlot(counselorId, MONDAY, LocalTime.of(10, 0), LocalTime.of(9, 0), true));
    }

    @Test
    @DisplayName("bulk creation skips conflicts and excluded dates")
    void bulkCreateSkipsConflicts() {
        LocalDate tuesday = MONDAY.plusDays(1);
        LocalDate wednesday = MONDAY.plusDays(2);
        TimeRange morning = new TimeRange(LocalTime.of(9, 0), LocalTime.of(9, 50));
        TimeSlot clash = TimeSlot.builder().startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(9, 50)).build();

        when(slotRepo.findOverlapping(counselorId, MONDAY, morning.getStart(), morning.getEnd())).thenReturn(List.of(clash));
        when(slotRepo.findOverlapping(counselorId, wednesday, morning.getStart(), morning.getEnd())).thenReturn(List.of());
        when(unavailabilityRepo.findCovering(counselorId, wednesday)).thenReturn(List.of());
        when(slotRepo.insert(any(TimeSlot.class), eq(clock.instant()))).thenAnswer(inv -> inv.getArgument(0));

        List<TimeSlot> created = slotService.bulkCreate(counselorId, MONDAY, wednesday, List.of(morning), List.of(tuesday));

        assertEquals(1, created.size());
        assertEquals(wednesday, created.get(0).getDate());
    }

    @Test
    @DisplayName("generation strides by session plus break and never runs past the end time")
    void generateFromSchedule() {
        CounselorSchedule schedule = schedule(LocalTime.of(9, 0), LocalTime.of(12, 0));
        when(unavailabilityRepo.findCovering(counselorId, MONDAY)).thenReturn(List.of());
        when(slotRepo.existsAtStart(eq(counselorId), eq(MONDAY), any())).thenReturn(false);
        when(slotRepo.insert(any(TimeSlot.class), eq(clock.instant()))).thenAnswer(inv -> inv.getArgument(0));

        List<TimeSlot> slots = slotService.generateFromSchedule(schedule, MONDAY);

        // 09:00, 10:00, 11:00; the next would start at 12:00
        assertEquals(3, slots.size());
        assertEquals(LocalTime.of(9, 0), slots.get(0).getStartTime());
        assertEquals(LocalTime.of(9, 50), slots.get(0).getEndTime());
        assertEquals(LocalTime.of(11, 0), slots.get(2).getStartTime());
        assertEquals(LocalTime.of(11, 50), slots.get(2).getEndTime());
        assertTrue(slots.stream().allMatch(s -> schedule.getId().equals(s.getGeneratedFromScheduleId())));
    }

    @Test
    @DisplayName("a trailing slot that would exceed the end time is not generated")
    void generateStopsBeforeEnd() {
        CounselorSchedule schedule = schedule(LocalTime.of(9, 0), LocalTime.of(11, 30));
        when(unavailabilityRepo.findCovering(counselorId, MONDAY)).thenReturn(List.of());
        when(slotRepo.existsAtStart(eq(counselorId), eq(MONDAY), any())).thenReturn(false);
        when(slotRepo.insert(any(TimeSlot.class), any())).thenAnswer(inv -> inv.getArgument(0));

        List<TimeSlot> slots = slotService.generateFromSchedule(schedule, MONDAY);

        // 11:00-11:50 would run past 11:30
        assertEquals(2, slots.size());
    }

    @Test
    @DisplayName("slots already present at the same start time are skipped")
    void generateSkipsExisting() {
        CounselorSchedule schedule = schedule(LocalTime.of(9, 0), LocalTime.of(11, 0));
        when(unavailabilityRepo.findCovering(counselorId, MONDAY)).thenReturn(List.of());
        when(slotRepo.existsAtStart(counselorId, MONDAY, LocalTime.of(9, 0))).thenReturn(true);
        when(slotRepo.existsAtStart(counselorId, MONDAY, LocalTime.of(10, 0))).thenReturn(false);
        when(slotRepo.insert(any(TimeSlot.class), any())).thenAnswer(inv -> inv.getArgument(0));

        List<TimeSlot> slots = slotService.generateFromSchedule(schedule, MONDAY);

        assertEquals(1, slots.size());
        assertEquals(LocalTime.of(10, 0), slots.get(0).getStartTime());
    }

    @Test
    @DisplayName("nothing is generated on a weekday the rule does not cover or when unavailable")
    void generateRespectsWeekdayAndUnavailability() {
        CounselorSchedule schedule = schedule(LocalTime.of(9, 0), LocalTime.of(12, 0));
        assertTrue(slotService.generateFromSchedule(schedule, MONDAY.plusDays(1)).isEmpty());

        when(unavailabilityRepo.findCovering(counselorId, MONDAY)).thenReturn(List.of(CounselorUnavailability.builder()
                .counselorId(counselorId).startDate(MONDAY).endDate(MONDAY).reason("Leave").build()));
        assertTrue(slotService.generateFromSchedule(schedule, MONDAY).isEmpty());
        verify(slotRepo, never()).insert(any(), any());
    }

    @Test
    @DisplayName("a schedule without weekdays is rejected")
    void scheduleWithoutDays() {
        CounselorSchedule schedule = schedule(LocalTime.of(9, 0), LocalTime.of(12, 0));
        schedule.setDaysOfWeek(Set.of());

        assertThrows(ValidationException.class, () -> slotService.createSchedule(schedule));
        verify(scheduleRepo, never()).insert(any(), any());
    }

    private CounselorSchedule schedule(LocalTime start, LocalTime end) {
        return CounselorSchedule.builder()
                .id(UUID.randomUUID())
                .counselorId(counselorId)
                .name("Weekday mornings")
                .daysOfWeek(Set.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY))
                .startTime(start)
                .endTime(end)
                .effectiveFrom(MONDAY.minusDays(7))
                .build();
    }
}
