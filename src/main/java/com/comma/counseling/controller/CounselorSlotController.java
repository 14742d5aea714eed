package com.comma.counseling.controller;

import com.comma.counseling.dto.BulkSlotRequest;
import com.comma.counseling.dto.CreateSlotRequest;
import com.comma.counseling.dto.ScheduleRequest;
import com.comma.counseling.dto.TimeSlotResponse;
import com.comma.counseling.dto.UnavailabilityRequest;
import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.models.CounselorSchedule;
import com.comma.counseling.models.CounselorUnavailability;
import com.comma.counseling.models.TimeSlot;
import com.comma.counseling.security.AuthenticatedParticipant;
import com.comma.counseling.service.slots.TimeSlotService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Bookable time management. Reads are open to any participant, writes only to the
 * counselor the slots belong to.
 */
@RestController
@RequestMapping("/api/counselors")
@RequiredArgsConstructor
@Validated
public class CounselorSlotController {

    private final TimeSlotService slotService;

    @GetMapping(value = "/{counselorId}/slots/available", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<TimeSlotResponse>> available(
            @PathVariable UUID counselorId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(toResponses(slotService.listAvailable(counselorId, date)));
    }

    @GetMapping(value = "/me/slots", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<TimeSlotResponse>> mySlots(
            @AuthenticationPrincipal AuthenticatedParticipant caller,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(name = "include_booked", defaultValue = "true") boolean includeBooked) {
        return ResponseEntity.ok(toResponses(slotService.listSlots(counselorOf(caller), from, to, includeBooked)));
    }

    @PostMapping(value = "/me/slots", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TimeSlotResponse> createSlot(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                       @Valid @RequestBody CreateSlotRequest req) {
        TimeSlot slot = slotService.createSlot(counselorOf(caller), req.getDate(), req.getStartTime(),
                req.getEndTime(), req.isAvailable());
        return ResponseEntity.status(HttpStatus.CREATED).body(TimeSlotResponse.from(slot));
    }

    @PostMapping(value = "/me/slots/bulk", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<TimeSlotResponse>> bulkCreate(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                             @Valid @RequestBody BulkSlotRequest req) {
        List<TimeSlot> created = slotService.bulkCreate(counselorOf(caller), req.getStartDate(), req.getEndDate(),
                req.toTimeRanges(), req.getExcludeDates());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponses(created));
    }

    @PostMapping(value = "/me/schedules", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CounselorSchedule> createSchedule(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                            @Valid @RequestBody ScheduleRequest req) {
        CounselorSchedule schedule = slotService.createSchedule(req.toSchedule(counselorOf(caller)));
        return ResponseEntity.status(HttpStatus.CREATED).body(schedule);
    }

    @PostMapping(value = "/me/unavailabilities", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CounselorUnavailability> createUnavailability(
            @AuthenticationPrincipal AuthenticatedParticipant caller,
            @Valid @RequestBody UnavailabilityRequest req) {
        CounselorUnavailability created = slotService.createUnavailability(req.toUnavailability(counselorOf(caller)));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    private UUID counselorOf(AuthenticatedParticipant caller) {
        if (!caller.isCounselor()) {
            throw new ForbiddenException("Only counselors can manage time slots");
        }
        return caller.getId();
    }

    private List<TimeSlotResponse> toResponses(List<TimeSlot> slots) {
        return slots.stream().map(TimeSlotResponse::from).toList();
    }
}
