package com.comma.counseling.service.booking;

import com.comma.counseling.dto.BookSessionRequest;
import com.comma.counseling.exceptions.ConflictException;
import com.comma.counseling.exceptions.NotFoundException;
import com.comma.counseling.exceptions.UnavailableException;
import com.comma.counseling.exceptions.ValidationException;
import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.CounselorProfile;
import com.comma.counseling.models.NotificationKind;
import com.comma.counseling.models.TimeSlot;
import com.comma.counseling.repo.ChatSessionJDBCRepository;
import com.comma.counseling.repo.CounselorProfileJDBCRepository;
import com.comma.counseling.repo.TimeSlotJDBCRepository;
import com.comma.counseling.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final CounselorProfileJDBCRepository counselorRepo;
    private final TimeSlotJDBCRepository slotRepo;
    private final ChatSessionJDBCRepository sessionRepo;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * Creates a pending session. When a slot is given it is booked in the same
     * transaction: either both rows change or neither does.
     */
    @Transactional
    public ChatSession book(UUID userId, BookSessionRequest request) {
        if (!request.getEndTime().isAfter(request.getStartTime())) {
            throw new ValidationException("End time must be after start time");
        }

        CounselorProfile counselor = counselorRepo.findByCounselorId(request.getCounselorId())
                .filter(CounselorProfile::isActive)
                .orElseThrow(() -> new NotFoundException("Counselor not found"));
        if (!counselor.isAcceptingSessions()) {
            throw new UnavailableException("Counselor is not available");
        }

        Instant now = clock.instant();
        TimeSlot slot = null;
        if (request.getTimeSlotId() != null) {
            slot = slotRepo.findById(request.getTimeSlotId())
                    .filter(s -> s.getCounselorId().equals(request.getCounselorId()))
                    .filter(s -> s.isAvailable() && !s.isBooked())
                    .orElseThrow(() -> new ConflictException("Time slot not available"));
            if (!slot.matches(request.getScheduledDate(), request.getStartTime(), request.getEndTime())) {
                throw new ConflictException("Scheduled time does not match time slot");
            }
        }

        ChatSession session = sessionRepo.insert(ChatSession.builder()
                .userId(userId)
                .counselorId(request.getCounselorId())
                .timeSlotId(request.getTimeSlotId())
                .scheduledDate(request.getScheduledDate())
                .scheduledStartTime(request.getStartTime())
                .scheduledEndTime(request.getEndTime())
                .category(request.getCategory())
                .description(request.getDescription())
                .build(), now);

        // a concurrent booking of the same slot loses here and rolls back its session insert
        if (slot != null && !slotRepo.book(slot, now)) {
            throw new ConflictException("Time slot not available");
        }

        log.info("Session {} booked by user {} with counselor {} for {} {}",
                session.getId(), userId, request.getCounselorId(), request.getScheduledDate(), request.getStartTime());

        notificationService.notify(userId, NotificationKind.SESSION_BOOKED, Map.of(
                "session_id", session.getId(),
                "counselor_name", counselor.getDisplayName(),
                "scheduled_start", session.scheduledStart().toString()));
        return session;
    }
}
