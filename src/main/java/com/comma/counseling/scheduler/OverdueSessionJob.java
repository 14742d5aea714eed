package com.comma.counseling.scheduler;

import com.comma.counseling.exceptions.InvalidTransitionException;
import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.SessionStatus;
import com.comma.counseling.repo.ChatSessionJDBCRepository;
import com.comma.counseling.service.sessions.SessionLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Closes sessions nobody closed: pending ones never started within the grace period
 * are cancelled, active ones running past their scheduled end are completed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OverdueSessionJob {

    private final ChatSessionJDBCRepository sessionRepo;
    private final SessionLifecycleService lifecycleService;
    private final Clock clock;

    @Value("${counseling.scheduler.pending-grace-minutes:15}")
    private long pendingGraceMinutes = 15;

    @Value("${counseling.scheduler.active-grace-minutes:30}")
    private long activeGraceMinutes = 30;

    @Scheduled(cron = "${counseling.scheduler.overdue-cron:0 */5 * * * *}",
            zone = "${counseling.time-zone:UTC}")
    public void sweep() {
        LocalDateTime now = LocalDateTime.now(clock);
        cancelUnstarted(now);
        completeOverrun(now);
    }

    void cancelUnstarted(LocalDateTime now) {
        Duration grace = Duration.ofMinutes(pendingGraceMinutes);
        LocalDateTime cutoff = now.minus(grace);
        for (ChatSession session : sessionRepo.findByStatusScheduledOnOrBefore(SessionStatus.PENDING, now.toLocalDate())) {
            if (!session.scheduledStart().isBefore(cutoff)) {
                continue;
            }
            try {
                lifecycleService.autoCancel(session.getId(), grace);
                log.info("Auto-cancelled session {} scheduled at {}", session.getId(), session.scheduledStart());
            } catch (InvalidTransitionException e) {
                log.info("Session {} already moved on: {}", session.getId(), e.getMessage());
            } catch (Exception e) {
                log.error("Auto-cancel failed for session {}: {}", session.getId(), e.getMessage(), e);
            }
        }
    }

    void completeOverrun(LocalDateTime now) {
        Duration grace = Duration.ofMinutes(activeGraceMinutes);
        LocalDateTime cutoff = now.minus(grace);
        for (ChatSession session : sessionRepo.findByStatusScheduledOnOrBefore(SessionStatus.ACTIVE, now.toLocalDate())) {
            if (!session.scheduledEnd().isBefore(cutoff)) {
                continue;
            }
            try {
                lifecycleService.autoComplete(session.getId(), grace);
                log.info("Auto-completed session {} scheduled to end at {}", session.getId(), session.scheduledEnd());
            } catch (InvalidTransitionException e) {
                log.info("Session {} already moved on: {}", session.getId(), e.getMessage());
            } catch (Exception e) {
                log.error("Auto-complete failed for session {}: {}", session.getId(), e.getMessage(), e);
            }
        }
    }
}
