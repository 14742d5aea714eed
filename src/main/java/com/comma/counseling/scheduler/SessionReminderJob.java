package com.comma.counseling.scheduler;

import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.NotificationKind;
import com.comma.counseling.repo.ChatSessionJDBCRepository;
import com.comma.counseling.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Reminds both participants shortly before a pending session starts. Each session
 * is reminded at most once: the reminder is claimed on the row before anything is sent.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionReminderJob {

    private final ChatSessionJDBCRepository sessionRepo;
    private final NotificationService notificationService;
    private final Clock clock;

    @Value("${counseling.scheduler.reminder-lead-minutes:10}")
    private long leadMinutes = 10;

    @Value("${counseling.scheduler.reminder-tolerance-seconds:30}")
    private long toleranceSeconds = 30;

    @Scheduled(cron = "${counseling.scheduler.reminder-cron:0 * * * * *}",
            zone = "${counseling.time-zone:UTC}")
    public void sendReminders() {
        LocalDateTime target = LocalDateTime.now(clock).plusMinutes(leadMinutes);
        LocalDateTime from = target.minusSeconds(toleranceSeconds);
        LocalDateTime to = target.plusSeconds(toleranceSeconds);

        int sent = 0;
        for (ChatSession session : sessionRepo.findReminderCandidates(from.toLocalDate(), to.toLocalDate())) {
            LocalDateTime start = session.scheduledStart();
            if (start.isBefore(from) || start.isAfter(to)) {
                continue;
            }
            try {
                if (!sessionRepo.claimReminder(session.getId(), clock.instant())) {
                    log.debug("Reminder for session {} already claimed", session.getId());
                    continue;
                }
                Map<String, Object> payload = Map.of(
                        "session_id", session.getId(),
                        "scheduled_start", start.toString(),
                        "minutes_until_start", leadMinutes);
                notificationService.notify(session.getUserId(), NotificationKind.SESSION_REMINDER, payload);
                notificationService.notify(session.getCounselorId(), NotificationKind.SESSION_REMINDER, payload);
                sent++;
            } catch (Exception e) {
                log.error("Reminder failed for session {}: {}", session.getId(), e.getMessage(), e);
            }
        }
        if (sent > 0) {
            log.info("Sent {} session reminders", sent);
        }
    }
}
