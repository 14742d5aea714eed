package com.comma.counseling.scheduler;

import com.comma.counseling.models.CounselorSchedule;
import com.comma.counseling.models.TimeSlot;
import com.comma.counseling.service.slots.TimeSlotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Materializes tomorrow's bookable slots from the active schedule rules.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SlotGenerationJob {

    private final TimeSlotService slotService;
    private final Clock clock;

    @Scheduled(cron = "${counseling.scheduler.slot-generation-cron:0 0 0 * * *}",
            zone = "${counseling.time-zone:UTC}")
    public void generateTomorrow() {
        generateFor(LocalDate.now(clock).plusDays(1));
    }

    int generateFor(LocalDate date) {
        List<CounselorSchedule> schedules;
        try {
            schedules = slotService.activeSchedulesOn(date);
        } catch (Exception e) {
            log.error("Slot generation for {} could not load schedules: {}", date, e.getMessage(), e);
            return 0;
        }

        int total = 0;
        for (CounselorSchedule schedule : schedules) {
            try {
                List<TimeSlot> generated = slotService.generateFromSchedule(schedule, date);
                total += generated.size();
                if (!generated.isEmpty()) {
                    log.info("Generated {} slots for counselor {} on {}", generated.size(), schedule.getCounselorId(), date);
                }
            } catch (Exception e) {
                log.error("Slot generation failed for schedule {}: {}", schedule.getId(), e.getMessage(), e);
            }
        }
        log.info("Slot generation for {} done: {} slots from {} schedules", date, total, schedules.size());
        return total;
    }
}
