package com.comma.counseling.repo;

import com.comma.counseling.models.TimeSlot;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class TimeSlotJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        id, counselor_id, slot_date, start_time, end_time, is_available, is_booked,
        generated_from_schedule_id, created_at, updated_at
        """;

    private static final String SQL_INSERT = """
        INSERT INTO time_slots
        (id, counselor_id, slot_date, start_time, end_time, is_available, is_booked,
         generated_from_schedule_id, created_at)
        VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, false, ?, ?)
        RETURNING\s""" + COLUMNS;

    private static final String SQL_FIND_BY_ID = "SELECT " + COLUMNS + " FROM time_slots WHERE id = ?";

    private static final String SQL_FIND_OVERLAPPING = "SELECT " + COLUMNS + """
         FROM time_slots
        WHERE counselor_id = ?
          AND slot_date = ?
          AND start_time < ?
          AND end_time > ?
        ORDER BY start_time
        """;

    private static final String SQL_EXISTS_AT_START = """
        SELECT COUNT(*) FROM time_slots WHERE counselor_id = ? AND slot_date = ? AND start_time = ?
        """;

    private static final String SQL_FIND_RANGE = "SELECT " + COLUMNS + """
         FROM time_slots
        WHERE counselor_id = ?
          AND slot_date BETWEEN ? AND ?
          AND (? OR is_booked = false)
        ORDER BY slot_date, start_time
        """;

    private static final String SQL_FIND_AVAILABLE = "SELECT " + COLUMNS + """
         FROM time_slots
        WHERE counselor_id = ?
          AND slot_date = ?
          AND is_available = true
          AND is_booked = false
        ORDER BY start_time
        """;

    private static final String SQL_BOOK = """
        UPDATE time_slots
           SET is_booked = true, updated_at = ?
         WHERE id = ?
           AND counselor_id = ?
           AND slot_date = ?
           AND start_time = ?
           AND end_time = ?
           AND is_available = true
           AND is_booked = false
        """;

    private static final String SQL_RELEASE = """
        UPDATE time_slots SET is_booked = false, updated_at = ? WHERE id = ?
        """;

    public TimeSlot insert(TimeSlot slot, Instant now) {
        return jdbc.queryForObject(SQL_INSERT, new TimeSlotRowMapper(),
                slot.getCounselorId(),
                slot.getDate(),
                slot.getStartTime(),
                slot.getEndTime(),
                slot.isAvailable(),
                slot.getGeneratedFromScheduleId(),
                Timestamp.from(now));
    }

    public Optional<TimeSlot> findById(UUID slotId) {
        return jdbc.query(SQL_FIND_BY_ID, new TimeSlotRowMapper(), slotId).stream().findFirst();
    }

    public List<TimeSlot> findOverlapping(UUID counselorId, LocalDate date, LocalTime start, LocalTime end) {
        return jdbc.query(SQL_FIND_OVERLAPPING, new TimeSlotRowMapper(), counselorId, date, end, start);
    }

    public boolean existsAtStart(UUID counselorId, LocalDate date, LocalTime start) {
        Integer count = jdbc.queryForObject(SQL_EXISTS_AT_START, Integer.class, counselorId, date, start);
        return count != null && count > 0;
    }

    public List<TimeSlot> findByCounselorBetween(UUID counselorId, LocalDate from, LocalDate to, boolean includeBooked) {
        return jdbc.query(SQL_FIND_RANGE, new TimeSlotRowMapper(), counselorId, from, to, includeBooked);
    }

    public List<TimeSlot> findAvailable(UUID counselorId, LocalDate date) {
        return jdbc.query(SQL_FIND_AVAILABLE, new TimeSlotRowMapper(), counselorId, date);
    }

    /**
     * Books the slot only if it still matches the requested schedule and nobody booked it in between.
     */
    public boolean book(TimeSlot expected, Instant now) {
        return jdbc.update(SQL_BOOK,
                Timestamp.from(now),
                expected.getId(),
                expected.getCounselorId(),
                expected.getDate(),
                expected.getStartTime(),
                expected.getEndTime()) == 1;
    }

    public boolean release(UUID slotId, Instant now) {
        return jdbc.update(SQL_RELEASE, Timestamp.from(now), slotId) == 1;
    }

    private static class TimeSlotRowMapper implements RowMapper<TimeSlot> {
        @Override
        public TimeSlot mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp updated = rs.getTimestamp("updated_at");
            return TimeSlot.builder()
                    .id(rs.getObject("id", UUID.class))
                    .counselorId(rs.getObject("counselor_id", UUID.class))
                    .date(rs.getObject("slot_date", LocalDate.class))
                    .startTime(rs.getObject("start_time", LocalTime.class))
                    .endTime(rs.getObject("end_time", LocalTime.class))
                    .available(rs.getBoolean("is_available"))
                    .booked(rs.getBoolean("is_booked"))
                    .generatedFromScheduleId(rs.getObject("generated_from_schedule_id", UUID.class))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(updated == null ? null : updated.toInstant())
                    .build();
        }
    }
}
