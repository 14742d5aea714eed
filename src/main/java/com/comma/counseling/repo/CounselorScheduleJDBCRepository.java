package com.comma.counseling.repo;

import com.comma.counseling.models.CounselorSchedule;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class CounselorScheduleJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        id, counselor_id, name, description, days_of_week, start_time, end_time,
        session_duration_minutes, break_duration_minutes, effective_from, effective_until,
        is_active, created_at
        """;

    private static final String SQL_INSERT = """
        INSERT INTO counselor_schedules
        (id, counselor_id, name, description, days_of_week, start_time, end_time,
         session_duration_minutes, break_duration_minutes, effective_from, effective_until,
         is_active, created_at)
        VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, true, ?)
        RETURNING\s""" + COLUMNS;

    private static final String SQL_FIND_ACTIVE_EFFECTIVE_ON = "SELECT " + COLUMNS + """
         FROM counselor_schedules
        WHERE is_active = true
          AND effective_from <= ?
          AND (effective_until IS NULL OR effective_until >= ?)
        """;

    private static final String SQL_FIND_BY_COUNSELOR = "SELECT " + COLUMNS + """
         FROM counselor_schedules
        WHERE counselor_id = ?
        ORDER BY created_at
        """;

    public CounselorSchedule insert(CounselorSchedule schedule, Instant now) {
        return jdbc.queryForObject(SQL_INSERT, new CounselorScheduleRowMapper(),
                schedule.getCounselorId(),
                schedule.getName(),
                schedule.getDescription(),
                encodeDays(schedule.getDaysOfWeek()),
                schedule.getStartTime(),
                schedule.getEndTime(),
                schedule.getSessionDurationMinutes(),
                schedule.getBreakDurationMinutes(),
                schedule.getEffectiveFrom(),
                schedule.getEffectiveUntil(),
                Timestamp.from(now));
    }

    public List<CounselorSchedule> findActiveEffectiveOn(LocalDate date) {
        return jdbc.query(SQL_FIND_ACTIVE_EFFECTIVE_ON, new CounselorScheduleRowMapper(), date, date);
    }

    public List<CounselorSchedule> findByCounselorId(UUID counselorId) {
        return jdbc.query(SQL_FIND_BY_COUNSELOR, new CounselorScheduleRowMapper(), counselorId);
    }

    // ISO day numbers, 1 = Monday
    static String encodeDays(Set<DayOfWeek> days) {
        return days.stream()
                .sorted()
                .map(d -> String.valueOf(d.getValue()))
                .collect(Collectors.joining(","));
    }

    static Set<DayOfWeek> decodeDays(String csv) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (csv == null || csv.isBlank()) return days;
        Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> DayOfWeek.of(Integer.parseInt(s)))
                .forEach(days::add);
        return days;
    }

    private static class CounselorScheduleRowMapper implements RowMapper<CounselorSchedule> {
        @Override
        public CounselorSchedule mapRow(ResultSet rs, int rowNum) throws SQLException {
            return CounselorSchedule.builder()
                    .id(rs.getObject("id", UUID.class))
                    .counselorId(rs.getObject("counselor_id", UUID.class))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .daysOfWeek(decodeDays(rs.getString("days_of_week")))
                    .startTime(rs.getObject("start_time", LocalTime.class))
                    .endTime(rs.getObject("end_time", LocalTime.class))
                    .sessionDurationMinutes(rs.getInt("session_duration_minutes"))
                    .breakDurationMinutes(rs.getInt("break_duration_minutes"))
                    .effectiveFrom(rs.getObject("effective_from", LocalDate.class))
                    .effectiveUntil(rs.getObject("effective_until", LocalDate.class))
                    .active(rs.getBoolean("is_active"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
