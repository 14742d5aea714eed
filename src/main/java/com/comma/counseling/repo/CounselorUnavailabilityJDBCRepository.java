package com.comma.counseling.repo;

import com.comma.counseling.models.CounselorUnavailability;
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
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class CounselorUnavailabilityJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        id, counselor_id, schedule_id, start_date, end_date, start_time, end_time, reason, notes, created_at
        """;

    private static final String SQL_INSERT = """
        INSERT INTO counselor_unavailabilities
        (id, counselor_id, schedule_id, start_date, end_date, start_time, end_time, reason, notes, created_at)
        VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING\s""" + COLUMNS;

    private static final String SQL_FIND_COVERING = "SELECT " + COLUMNS + """
         FROM counselor_unavailabilities
        WHERE counselor_id = ?
          AND start_date <= ?
          AND end_date >= ?
        """;

    public CounselorUnavailability insert(CounselorUnavailability u, Instant now) {
        return jdbc.queryForObject(SQL_INSERT, new UnavailabilityRowMapper(),
                u.getCounselorId(),
                u.getScheduleId(),
                u.getStartDate(),
                u.getEndDate(),
                u.getStartTime(),
                u.getEndTime(),
                u.getReason(),
                u.getNotes(),
                Timestamp.from(now));
    }

    public List<CounselorUnavailability> findCovering(UUID counselorId, LocalDate date) {
        return jdbc.query(SQL_FIND_COVERING, new UnavailabilityRowMapper(), counselorId, date, date);
    }

    private static class UnavailabilityRowMapper implements RowMapper<CounselorUnavailability> {
        @Override
        public CounselorUnavailability mapRow(ResultSet rs, int rowNum) throws SQLException {
            return CounselorUnavailability.builder()
                    .id(rs.getObject("id", UUID.class))
                    .counselorId(rs.getObject("counselor_id", UUID.class))
                    .scheduleId(rs.getObject("schedule_id", UUID.class))
                    .startDate(rs.getObject("start_date", LocalDate.class))
                    .endDate(rs.getObject("end_date", LocalDate.class))
                    .startTime(rs.getObject("start_time", LocalTime.class))
                    .endTime(rs.getObject("end_time", LocalTime.class))
                    .reason(rs.getString("reason"))
                    .notes(rs.getString("notes"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .build();
        }
    }
}
