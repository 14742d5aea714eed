package com.comma.counseling.repo;

import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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

/**
 * Session rows. Every status change goes through a conditional update on the
 * expected prior status; callers treat zero affected rows as a lost race.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ChatSessionJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        id, user_id, counselor_id, time_slot_id, status, scheduled_date, scheduled_start_time,
        scheduled_end_time, actual_start_time, actual_end_time, duration, category, description,
        counselor_notes, user_feedback, rating, reminder_sent_at, created_at, updated_at
        """;

    private static final String SQL_INSERT = """
        INSERT INTO chat_sessions
        (id, user_id, counselor_id, time_slot_id, status, scheduled_date, scheduled_start_time,
         scheduled_end_time, category, description, created_at, updated_at)
        VALUES (gen_random_uuid(), ?, ?, ?, 'pending', ?, ?, ?, ?, ?, ?, ?)
        RETURNING\s""" + COLUMNS;

    private static final String SQL_FIND_BY_ID = "SELECT " + COLUMNS + " FROM chat_sessions WHERE id = ?";

    private static final String SQL_FIND_BY_USER = "SELECT " + COLUMNS + """
         FROM chat_sessions
        WHERE user_id = ?
          AND (CAST(? AS TEXT) IS NULL OR status = ?)
        ORDER BY scheduled_date DESC, scheduled_start_time DESC
        LIMIT ? OFFSET ?
        """;

    private static final String SQL_FIND_BY_COUNSELOR = "SELECT " + COLUMNS + """
         FROM chat_sessions
        WHERE counselor_id = ?
          AND (CAST(? AS TEXT) IS NULL OR status = ?)
        ORDER BY scheduled_date DESC, scheduled_start_time DESC
        LIMIT ? OFFSET ?
        """;

    private static final String SQL_FIND_BY_STATUS_ON_OR_BEFORE = "SELECT " + COLUMNS + """
         FROM chat_sessions
        WHERE status = ?
          AND scheduled_date <= ?
        ORDER BY scheduled_date, scheduled_start_time
        """;

    private static final String SQL_FIND_REMINDER_CANDIDATES = "SELECT " + COLUMNS + """
         FROM chat_sessions
        WHERE status = 'pending'
          AND reminder_sent_at IS NULL
          AND scheduled_date BETWEEN ? AND ?
        ORDER BY scheduled_date, scheduled_start_time
        """;

    private static final String SQL_MARK_STARTED = """
        UPDATE chat_sessions
           SET status = 'active', actual_start_time = ?, updated_at = ?
         WHERE id = ? AND status = 'pending'
        """;

    private static final String SQL_MARK_COMPLETED = """
        UPDATE chat_sessions
           SET status = 'completed', actual_end_time = ?, duration = ?, counselor_notes = ?, updated_at = ?
         WHERE id = ? AND status = 'active'
        """;

    private static final String SQL_MARK_CANCELLED = """
        UPDATE chat_sessions
           SET status = 'cancelled', counselor_notes = ?, updated_at = ?
         WHERE id = ? AND status = 'pending'
        """;

    private static final String SQL_CLAIM_REMINDER = """
        UPDATE chat_sessions
           SET reminder_sent_at = ?
         WHERE id = ? AND reminder_sent_at IS NULL AND status = 'pending'
        """;

    private static final String SQL_SAVE_FEEDBACK = """
        UPDATE chat_sessions
           SET rating = ?, user_feedback = ?, updated_at = ?
         WHERE id = ? AND user_id = ? AND status = 'completed'
        """;

    public ChatSession insert(ChatSession session, Instant now) {
        return jdbc.queryForObject(SQL_INSERT, new ChatSessionRowMapper(),
                session.getUserId(),
                session.getCounselorId(),
                session.getTimeSlotId(),
                session.getScheduledDate(),
                session.getScheduledStartTime(),
                session.getScheduledEndTime(),
                session.getCategory(),
                session.getDescription(),
                Timestamp.from(now),
                Timestamp.from(now));
    }

    public Optional<ChatSession> findById(UUID sessionId) {
        return jdbc.query(SQL_FIND_BY_ID, new ChatSessionRowMapper(), sessionId)
                .stream().findFirst();
    }

    public List<ChatSession> findByUserId(UUID userId, SessionStatus status, int skip, int limit) {
        String code = status == null ? null : status.code();
        return jdbc.query(SQL_FIND_BY_USER, new ChatSessionRowMapper(), userId, code, code, limit, skip);
    }

    public List<ChatSession> findByCounselorId(UUID counselorId, SessionStatus status, int skip, int limit) {
        String code = status == null ? null : status.code();
        return jdbc.query(SQL_FIND_BY_COUNSELOR, new ChatSessionRowMapper(), counselorId, code, code, limit, skip);
    }

    public List<ChatSession> findByStatusScheduledOnOrBefore(SessionStatus status, LocalDate date) {
        return jdbc.query(SQL_FIND_BY_STATUS_ON_OR_BEFORE, new ChatSessionRowMapper(), status.code(), date);
    }

    public List<ChatSession> findReminderCandidates(LocalDate from, LocalDate to) {
        return jdbc.query(SQL_FIND_REMINDER_CANDIDATES, new ChatSessionRowMapper(), from, to);
    }

    public boolean markStarted(UUID sessionId, Instant startedAt) {
        return jdbc.update(SQL_MARK_STARTED, Timestamp.from(startedAt), Timestamp.from(startedAt), sessionId) == 1;
    }

    public boolean markCompleted(UUID sessionId, Instant endedAt, int durationMinutes, String notes, Instant now) {
        return jdbc.update(SQL_MARK_COMPLETED,
                Timestamp.from(endedAt), durationMinutes, notes, Timestamp.from(now), sessionId) == 1;
    }

    public boolean markCancelled(UUID sessionId, String notes, Instant now) {
        return jdbc.update(SQL_MARK_CANCELLED, notes, Timestamp.from(now), sessionId) == 1;
    }

    /**
     * Claims the reminder for a session. Only the first caller gets {@code true}.
     */
    public boolean claimReminder(UUID sessionId, Instant at) {
        return jdbc.update(SQL_CLAIM_REMINDER, Timestamp.from(at), sessionId) == 1;
    }

    public boolean saveFeedback(UUID sessionId, UUID userId, int rating, String feedback, Instant now) {
        return jdbc.update(SQL_SAVE_FEEDBACK, rating, feedback, Timestamp.from(now), sessionId, userId) == 1;
    }

    private static class ChatSessionRowMapper implements RowMapper<ChatSession> {
        @Override
        public ChatSession mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ChatSession.builder()
                    .id(rs.getObject("id", UUID.class))
                    .userId(rs.getObject("user_id", UUID.class))
                    .counselorId(rs.getObject("counselor_id", UUID.class))
                    .timeSlotId(rs.getObject("time_slot_id", UUID.class))
                    .status(SessionStatus.fromCode(rs.getString("status")))
                    .scheduledDate(rs.getObject("scheduled_date", LocalDate.class))
                    .scheduledStartTime(rs.getObject("scheduled_start_time", LocalTime.class))
                    .scheduledEndTime(rs.getObject("scheduled_end_time", LocalTime.class))
                    .actualStartTime(toInstant(rs.getTimestamp("actual_start_time")))
                    .actualEndTime(toInstant(rs.getTimestamp("actual_end_time")))
                    .duration((Integer) rs.getObject("duration"))
                    .category(rs.getString("category"))
                    .description(rs.getString("description"))
                    .counselorNotes(rs.getString("counselor_notes"))
                    .userFeedback(rs.getString("user_feedback"))
                    .rating((Integer) rs.getObject("rating"))
                    .reminderSentAt(toInstant(rs.getTimestamp("reminder_sent_at")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }

        private static Instant toInstant(Timestamp ts) {
            return ts == null ? null : ts.toInstant();
        }
    }
}
