package com.comma.counseling.repo;

import com.comma.counseling.models.Message;
import com.comma.counseling.models.ParticipantKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class MessageJDBCRepository {

    private final JdbcTemplate jdbc;

    // Inserts only while the owning session is still open, so a message can never
    // land on a session that the scheduler closed a moment earlier.
    private static final String SQL_INSERT_IF_SESSION_OPEN = """
        INSERT INTO messages (id, session_id, sender_id, sender_type, content, created_at)
        SELECT gen_random_uuid(), s.id, ?, ?, ?, ?
          FROM chat_sessions s
         WHERE s.id = ?
           AND s.status IN ('pending', 'active')
        RETURNING id, session_id, sender_id, sender_type, content, created_at
        """;

    private static final String SQL_FIND_BY_SESSION = """
        SELECT id, session_id, sender_id, sender_type, content, created_at
          FROM messages
         WHERE session_id = ?
         ORDER BY seq
         LIMIT ? OFFSET ?
        """;

    /**
     * @return the stored message, or empty when the session is not open for messages
     */
    public Optional<Message> insertIfSessionOpen(Message message) {
        List<Message> rows = jdbc.query(SQL_INSERT_IF_SESSION_OPEN, new MessageRowMapper(),
                message.getSenderId(),
                message.getSenderKind().code(),
                message.getContent(),
                Timestamp.from(message.getCreatedAt()),
                message.getSessionId());
        return rows.stream().findFirst();
    }

    public List<Message> findBySessionId(UUID sessionId, int skip, int limit) {
        return jdbc.query(SQL_FIND_BY_SESSION, new MessageRowMapper(), sessionId, limit, skip);
    }

    private static class MessageRowMapper implements RowMapper<Message> {
        @Override
        public Message mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Message.builder()
                    .id(rs.getObject("id", UUID.class))
                    .sessionId(rs.getObject("session_id", UUID.class))
                    .senderId(rs.getObject("sender_id", UUID.class))
                    .senderKind(ParticipantKind.fromCode(rs.getString("sender_type")))
                    .content(rs.getString("content"))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .build();
        }

        private static Instant toInstant(Timestamp ts) {
            return ts == null ? null : ts.toInstant();
        }
    }
}
