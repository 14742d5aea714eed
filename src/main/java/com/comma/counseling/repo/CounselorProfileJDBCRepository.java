package com.comma.counseling.repo;

import com.comma.counseling.models.CounselorProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class CounselorProfileJDBCRepository {

    private final JdbcTemplate jdbc;

    private static final String SQL_FIND_BY_COUNSELOR = """
        SELECT counselor_id, display_name, is_active, is_available, total_sessions
          FROM counselor_profiles
         WHERE counselor_id = ?
        """;

    private static final String SQL_INCREMENT_SESSIONS = """
        UPDATE counselor_profiles SET total_sessions = total_sessions + 1 WHERE counselor_id = ?
        """;

    public Optional<CounselorProfile> findByCounselorId(UUID counselorId) {
        return jdbc.query(SQL_FIND_BY_COUNSELOR, (rs, i) -> CounselorProfile.builder()
                        .counselorId(rs.getObject("counselor_id", UUID.class))
                        .displayName(rs.getString("display_name"))
                        .active(rs.getBoolean("is_active"))
                        .acceptingSessions(rs.getBoolean("is_available"))
                        .totalSessions(rs.getInt("total_sessions"))
                        .build(), counselorId)
                .stream().findFirst();
    }

    public void incrementTotalSessions(UUID counselorId) {
        jdbc.update(SQL_INCREMENT_SESSIONS, counselorId);
    }
}
