package com.delta.warmup.placement.persistence;

import com.delta.warmup.placement.model.ScheduledEntry;
import com.delta.warmup.placement.model.ScheduledEntryStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
@ConditionalOnProperty(prefix = "warmup.persistence", name = "mode", havingValue = "jdbc", matchIfMissing = true)
public class JdbcScheduleStore implements ScheduleStore {
    private static final RowMapper<ScheduledEntry> ROW_MAPPER = (rs, rowNum) -> new ScheduledEntry(
        rs.getString("id"),
        rs.getString("domain_id"),
        rs.getTimestamp("scheduled_for").toInstant(),
        ScheduledEntryStatus.valueOf(rs.getString("status")),
        rs.getString("placement_test_id"),
        rs.getString("last_error"),
        rs.getTimestamp("created_at").toInstant()
    );

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcScheduleStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public ScheduledEntry get(String id) {
        List<ScheduledEntry> results = jdbc.query(
            """
                SELECT id, domain_id, scheduled_for, status, placement_test_id, last_error, created_at
                FROM scheduled_tests
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            ROW_MAPPER
        );
        return results.isEmpty() ? null : results.get(0);
    }

    @Override
    public void set(ScheduledEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", entry.id())
            .addValue("domainId", entry.domainId())
            .addValue("scheduledFor", Timestamp.from(entry.scheduledFor()))
            .addValue("status", entry.status().name())
            .addValue("placementTestId", entry.placementTestId())
            .addValue("lastError", entry.lastError())
            .addValue("createdAt", Timestamp.from(entry.createdAt()));
        int updated = jdbc.update(
            """
                UPDATE scheduled_tests
                SET scheduled_for = :scheduledFor,
                    status = :status,
                    placement_test_id = :placementTestId,
                    last_error = :lastError
                WHERE id = :id
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO scheduled_tests (
                        id, domain_id, scheduled_for, status, placement_test_id, last_error, created_at
                    ) VALUES (
                        :id, :domainId, :scheduledFor, :status, :placementTestId, :lastError, :createdAt
                    )
                    """,
                params
            );
        }
    }

    @Override
    public boolean delete(String id) {
        return jdbc.update("DELETE FROM scheduled_tests WHERE id = :id", new MapSqlParameterSource("id", id)) > 0;
    }

    @Override
    public List<ScheduledEntry> listByStatus(ScheduledEntryStatus status) {
        return jdbc.query(
            """
                SELECT id, domain_id, scheduled_for, status, placement_test_id, last_error, created_at
                FROM scheduled_tests
                WHERE status = :status
                ORDER BY scheduled_for ASC
                """,
            new MapSqlParameterSource("status", status.name()),
            ROW_MAPPER
        );
    }
}
