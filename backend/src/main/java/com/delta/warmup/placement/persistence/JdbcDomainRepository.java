package com.delta.warmup.placement.persistence;

import com.delta.warmup.placement.model.Domain;
import com.delta.warmup.placement.model.DomainStatus;
import com.delta.warmup.placement.model.TestHistoryEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Repository
@ConditionalOnProperty(prefix = "warmup.persistence", name = "mode", havingValue = "jdbc", matchIfMissing = true)
public class JdbcDomainRepository implements DomainRepository {
    private static final TypeReference<List<TestHistoryEntry>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumnCodec json;
    private final RowMapper<Domain> rowMapper;
    private final Clock clock;

    public JdbcDomainRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
        this.json = new JsonColumnCodec(objectMapper);
        this.rowMapper = (rs, rowNum) -> new Domain(
            rs.getString("id"),
            rs.getString("owner_id"),
            rs.getString("name"),
            DomainStatus.valueOf(rs.getString("status")),
            rs.getInt("daily_send_volume"),
            rs.getInt("max_send_volume"),
            toInstant(rs.getTimestamp("last_test_at")),
            toInstant(rs.getTimestamp("next_test_at")),
            toInstant(rs.getTimestamp("volume_adjusted_at")),
            json.read(rs.getString("test_history"), HISTORY_TYPE)
        );
    }

    @Override
    public Domain findById(String id) {
        List<Domain> results = jdbc.query(
            """
                SELECT id, owner_id, name, status, daily_send_volume, max_send_volume,
                       last_test_at, next_test_at, volume_adjusted_at, test_history
                FROM placement_domains
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return results.isEmpty() ? null : results.get(0);
    }

    @Override
    public List<Domain> findByOwner(String ownerId) {
        return jdbc.query(
            """
                SELECT id, owner_id, name, status, daily_send_volume, max_send_volume,
                       last_test_at, next_test_at, volume_adjusted_at, test_history
                FROM placement_domains
                WHERE owner_id = :ownerId
                ORDER BY name ASC
                """,
            new MapSqlParameterSource("ownerId", ownerId),
            rowMapper
        );
    }

    @Override
    public List<Domain> findDueForTesting(Instant now, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("inactive", DomainStatus.INACTIVE.name())
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id, owner_id, name, status, daily_send_volume, max_send_volume,
                       last_test_at, next_test_at, volume_adjusted_at, test_history
                FROM placement_domains
                WHERE status <> :inactive
                  AND next_test_at IS NOT NULL
                  AND next_test_at <= :now
                ORDER BY next_test_at ASC
                LIMIT :limit
                """,
            params,
            rowMapper
        );
    }

    @Override
    public boolean existsByOwnerAndName(String ownerId, String name) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM placement_domains WHERE owner_id = :ownerId AND name = :name",
            new MapSqlParameterSource().addValue("ownerId", ownerId).addValue("name", name),
            Integer.class
        );
        return count != null && count > 0;
    }

    @Override
    public void insert(Domain domain) {
        Instant now = clock.instant();
        jdbc.update(
            """
                INSERT INTO placement_domains (
                    id, owner_id, name, status, daily_send_volume, max_send_volume,
                    last_test_at, next_test_at, volume_adjusted_at, test_history, created_at, updated_at
                ) VALUES (
                    :id, :ownerId, :name, :status, :dailySendVolume, :maxSendVolume,
                    :lastTestAt, :nextTestAt, :volumeAdjustedAt, :testHistory, :now, :now
                )
                """,
            params(domain).addValue("now", Timestamp.from(now))
        );
    }

    @Override
    public void update(Domain domain) {
        int updated = jdbc.update(
            """
                UPDATE placement_domains
                SET status = :status,
                    daily_send_volume = :dailySendVolume,
                    max_send_volume = :maxSendVolume,
                    last_test_at = :lastTestAt,
                    next_test_at = :nextTestAt,
                    volume_adjusted_at = :volumeAdjustedAt,
                    test_history = :testHistory,
                    updated_at = :now
                WHERE id = :id
                """,
            params(domain).addValue("now", Timestamp.from(clock.instant()))
        );
        if (updated == 0) {
            throw new IllegalStateException("Domain " + domain.id() + " does not exist");
        }
    }

    @Override
    public boolean compareAndSetTestTimes(
        String id,
        Instant expectedLastTestAt,
        Instant newLastTestAt,
        Instant newNextTestAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("newLastTestAt", toTimestamp(newLastTestAt))
            .addValue("newNextTestAt", toTimestamp(newNextTestAt))
            .addValue("now", Timestamp.from(clock.instant()));
        String guard;
        if (expectedLastTestAt == null) {
            guard = "last_test_at IS NULL";
        } else {
            guard = "last_test_at = :expectedLastTestAt";
            params.addValue("expectedLastTestAt", Timestamp.from(expectedLastTestAt));
        }
        int updated = jdbc.update(
            """
                UPDATE placement_domains
                SET last_test_at = :newLastTestAt,
                    next_test_at = :newNextTestAt,
                    updated_at = :now
                WHERE id = :id
                  AND """ + guard,
            params
        );
        return updated == 1;
    }

    private MapSqlParameterSource params(Domain domain) {
        return new MapSqlParameterSource()
            .addValue("id", domain.id())
            .addValue("ownerId", domain.ownerId())
            .addValue("name", domain.name())
            .addValue("status", domain.status().name())
            .addValue("dailySendVolume", domain.dailySendVolume())
            .addValue("maxSendVolume", domain.maxSendVolume())
            .addValue("lastTestAt", toTimestamp(domain.lastTestAt()))
            .addValue("nextTestAt", toTimestamp(domain.nextTestAt()))
            .addValue("volumeAdjustedAt", toTimestamp(domain.volumeAdjustedAt()))
            .addValue("testHistory", json.write(domain.testHistory()));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
