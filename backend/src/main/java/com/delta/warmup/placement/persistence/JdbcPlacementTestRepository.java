package com.delta.warmup.placement.persistence;

import com.delta.warmup.placement.model.PlacementTest;
import com.delta.warmup.placement.model.PlacementTestStatus;
import com.delta.warmup.placement.model.ProviderType;
import com.delta.warmup.placement.model.TestEmailOutcome;
import com.delta.warmup.placement.model.TestSummary;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
@ConditionalOnProperty(prefix = "warmup.persistence", name = "mode", havingValue = "jdbc", matchIfMissing = true)
public class JdbcPlacementTestRepository implements PlacementTestRepository {
    private static final TypeReference<List<TestEmailOutcome>> OUTCOMES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<TestSummary> SUMMARY_TYPE = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final JsonColumnCodec json;
    private final RowMapper<PlacementTest> rowMapper;

    public JdbcPlacementTestRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.json = new JsonColumnCodec(objectMapper);
        this.rowMapper = (rs, rowNum) -> new PlacementTest(
            rs.getString("id"),
            rs.getString("domain_id"),
            rs.getString("owner_id"),
            ProviderType.valueOf(rs.getString("provider")),
            rs.getString("provider_test_id"),
            PlacementTestStatus.valueOf(rs.getString("status")),
            rs.getString("filter_phrase"),
            json.read(rs.getString("outcomes"), OUTCOMES_TYPE),
            json.read(rs.getString("summary"), SUMMARY_TYPE),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    @Override
    public PlacementTest findById(String id) {
        List<PlacementTest> results = jdbc.query(
            """
                SELECT id, domain_id, owner_id, provider, provider_test_id, status, filter_phrase,
                       outcomes, summary, created_at, updated_at
                FROM placement_tests
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            rowMapper
        );
        return results.isEmpty() ? null : results.get(0);
    }

    @Override
    public void save(PlacementTest test) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", test.id())
            .addValue("domainId", test.domainId())
            .addValue("ownerId", test.ownerId())
            .addValue("provider", test.provider().name())
            .addValue("providerTestId", test.providerTestId())
            .addValue("status", test.status().name())
            .addValue("filterPhrase", test.filterPhrase())
            .addValue("outcomes", json.write(test.outcomes()))
            .addValue("summary", json.write(test.summary()))
            .addValue("createdAt", Timestamp.from(test.createdAt()))
            .addValue("updatedAt", Timestamp.from(test.updatedAt()));
        int updated = jdbc.update(
            """
                UPDATE placement_tests
                SET status = :status,
                    provider_test_id = :providerTestId,
                    filter_phrase = :filterPhrase,
                    outcomes = :outcomes,
                    summary = :summary,
                    updated_at = :updatedAt
                WHERE id = :id
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        jdbc.update(
            """
                INSERT INTO placement_tests (
                    id, domain_id, owner_id, provider, provider_test_id, status, filter_phrase,
                    outcomes, summary, created_at, updated_at
                ) VALUES (
                    :id, :domainId, :ownerId, :provider, :providerTestId, :status, :filterPhrase,
                    :outcomes, :summary, :createdAt, :updatedAt
                )
                """,
            params
        );
    }

    @Override
    public int countCreatedSince(String ownerId, Instant since) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM placement_tests
                WHERE owner_id = :ownerId
                  AND created_at >= :since
                """,
            new MapSqlParameterSource()
                .addValue("ownerId", ownerId)
                .addValue("since", Timestamp.from(since)),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    @Override
    public List<PlacementTest> findByStatuses(Collection<PlacementTestStatus> statuses, int limit) {
        if (statuses == null || statuses.isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("statuses", statuses.stream().map(Enum::name).toList())
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT id, domain_id, owner_id, provider, provider_test_id, status, filter_phrase,
                       outcomes, summary, created_at, updated_at
                FROM placement_tests
                WHERE status IN (:statuses)
                ORDER BY created_at ASC
                LIMIT :limit
                """,
            params,
            rowMapper
        );
    }
}
