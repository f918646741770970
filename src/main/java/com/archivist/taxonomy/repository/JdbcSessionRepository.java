package com.archivist.taxonomy.repository;

import com.archivist.taxonomy.exception.SessionNotFoundException;
import com.archivist.taxonomy.model.ImportSession;
import com.archivist.taxonomy.model.PipelineProgress;
import com.archivist.taxonomy.model.PipelineStatus;
import com.archivist.taxonomy.model.StageStats;
import com.archivist.taxonomy.model.StatusTransition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class JdbcSessionRepository implements SessionRepository {

    private static final TypeReference<Map<String, StageStats>> STATS_TYPE = new TypeReference<>() {};

    private static final String SESSION_COLUMNS = """
        id, total_documents, pipeline_status, pipeline_started_at, pipeline_stage_started_at,
        pipeline_completed_at, pipeline_error, pipeline_stats::text AS pipeline_stats,
        pipeline_progress::text AS pipeline_progress, pending_batch_handles, created_at, updated_at
        """;

    private final JdbcClient jdbcClient;

    private final ObjectMapper objectMapper;

    private final RowMapper<ImportSession> sessionRowMapper = (rs, rowNum) -> new ImportSession(
        rs.getObject("id", UUID.class),
        rs.getInt("total_documents"),
        PipelineStatus.fromDbValue(rs.getString("pipeline_status")),
        rs.getObject("pipeline_started_at", OffsetDateTime.class),
        rs.getObject("pipeline_stage_started_at", OffsetDateTime.class),
        rs.getObject("pipeline_completed_at", OffsetDateTime.class),
        rs.getString("pipeline_error"),
        readStats(rs.getString("pipeline_stats")),
        readProgress(rs.getString("pipeline_progress")),
        toStrings(rs.getArray("pending_batch_handles")),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public ImportSession create(int totalDocuments) {
        return jdbcClient.sql("""
                INSERT INTO legacy_import_sessions (total_documents)
                VALUES (:totalDocuments)
                RETURNING\s""" + SESSION_COLUMNS)
            .param("totalDocuments", totalDocuments)
            .query(sessionRowMapper)
            .single();
    }

    @Override
    public Optional<ImportSession> findById(UUID id) {
        return jdbcClient.sql("SELECT " + SESSION_COLUMNS + " FROM legacy_import_sessions WHERE id = :id")
            .param("id", id)
            .query(sessionRowMapper)
            .optional();
    }

    @Override
    public boolean updateSessionStatus(UUID sessionId, StatusTransition transition) {
        PipelineStatus to = transition.to();
        boolean completes = to == PipelineStatus.READY_FOR_VALIDATION || to == PipelineStatus.COMPLETED;
        boolean fails = to == PipelineStatus.FAILED;

        String sql = """
            UPDATE legacy_import_sessions
            SET pipeline_status = CAST(:to AS pipeline_status),
                pipeline_started_at = CASE WHEN :startsRun THEN NOW() ELSE pipeline_started_at END,
                pipeline_stage_started_at = NOW(),
                pipeline_completed_at = CASE
                    WHEN :completes THEN NOW()
                    WHEN :startsRun THEN NULL
                    ELSE pipeline_completed_at END,
                pipeline_error = CASE
                    WHEN :fails THEN CAST(:error AS text)
                    WHEN :startsRun THEN NULL
                    ELSE pipeline_error END,
                pipeline_progress = CASE WHEN :startsRun THEN NULL ELSE pipeline_progress END,
                updated_at = NOW()
            WHERE id = :id
              AND pipeline_status::text IN (:from)
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("to", to.dbValue())
            .param("startsRun", transition.startsRun())
            .param("completes", completes)
            .param("fails", fails)
            .param("error", transition.error())
            .param("id", sessionId)
            .param("from", transition.from().stream().map(PipelineStatus::dbValue).toList())
            .update();

        if (rowsAffected == 0 && findById(sessionId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        return rowsAffected == 1;
    }

    @Override
    public boolean reset(UUID sessionId, Set<PipelineStatus> allowed) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE legacy_import_sessions
                SET pipeline_status = 'NotStarted'::pipeline_status,
                    pipeline_started_at = NULL,
                    pipeline_stage_started_at = NULL,
                    pipeline_completed_at = NULL,
                    pipeline_error = NULL,
                    pipeline_progress = NULL,
                    updated_at = NOW()
                WHERE id = :id
                  AND pipeline_status::text IN (:allowed)
                """)
            .param("id", sessionId)
            .param("allowed", allowed.stream().map(PipelineStatus::dbValue).toList())
            .update();

        if (rowsAffected == 0 && findById(sessionId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        return rowsAffected == 1;
    }

    @Override
    @SneakyThrows
    public void updateSessionStats(UUID sessionId, StageStats stats) {
        String json = objectMapper.writerFor(StageStats.class).writeValueAsString(stats);

        int rowsAffected = jdbcClient.sql("""
                UPDATE legacy_import_sessions
                SET pipeline_stats = COALESCE(pipeline_stats, '{}'::jsonb) || jsonb_build_object(:key, CAST(:value AS jsonb)),
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("key", stats.key())
            .param("value", json)
            .param("id", sessionId)
            .update();

        if (rowsAffected == 0) {
            throw new SessionNotFoundException(sessionId);
        }
    }

    @Override
    @SneakyThrows
    public void updateProgress(UUID sessionId, PipelineProgress progress) {
        jdbcClient.sql("""
                UPDATE legacy_import_sessions
                SET pipeline_progress = CAST(:progress AS jsonb), updated_at = NOW()
                WHERE id = :id
                """)
            .param("progress", objectMapper.writeValueAsString(progress))
            .param("id", sessionId)
            .update();
    }

    @Override
    public void addPendingBatchHandles(UUID sessionId, Collection<String> handles) {
        if (handles == null || handles.isEmpty()) {
            return;
        }
        jdbcClient.sql("""
                UPDATE legacy_import_sessions
                SET pending_batch_handles = ARRAY(
                        SELECT DISTINCT h
                        FROM unnest(pending_batch_handles || CAST(:handles AS text[])) AS h
                        ORDER BY h),
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("handles", toArrayLiteral(handles))
            .param("id", sessionId)
            .update();
    }

    @Override
    public void removePendingBatchHandle(UUID sessionId, String handle) {
        jdbcClient.sql("""
                UPDATE legacy_import_sessions
                SET pending_batch_handles = array_remove(pending_batch_handles, CAST(:handle AS text)),
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("handle", handle)
            .param("id", sessionId)
            .update();
    }

    @Override
    public List<UUID> findSessionsWithPendingHandle(String handle) {
        return jdbcClient.sql("""
                SELECT id
                FROM legacy_import_sessions
                WHERE CAST(:handle AS text) = ANY(pending_batch_handles)
                ORDER BY created_at
                """)
            .param("handle", handle)
            .query(UUID.class)
            .list();
    }

    @SneakyThrows
    private Map<String, StageStats> readStats(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return objectMapper.readValue(json, STATS_TYPE);
    }

    @SneakyThrows
    private PipelineProgress readProgress(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        return objectMapper.readValue(json, PipelineProgress.class);
    }

    private static List<String> toStrings(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        return Arrays.asList((String[]) array.getArray());
    }

    private static String toArrayLiteral(Collection<String> values) {
        return values.stream()
            .map(value -> "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"")
            .collect(Collectors.joining(",", "{", "}"));
    }
}
