package com.archivist.taxonomy.repository;

import com.archivist.taxonomy.exception.EntityNotFoundException;
import com.archivist.taxonomy.model.ClusterStatus;
import com.archivist.taxonomy.model.DocumentCluster;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class JdbcClusterRepository implements ClusterRepository {

    private static final String CLUSTER_COLUMNS = """
        id, session_id, suggested_name, naming_error, document_count, is_noise,
        sample_document_ids::text[] AS sample_document_ids, status, created_at, updated_at
        """;

    private final JdbcClient jdbcClient;

    private final RowMapper<DocumentCluster> clusterRowMapper = (rs, rowNum) -> new DocumentCluster(
        rs.getObject("id", UUID.class),
        rs.getObject("session_id", UUID.class),
        rs.getString("suggested_name"),
        rs.getString("naming_error"),
        rs.getInt("document_count"),
        rs.getBoolean("is_noise"),
        toUuids(rs.getArray("sample_document_ids")),
        ClusterStatus.fromDbValue(rs.getString("status")),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public DocumentCluster createCluster(UUID sessionId, List<UUID> memberIds, boolean noise, List<UUID> sampleDocumentIds) {
        return jdbcClient.sql("""
                INSERT INTO document_clusters (session_id, document_count, is_noise, sample_document_ids)
                VALUES (:sessionId, :documentCount, :noise, CAST(:sampleIds AS uuid[]))
                RETURNING\s""" + CLUSTER_COLUMNS)
            .param("sessionId", sessionId)
            .param("documentCount", memberIds.size())
            .param("noise", noise)
            .param("sampleIds", toArrayParam(sampleDocumentIds))
            .query(clusterRowMapper)
            .single();
    }

    @Override
    public DocumentCluster createNamedCluster(UUID sessionId, String name, List<UUID> memberIds) {
        return jdbcClient.sql("""
                INSERT INTO document_clusters (session_id, suggested_name, document_count, is_noise, sample_document_ids)
                VALUES (:sessionId, :name, :documentCount, FALSE, CAST(:sampleIds AS uuid[]))
                RETURNING\s""" + CLUSTER_COLUMNS)
            .param("sessionId", sessionId)
            .param("name", name)
            .param("documentCount", memberIds.size())
            .param("sampleIds", toArrayParam(memberIds))
            .query(clusterRowMapper)
            .single();
    }

    @Override
    public Optional<DocumentCluster> findById(UUID id) {
        return jdbcClient.sql("SELECT " + CLUSTER_COLUMNS + " FROM document_clusters WHERE id = :id")
            .param("id", id)
            .query(clusterRowMapper)
            .optional();
    }

    @Override
    public List<DocumentCluster> findBySession(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT\s""" + CLUSTER_COLUMNS + """
                FROM document_clusters
                WHERE session_id = :sessionId
                ORDER BY is_noise, document_count DESC, id
                """)
            .param("sessionId", sessionId)
            .query(clusterRowMapper)
            .list();
    }

    @Override
    public List<DocumentCluster> findUnnamed(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT\s""" + CLUSTER_COLUMNS + """
                FROM document_clusters
                WHERE session_id = :sessionId
                  AND NOT is_noise
                  AND suggested_name IS NULL
                ORDER BY document_count DESC, id
                """)
            .param("sessionId", sessionId)
            .query(clusterRowMapper)
            .list();
    }

    @Override
    public List<DocumentCluster> findActiveNamed(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT\s""" + CLUSTER_COLUMNS + """
                FROM document_clusters
                WHERE session_id = :sessionId
                  AND NOT is_noise
                  AND suggested_name IS NOT NULL
                  AND status NOT IN ('Rejected'::cluster_status, 'Deleted'::cluster_status)
                ORDER BY suggested_name, id
                """)
            .param("sessionId", sessionId)
            .query(clusterRowMapper)
            .list();
    }

    @Override
    public void deleteBySession(UUID sessionId) {
        jdbcClient.sql("DELETE FROM document_clusters WHERE session_id = :sessionId")
            .param("sessionId", sessionId)
            .update();
    }

    @Override
    public void updateClusterName(UUID clusterId, String name) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE document_clusters
                SET suggested_name = :name, naming_error = NULL, updated_at = NOW()
                WHERE id = :id
                """)
            .param("name", name)
            .param("id", clusterId)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException("Cluster", clusterId);
        }
    }

    @Override
    public void markNamingFailed(UUID clusterId, String error) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE document_clusters
                SET naming_error = :error, updated_at = NOW()
                WHERE id = :id
                """)
            .param("error", error)
            .param("id", clusterId)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException("Cluster", clusterId);
        }
    }

    @Override
    public void refreshDocumentCount(UUID clusterId) {
        jdbcClient.sql("""
                UPDATE document_clusters c
                SET document_count = (SELECT COUNT(*) FROM extracted_documents d WHERE d.cluster_id = c.id),
                    updated_at = NOW()
                WHERE c.id = :id
                """)
            .param("id", clusterId)
            .update();
    }

    private static String toArrayParam(List<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return "{}";
        }
        return ids.stream().map(UUID::toString).collect(Collectors.joining(",", "{", "}"));
    }

    private static List<UUID> toUuids(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        return Arrays.stream((String[]) array.getArray())
            .map(UUID::fromString)
            .toList();
    }
}
