package com.archivist.taxonomy.repository;

import com.archivist.taxonomy.exception.EntityNotFoundException;
import com.archivist.taxonomy.model.ClusterAssignment;
import com.archivist.taxonomy.model.DocumentVector;
import com.archivist.taxonomy.model.DuplicateGroup;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.model.TriageCounts;
import com.archivist.taxonomy.model.TriageStatus;
import com.archivist.taxonomy.model.ValidationStatus;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private static final String DOCUMENT_COLUMNS = """
        id, session_id, file_name, storage_path, extracted_text, email_subject, email_sender,
        email_date, folder_path, content_hash, triage_status, triage_confidence, triage_reason,
        duplicate_group_id, is_canonical, (embedding IS NOT NULL) AS embedded, embedding_error,
        cluster_id, cluster_confidence, validation_status, reclassification_note, created_at, updated_at
        """;

    private static final String CLUSTER_CANDIDATE_FILTER = """
        session_id = :sessionId
          AND triage_status = 'FirmDrafted'::triage_status
          AND is_canonical
          AND embedding IS NOT NULL
        """;

    private final JdbcClient jdbcClient;

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<ExtractedDocument> documentRowMapper = (rs, rowNum) -> {
        String triage = rs.getString("triage_status");
        String validation = rs.getString("validation_status");

        return new ExtractedDocument(
            rs.getObject("id", UUID.class),
            rs.getObject("session_id", UUID.class),
            rs.getString("file_name"),
            rs.getString("storage_path"),
            rs.getString("extracted_text"),
            rs.getString("email_subject"),
            rs.getString("email_sender"),
            rs.getObject("email_date", OffsetDateTime.class),
            rs.getString("folder_path"),
            rs.getString("content_hash"),
            triage != null ? TriageStatus.fromDbValue(triage) : null,
            rs.getObject("triage_confidence", Double.class),
            rs.getString("triage_reason"),
            rs.getObject("duplicate_group_id", UUID.class),
            rs.getBoolean("is_canonical"),
            rs.getBoolean("embedded"),
            rs.getString("embedding_error"),
            rs.getObject("cluster_id", UUID.class),
            rs.getObject("cluster_confidence", Double.class),
            validation != null ? ValidationStatus.fromDbValue(validation) : ValidationStatus.PENDING,
            rs.getString("reclassification_note"),
            rs.getObject("created_at", OffsetDateTime.class),
            rs.getObject("updated_at", OffsetDateTime.class)
        );
    };

    @Override
    public ExtractedDocument save(ExtractedDocument document) {
        return jdbcClient.sql("""
                INSERT INTO extracted_documents
                    (session_id, file_name, storage_path, extracted_text, email_subject, email_sender, email_date, folder_path)
                VALUES (:sessionId, :fileName, :storagePath, :extractedText, :emailSubject, :emailSender, :emailDate, :folderPath)
                RETURNING\s""" + DOCUMENT_COLUMNS)
            .param("sessionId", document.sessionId())
            .param("fileName", document.fileName())
            .param("storagePath", document.storagePath())
            .param("extractedText", document.extractedText())
            .param("emailSubject", document.emailSubject())
            .param("emailSender", document.emailSender())
            .param("emailDate", document.emailDate())
            .param("folderPath", document.folderPath())
            .query(documentRowMapper)
            .single();
    }

    @Override
    public Optional<ExtractedDocument> findById(UUID id) {
        return jdbcClient.sql("SELECT " + DOCUMENT_COLUMNS + " FROM extracted_documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public List<ExtractedDocument> findByIds(Collection<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return jdbcClient.sql("SELECT " + DOCUMENT_COLUMNS + " FROM extracted_documents WHERE id IN (:ids)")
            .param("ids", ids)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public List<ExtractedDocument> findUntriaged(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT\s""" + DOCUMENT_COLUMNS + """
                FROM extracted_documents
                WHERE session_id = :sessionId
                  AND triage_status IS NULL
                ORDER BY created_at, id
                """)
            .param("sessionId", sessionId)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public boolean updateTriage(UUID docId, TriageStatus status, double confidence, String reason) {
        String sql = """
            UPDATE extracted_documents
            SET triage_status = CAST(:status AS triage_status),
                triage_confidence = :confidence,
                triage_reason = :reason,
                updated_at = NOW()
            WHERE id = :id
              AND triage_status IS NULL
            """;

        return jdbcClient.sql(sql)
            .param("status", status.dbValue())
            .param("confidence", confidence)
            .param("reason", reason)
            .param("id", docId)
            .update() == 1;
    }

    @Override
    public TriageCounts countByTriageStatus(UUID sessionId) {
        record StatusCount(String status, int total) {}

        List<StatusCount> rows = jdbcClient.sql("""
                SELECT triage_status::text AS triage_status, COUNT(*) AS total
                FROM extracted_documents
                WHERE session_id = :sessionId
                GROUP BY triage_status
                """)
            .param("sessionId", sessionId)
            .query((rs, rowNum) -> new StatusCount(rs.getString("triage_status"), rs.getInt("total")))
            .list();

        Map<TriageStatus, Integer> byStatus = new EnumMap<>(TriageStatus.class);
        int untriaged = 0;
        for (StatusCount row : rows) {
            if (row.status() == null) {
                untriaged = row.total();
            } else {
                byStatus.put(TriageStatus.fromDbValue(row.status()), row.total());
            }
        }

        return new TriageCounts(byStatus, untriaged);
    }

    @Override
    public List<ExtractedDocument> findFirmDrafted(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT\s""" + DOCUMENT_COLUMNS + """
                FROM extracted_documents
                WHERE session_id = :sessionId
                  AND triage_status = 'FirmDrafted'::triage_status
                """)
            .param("sessionId", sessionId)
            .query(documentRowMapper)
            .list();
    }

    @Override
    @Transactional
    public void markDuplicateGroups(List<DuplicateGroup> groups) {
        if (groups == null || groups.isEmpty()) {
            return;
        }

        record Row(UUID documentId, UUID groupId, String hash, boolean canonical) {}

        List<Row> rows = new ArrayList<>();
        for (DuplicateGroup group : groups) {
            for (UUID memberId : group.memberIds()) {
                rows.add(new Row(memberId, group.groupId(), group.contentHash(), memberId.equals(group.canonicalId())));
            }
        }

        String sql = """
            UPDATE extracted_documents
            SET content_hash = ?,
                duplicate_group_id = ?,
                is_canonical = ?,
                cluster_id = CASE WHEN ? THEN cluster_id ELSE NULL END,
                cluster_confidence = CASE WHEN ? THEN cluster_confidence ELSE NULL END,
                updated_at = NOW()
            WHERE id = ?
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                Row row = rows.get(i);
                ps.setString(1, row.hash());
                ps.setObject(2, row.groupId());
                ps.setBoolean(3, row.canonical());
                ps.setBoolean(4, row.canonical());
                ps.setBoolean(5, row.canonical());
                ps.setObject(6, row.documentId());
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
    }

    @Override
    public List<ExtractedDocument> findCanonicalFirmDrafted(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT\s""" + DOCUMENT_COLUMNS + """
                FROM extracted_documents
                WHERE session_id = :sessionId
                  AND triage_status = 'FirmDrafted'::triage_status
                  AND is_canonical
                ORDER BY id
                """)
            .param("sessionId", sessionId)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public List<ExtractedDocument> findPendingEmbedding(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT\s""" + DOCUMENT_COLUMNS + """
                FROM extracted_documents
                WHERE session_id = :sessionId
                  AND triage_status = 'FirmDrafted'::triage_status
                  AND is_canonical
                  AND embedding IS NULL
                  AND embedding_error IS NULL
                ORDER BY id
                """)
            .param("sessionId", sessionId)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public void updateEmbedding(UUID docId, float[] vector) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE extracted_documents
                SET embedding = :embedding, embedding_error = NULL, updated_at = NOW()
                WHERE id = :id
                """)
            .param("embedding", new PGvector(vector))
            .param("id", docId)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException("Document", docId);
        }
    }

    @Override
    public void markEmbeddingFailed(UUID docId, String error) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE extracted_documents
                SET embedding_error = :error, updated_at = NOW()
                WHERE id = :id
                """)
            .param("error", error == null ? "Unknown embedding error" : error)
            .param("id", docId)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException("Document", docId);
        }
    }

    @Override
    public List<DocumentVector> findEmbedded(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT id, embedding::text AS embedding
                FROM extracted_documents
                WHERE\s""" + CLUSTER_CANDIDATE_FILTER + """
                ORDER BY id
                """)
            .param("sessionId", sessionId)
            .query((rs, rowNum) -> new DocumentVector(
                rs.getObject("id", UUID.class),
                new PGvector(rs.getString("embedding")).toArray()
            ))
            .list();
    }

    @Override
    public int countClusterCandidatesWithoutCluster(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT COUNT(*)
                FROM extracted_documents
                WHERE\s""" + CLUSTER_CANDIDATE_FILTER + """
                  AND cluster_id IS NULL
                """)
            .param("sessionId", sessionId)
            .query(Integer.class)
            .single();
    }

    @Override
    public void clearClusterAssignments(UUID sessionId) {
        jdbcClient.sql("""
                UPDATE extracted_documents
                SET cluster_id = NULL, cluster_confidence = NULL, updated_at = NOW()
                WHERE session_id = :sessionId
                  AND cluster_id IS NOT NULL
                """)
            .param("sessionId", sessionId)
            .update();
    }

    @Override
    public void assignClusters(List<ClusterAssignment> assignments) {
        if (assignments == null || assignments.isEmpty()) {
            return;
        }

        String sql = """
            UPDATE extracted_documents
            SET cluster_id = ?, cluster_confidence = ?, updated_at = NOW()
            WHERE id = ?
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                ClusterAssignment assignment = assignments.get(i);
                ps.setObject(1, assignment.clusterId());
                ps.setDouble(2, assignment.confidence());
                ps.setObject(3, assignment.documentId());
            }

            @Override
            public int getBatchSize() {
                return assignments.size();
            }
        });
    }

    @Override
    public List<ExtractedDocument> findReclassified(UUID sessionId) {
        return jdbcClient.sql("""
                SELECT\s""" + DOCUMENT_COLUMNS + """
                FROM extracted_documents
                WHERE session_id = :sessionId
                  AND validation_status = 'Reclassified'::validation_status
                ORDER BY id
                """)
            .param("sessionId", sessionId)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public int reassignToCluster(Collection<UUID> docIds, UUID clusterId) {
        if (docIds == null || docIds.isEmpty()) {
            return 0;
        }
        return jdbcClient.sql("""
                UPDATE extracted_documents
                SET cluster_id = :clusterId,
                    cluster_confidence = NULL,
                    validation_status = 'Pending'::validation_status,
                    updated_at = NOW()
                WHERE id IN (:ids)
                  AND triage_status = 'FirmDrafted'::triage_status
                  AND is_canonical
                  AND embedding IS NOT NULL
                """)
            .param("clusterId", clusterId)
            .param("ids", docIds)
            .update();
    }
}
