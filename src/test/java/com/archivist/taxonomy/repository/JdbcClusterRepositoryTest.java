package com.archivist.taxonomy.repository;

import com.archivist.taxonomy.exception.EntityNotFoundException;
import com.archivist.taxonomy.model.ClusterAssignment;
import com.archivist.taxonomy.model.ClusterStatus;
import com.archivist.taxonomy.model.DocumentCluster;
import com.archivist.taxonomy.model.ExtractedDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcClusterRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private ClusterRepository clusterRepository;

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private SessionRepository sessionRepository;

    @Autowired
    private JdbcClient jdbcClient;

    private UUID sessionId;

    @BeforeEach
    void setUp() {
        sessionId = sessionRepository.create(0).id();
    }

    private UUID document() {
        return documentRepository.save(ExtractedDocument.newDocument(sessionId, "doc.docx", "text", null, null)).id();
    }

    @Test
    @DisplayName("Should create a cluster with its sample ids and find it by id")
    void shouldCreateAndFindCluster() {
        List<UUID> members = List.of(document(), document(), document());

        DocumentCluster created = clusterRepository.createCluster(sessionId, members, false, members.subList(0, 2));

        assertThat(created.id()).isNotNull();
        assertThat(created.documentCount()).isEqualTo(3);
        assertThat(created.sampleDocumentIds()).containsExactlyElementsOf(members.subList(0, 2));
        assertThat(created.status()).isEqualTo(ClusterStatus.PENDING);
        assertThat(created.isNamed()).isFalse();
        assertThat(clusterRepository.findById(created.id())).contains(created);
        assertThat(clusterRepository.findById(UUID.randomUUID())).isEmpty();
    }

    @Test
    @DisplayName("Unnamed lookups skip noise and named clusters, largest first")
    void shouldFindUnnamed() {
        DocumentCluster small = clusterRepository.createCluster(sessionId, List.of(document(), document()), false, List.of());
        DocumentCluster large = clusterRepository.createCluster(sessionId,
            List.of(document(), document(), document()), false, List.of());
        clusterRepository.createCluster(sessionId, List.of(document()), true, List.of());
        clusterRepository.createNamedCluster(sessionId, "Pleadings", List.of(document()));

        assertThat(clusterRepository.findUnnamed(sessionId))
            .extracting(DocumentCluster::id)
            .containsExactly(large.id(), small.id());
        assertThat(clusterRepository.findBySession(sessionId)).hasSize(4).last().matches(DocumentCluster::noise);
    }

    @Test
    @DisplayName("Naming stores the name and clears an earlier error")
    void shouldNameCluster() {
        DocumentCluster cluster = clusterRepository.createCluster(sessionId, List.of(document()), false, List.of());

        clusterRepository.markNamingFailed(cluster.id(), "Batch item EXPIRED: Request expired");
        assertThat(clusterRepository.findById(cluster.id()).orElseThrow().namingError())
            .isEqualTo("Batch item EXPIRED: Request expired");

        clusterRepository.updateClusterName(cluster.id(), "Lease Agreements");

        DocumentCluster named = clusterRepository.findById(cluster.id()).orElseThrow();
        assertThat(named.suggestedName()).isEqualTo("Lease Agreements");
        assertThat(named.namingError()).isNull();
        assertThatThrownBy(() -> clusterRepository.updateClusterName(UUID.randomUUID(), "x"))
            .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    @DisplayName("Active named clusters exclude rejected ones")
    void shouldFindActiveNamed() {
        DocumentCluster invoices = clusterRepository.createNamedCluster(sessionId, "Invoices", List.of(document()));
        DocumentCluster rejected = clusterRepository.createNamedCluster(sessionId, "Misc", List.of(document()));
        jdbcClient.sql("UPDATE document_clusters SET status = 'Rejected'::cluster_status WHERE id = :id")
            .param("id", rejected.id())
            .update();

        assertThat(clusterRepository.findActiveNamed(sessionId))
            .extracting(DocumentCluster::id)
            .containsExactly(invoices.id());
    }

    @Test
    @DisplayName("Document counts are recomputed from assignments")
    void shouldRefreshDocumentCount() {
        UUID first = document();
        UUID second = document();
        DocumentCluster cluster = clusterRepository.createCluster(sessionId, List.of(first), false, List.of(first));
        documentRepository.assignClusters(List.of(
            new ClusterAssignment(first, cluster.id(), 1.0),
            new ClusterAssignment(second, cluster.id(), 0.6)
        ));

        clusterRepository.refreshDocumentCount(cluster.id());

        assertThat(clusterRepository.findById(cluster.id()).orElseThrow().documentCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Deleting a session's clusters unassigns its documents")
    void shouldDeleteBySession() {
        UUID member = document();
        DocumentCluster cluster = clusterRepository.createCluster(sessionId, List.of(member), false, List.of(member));
        documentRepository.assignClusters(List.of(new ClusterAssignment(member, cluster.id(), 1.0)));

        clusterRepository.deleteBySession(sessionId);

        assertThat(clusterRepository.findBySession(sessionId)).isEmpty();
        assertThat(documentRepository.findById(member).orElseThrow().clusterId()).isNull();
    }
}
