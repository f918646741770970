package com.archivist.taxonomy.repository;

import com.archivist.taxonomy.exception.EntityNotFoundException;
import com.archivist.taxonomy.model.ClusterAssignment;
import com.archivist.taxonomy.model.DocumentCluster;
import com.archivist.taxonomy.model.DocumentVector;
import com.archivist.taxonomy.model.DuplicateGroup;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.model.TriageCounts;
import com.archivist.taxonomy.model.TriageStatus;
import com.archivist.taxonomy.model.ValidationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcDocumentRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private SessionRepository sessionRepository;

    @Autowired
    private ClusterRepository clusterRepository;

    @Autowired
    private JdbcClient jdbcClient;

    private UUID sessionId;

    @BeforeEach
    void setUp() {
        sessionId = sessionRepository.create(0).id();
    }

    private ExtractedDocument save(String fileName, String text) {
        return documentRepository.save(ExtractedDocument.newDocument(sessionId, fileName, text, null, null));
    }

    private ExtractedDocument canonicalFirmDrafted(String fileName) {
        ExtractedDocument document = save(fileName, "Text of " + fileName);
        documentRepository.updateTriage(document.id(), TriageStatus.FIRM_DRAFTED, 0.9, "Drafted by the firm");
        documentRepository.markDuplicateGroups(List.of(new DuplicateGroup(null, "h-" + fileName, document.id(),
            List.of(document.id()))));
        return document;
    }

    private ExtractedDocument reload(UUID id) {
        return documentRepository.findById(id).orElseThrow();
    }

    @Test
    @DisplayName("Happy path: Should save a document and find it by id")
    void shouldSaveAndFindDocument() {
        ExtractedDocument saved = documentRepository.save(
            ExtractedDocument.newDocument(sessionId, "lease.docx", "Lease agreement", "Re: lease", "a@firm.example"));

        assertThat(saved.id()).isNotNull();
        assertThat(saved.createdAt()).isNotNull();
        assertThat(saved.triageStatus()).isNull();
        assertThat(saved.validationStatus()).isEqualTo(ValidationStatus.PENDING);
        assertThat(saved.embedded()).isFalse();

        ExtractedDocument found = reload(saved.id());
        assertThat(found.emailSubject()).isEqualTo("Re: lease");
        assertThat(found.extractedText()).isEqualTo("Lease agreement");
        assertThat(documentRepository.findByIds(List.of(saved.id()))).hasSize(1);
        assertThat(documentRepository.findByIds(List.of())).isEmpty();
    }

    @Nested
    @DisplayName("Triage")
    class Triage {

        @Test
        @DisplayName("A triage result is written once and never overwritten")
        void writeOnce() {
            ExtractedDocument document = save("memo.docx", "Memo");

            assertThat(documentRepository.updateTriage(document.id(), TriageStatus.COURT_DOC, 0.8, "Court filing")).isTrue();
            assertThat(documentRepository.updateTriage(document.id(), TriageStatus.IRRELEVANT, 0.99, "Spam")).isFalse();

            ExtractedDocument reloaded = reload(document.id());
            assertThat(reloaded.triageStatus()).isEqualTo(TriageStatus.COURT_DOC);
            assertThat(reloaded.triageConfidence()).isEqualTo(0.8);
            assertThat(reloaded.triageReason()).isEqualTo("Court filing");
        }

        @Test
        @DisplayName("Untriaged documents are listed and counted")
        void untriagedAndCounts() {
            ExtractedDocument first = save("a.docx", "A");
            save("b.docx", "B");
            save("c.docx", "C");
            documentRepository.updateTriage(first.id(), TriageStatus.FIRM_DRAFTED, 0.9, "ours");

            assertThat(documentRepository.findUntriaged(sessionId)).hasSize(2)
                .noneMatch(document -> document.id().equals(first.id()));

            TriageCounts counts = documentRepository.countByTriageStatus(sessionId);
            assertThat(counts.count(TriageStatus.FIRM_DRAFTED)).isEqualTo(1);
            assertThat(counts.count(TriageStatus.THIRD_PARTY)).isZero();
            assertThat(counts.untriaged()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("Duplicate groups mark hashes and exactly one canonical member")
    void shouldMarkDuplicateGroups() {
        ExtractedDocument keep = save("a.docx", "Same");
        ExtractedDocument copy = save("a (1).docx", "Same");
        documentRepository.updateTriage(keep.id(), TriageStatus.FIRM_DRAFTED, 0.9, "ours");
        documentRepository.updateTriage(copy.id(), TriageStatus.FIRM_DRAFTED, 0.9, "ours");
        UUID groupId = UUID.randomUUID();

        documentRepository.markDuplicateGroups(List.of(new DuplicateGroup(groupId, "abc123", keep.id(),
            List.of(keep.id(), copy.id()))));

        assertThat(reload(keep.id()).canonical()).isTrue();
        assertThat(reload(copy.id()).canonical()).isFalse();
        assertThat(reload(copy.id()).duplicateGroupId()).isEqualTo(groupId);
        assertThat(reload(copy.id()).contentHash()).isEqualTo("abc123");
        assertThat(documentRepository.findFirmDrafted(sessionId)).hasSize(2);
        assertThat(documentRepository.findCanonicalFirmDrafted(sessionId))
            .extracting(ExtractedDocument::id).containsExactly(keep.id());
    }

    @Nested
    @DisplayName("Embeddings")
    class Embeddings {

        @Test
        @DisplayName("Stored vectors round-trip through pgvector")
        void storeAndLoad() {
            ExtractedDocument document = canonicalFirmDrafted("brief.docx");
            assertThat(documentRepository.findPendingEmbedding(sessionId)).hasSize(1);

            documentRepository.updateEmbedding(document.id(), new float[]{0.25f, -0.5f, 1.0f});

            assertThat(reload(document.id()).embedded()).isTrue();
            assertThat(documentRepository.findPendingEmbedding(sessionId)).isEmpty();
            List<DocumentVector> vectors = documentRepository.findEmbedded(sessionId);
            assertThat(vectors).hasSize(1);
            assertThat(vectors.get(0).vector()).containsExactly(0.25f, -0.5f, 1.0f);
        }

        @Test
        @DisplayName("A failed document is no longer pending")
        void failure() {
            ExtractedDocument document = canonicalFirmDrafted("scan.pdf");

            documentRepository.markEmbeddingFailed(document.id(), "Document has no extracted text");

            assertThat(reload(document.id()).embeddingError()).isEqualTo("Document has no extracted text");
            assertThat(documentRepository.findPendingEmbedding(sessionId)).isEmpty();
        }

        @Test
        @DisplayName("Writing to an unknown document throws")
        void unknownDocument() {
            assertThatThrownBy(() -> documentRepository.updateEmbedding(UUID.randomUUID(), new float[]{1f}))
                .isInstanceOf(EntityNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Cluster assignments")
    class Assignments {

        @Test
        @DisplayName("Assigning and clearing clusters tracks the unclustered candidate count")
        void assignAndClear() {
            ExtractedDocument first = canonicalFirmDrafted("one.docx");
            ExtractedDocument second = canonicalFirmDrafted("two.docx");
            documentRepository.updateEmbedding(first.id(), new float[]{1f, 0f});
            documentRepository.updateEmbedding(second.id(), new float[]{0f, 1f});
            assertThat(documentRepository.countClusterCandidatesWithoutCluster(sessionId)).isEqualTo(2);

            DocumentCluster cluster = clusterRepository.createCluster(sessionId, List.of(first.id()), false, List.of(first.id()));
            documentRepository.assignClusters(List.of(new ClusterAssignment(first.id(), cluster.id(), 0.75)));

            assertThat(reload(first.id()).clusterId()).isEqualTo(cluster.id());
            assertThat(reload(first.id()).clusterConfidence()).isEqualTo(0.75);
            assertThat(documentRepository.countClusterCandidatesWithoutCluster(sessionId)).isEqualTo(1);

            documentRepository.clearClusterAssignments(sessionId);

            assertThat(reload(first.id()).clusterId()).isNull();
            assertThat(documentRepository.countClusterCandidatesWithoutCluster(sessionId)).isEqualTo(2);
        }

        @Test
        @DisplayName("A member that loses canonical status also loses its cluster assignment")
        void demotedMemberLeavesCluster() {
            ExtractedDocument first = canonicalFirmDrafted("one.docx");
            ExtractedDocument richer = save("one-final.docx", "Text of one.docx");
            documentRepository.updateTriage(richer.id(), TriageStatus.FIRM_DRAFTED, 0.9, "ours");
            documentRepository.updateEmbedding(first.id(), new float[]{1f, 0f});
            DocumentCluster cluster = clusterRepository.createCluster(sessionId, List.of(first.id()), false, List.of(first.id()));
            documentRepository.assignClusters(List.of(new ClusterAssignment(first.id(), cluster.id(), 0.75)));

            documentRepository.markDuplicateGroups(List.of(new DuplicateGroup(UUID.randomUUID(), "h-one", richer.id(),
                List.of(first.id(), richer.id()))));

            assertThat(reload(first.id()).canonical()).isFalse();
            assertThat(reload(first.id()).clusterId()).isNull();
            assertThat(reload(first.id()).clusterConfidence()).isNull();
            assertThat(reload(richer.id()).canonical()).isTrue();
            assertThat(reload(richer.id()).clusterId()).isNull();
        }

        @Test
        @DisplayName("A member that stays canonical keeps its cluster assignment")
        void canonicalMemberKeepsCluster() {
            ExtractedDocument first = canonicalFirmDrafted("one.docx");
            documentRepository.updateEmbedding(first.id(), new float[]{1f, 0f});
            DocumentCluster cluster = clusterRepository.createCluster(sessionId, List.of(first.id()), false, List.of(first.id()));
            documentRepository.assignClusters(List.of(new ClusterAssignment(first.id(), cluster.id(), 0.75)));

            documentRepository.markDuplicateGroups(List.of(new DuplicateGroup(null, "h-one", first.id(), List.of(first.id()))));

            assertThat(reload(first.id()).clusterId()).isEqualTo(cluster.id());
            assertThat(reload(first.id()).clusterConfidence()).isEqualTo(0.75);
        }

        @Test
        @DisplayName("Reclassified documents are moved and returned to pending validation")
        void reassign() {
            ExtractedDocument document = canonicalFirmDrafted("invoice.pdf");
            documentRepository.updateEmbedding(document.id(), new float[]{1f, 1f});
            jdbcClient.sql("""
                    UPDATE extracted_documents
                    SET validation_status = 'Reclassified'::validation_status, reclassification_note = 'invoice'
                    WHERE id = :id
                    """)
                .param("id", document.id())
                .update();

            List<ExtractedDocument> reclassified = documentRepository.findReclassified(sessionId);
            assertThat(reclassified).extracting(ExtractedDocument::reclassificationNote).containsExactly("invoice");

            DocumentCluster target = clusterRepository.createNamedCluster(sessionId, "Invoices", List.of(document.id()));
            int moved = documentRepository.reassignToCluster(List.of(document.id()), target.id());

            ExtractedDocument reloaded = reload(document.id());
            assertThat(moved).isEqualTo(1);
            assertThat(reloaded.clusterId()).isEqualTo(target.id());
            assertThat(reloaded.validationStatus()).isEqualTo(ValidationStatus.PENDING);
            assertThat(documentRepository.findReclassified(sessionId)).isEmpty();
            assertThat(documentRepository.reassignToCluster(List.of(), target.id())).isZero();
        }
    }
}
