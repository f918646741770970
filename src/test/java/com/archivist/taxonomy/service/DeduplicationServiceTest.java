package com.archivist.taxonomy.service;

import com.archivist.taxonomy.model.DedupStats;
import com.archivist.taxonomy.model.DuplicateGroup;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.model.TriageStatus;
import com.archivist.taxonomy.support.InMemoryPipelineStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class DeduplicationServiceTest {

    private InMemoryPipelineStore store;
    private DeduplicationService service;
    private UUID sessionId;

    @BeforeEach
    void setUp() {
        store = new InMemoryPipelineStore();
        service = new DeduplicationService(store.documents(), store.sessions(), new ContentHasher(),
            new ProgressReporter(store.sessions()));
        sessionId = store.newSession();
    }

    private ExtractedDocument firmDrafted(String fileName, String text) {
        ExtractedDocument document = store.addDocument(sessionId, fileName, text);
        store.triage(document.id(), TriageStatus.FIRM_DRAFTED);
        return document;
    }

    @Test
    @DisplayName("Exactly one canonical document per duplicate group, the rest kept as duplicates")
    void shouldElectOneCanonicalPerGroup() {
        firmDrafted("a.docx", "Power of attorney");
        firmDrafted("b.docx", "Power  of\nattorney ");
        firmDrafted("c.docx", "Power of attorney");
        firmDrafted("d.docx", "Lease agreement");

        DedupStats stats = service.deduplicate(sessionId);

        assertThat(stats).isEqualTo(new DedupStats(4, 1, 2, 2));

        Map<String, List<ExtractedDocument>> byHash = store.documentsOf(sessionId).stream()
            .collect(Collectors.groupingBy(ExtractedDocument::contentHash));
        assertThat(byHash).hasSize(2);
        byHash.values().forEach(members ->
            assertThat(members).filteredOn(ExtractedDocument::canonical).hasSize(1));

        List<ExtractedDocument> group = byHash.values().stream().filter(members -> members.size() == 3).findFirst().orElseThrow();
        assertThat(group).extracting(ExtractedDocument::duplicateGroupId).containsOnly(group.get(0).duplicateGroupId()).doesNotContainNull();
        assertThat(group).extracting(ExtractedDocument::triageStatus).containsOnly(TriageStatus.FIRM_DRAFTED);
    }

    @Test
    @DisplayName("Documents outside FirmDrafted are not deduplicated")
    void shouldIgnoreOtherCategories() {
        firmDrafted("a.docx", "Shared text");
        ExtractedDocument thirdParty = store.addDocument(sessionId, "b.docx", "Shared text");
        store.triage(thirdParty.id(), TriageStatus.THIRD_PARTY);

        DedupStats stats = service.deduplicate(sessionId);

        assertThat(stats.duplicates()).isZero();
        assertThat(store.document(thirdParty.id()).contentHash()).isNull();
        assertThat(store.document(thirdParty.id()).canonical()).isFalse();
    }

    @Test
    @DisplayName("Documents without text stay canonical singletons")
    void shouldKeepBlankDocumentsAsSingletons() {
        ExtractedDocument first = firmDrafted("scan1.pdf", "   ");
        ExtractedDocument second = firmDrafted("scan2.pdf", null);

        DedupStats stats = service.deduplicate(sessionId);

        assertThat(stats.canonical()).isEqualTo(2);
        assertThat(store.document(first.id()).canonical()).isTrue();
        assertThat(store.document(second.id()).canonical()).isTrue();
        assertThat(store.document(first.id()).duplicateGroupId()).isNull();
    }

    @Test
    @DisplayName("Canonical choice prefers complete metadata, then the earliest document")
    void shouldBreakTiesDeterministically() {
        OffsetDateTime early = OffsetDateTime.of(2020, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        ExtractedDocument sparse = document(null, null, early);
        ExtractedDocument rich = document("Re: contract", "partner@firm.example", early.plusDays(1));
        ExtractedDocument richLater = document("Re: contract", "partner@firm.example", early.plusDays(2));

        List<DuplicateGroup> groups = service.group(sessionId, List.of(sparse, richLater, rich));

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).canonicalId()).isEqualTo(rich.id());
        assertThat(service.group(sessionId, List.of(rich, richLater, sparse)).get(0).canonicalId()).isEqualTo(rich.id());
    }

    @Test
    @DisplayName("Running twice leaves the same canonical documents")
    void shouldBeRepeatable() {
        firmDrafted("a.docx", "Same text");
        firmDrafted("b.docx", "Same text");
        service.deduplicate(sessionId);
        List<ExtractedDocument> first = store.documentsOf(sessionId);

        service.deduplicate(sessionId);

        assertThat(store.documentsOf(sessionId)).isEqualTo(first);
    }

    private ExtractedDocument document(String subject, String sender, OffsetDateTime createdAt) {
        return new ExtractedDocument(UUID.randomUUID(), sessionId, "memo.docx", null, "Identical memo", subject, sender,
            null, null, null, TriageStatus.FIRM_DRAFTED, 0.9, null, null, false, false, null, null, null,
            null, null, createdAt, createdAt);
    }
}
