package com.archivist.taxonomy.service;

import com.archivist.taxonomy.model.DedupStats;
import com.archivist.taxonomy.model.DuplicateGroup;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.repository.DocumentRepository;
import com.archivist.taxonomy.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {

    static final Comparator<ExtractedDocument> CANONICAL_ORDER = Comparator
        .comparingInt(ExtractedDocument::metadataCompleteness).reversed()
        .thenComparing(ExtractedDocument::createdAt, Comparator.nullsLast(Comparator.<OffsetDateTime>naturalOrder()))
        .thenComparing(document -> document.id().toString());

    private final DocumentRepository documentRepository;
    private final SessionRepository sessionRepository;
    private final ContentHasher contentHasher;
    private final ProgressReporter progressReporter;

    public DedupStats deduplicate(UUID sessionId) {
        List<ExtractedDocument> documents = documentRepository.findFirmDrafted(sessionId);
        log.info("Deduplicating {} FirmDrafted documents of session {}", documents.size(), sessionId);

        List<DuplicateGroup> groups = group(sessionId, documents);
        documentRepository.markDuplicateGroups(groups);

        int duplicateGroups = (int) groups.stream().filter(group -> group.memberIds().size() > 1).count();
        int duplicates = groups.stream().mapToInt(DuplicateGroup::duplicateCount).sum();
        DedupStats stats = new DedupStats(documents.size(), duplicateGroups, duplicates, groups.size());

        sessionRepository.updateSessionStats(sessionId, stats);
        progressReporter.report(sessionId, "deduplication", documents.size(), documents.size(),
            duplicates + " duplicates in " + duplicateGroups + " groups");
        log.info("Session {}: {} duplicate groups, {} duplicates, {} canonical documents",
            sessionId, duplicateGroups, duplicates, groups.size());
        return stats;
    }

    List<DuplicateGroup> group(UUID sessionId, List<ExtractedDocument> documents) {
        Map<String, List<ExtractedDocument>> byHash = new LinkedHashMap<>();
        List<DuplicateGroup> groups = new ArrayList<>();

        for (ExtractedDocument document : documents) {
            Optional<String> hash = contentHasher.hash(document.extractedText());
            if (hash.isPresent()) {
                byHash.computeIfAbsent(hash.get(), key -> new ArrayList<>()).add(document);
            } else {
                groups.add(new DuplicateGroup(null, null, document.id(), List.of(document.id())));
            }
        }

        byHash.forEach((hash, members) -> {
            ExtractedDocument canonical = members.stream().min(CANONICAL_ORDER).orElseThrow();
            UUID groupId = members.size() > 1 ? contentHasher.groupId(sessionId, hash) : null;
            List<UUID> memberIds = members.stream().map(ExtractedDocument::id).toList();
            groups.add(new DuplicateGroup(groupId, hash, canonical.id(), memberIds));
        });

        return groups;
    }
}
