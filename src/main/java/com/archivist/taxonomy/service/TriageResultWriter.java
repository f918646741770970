package com.archivist.taxonomy.service;

import com.archivist.taxonomy.batch.BatchItemResult;
import com.archivist.taxonomy.batch.CustomId;
import com.archivist.taxonomy.model.TriageStatus;
import com.archivist.taxonomy.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class TriageResultWriter {

    private final DocumentRepository documentRepository;
    private final TriageResponseParser parser;

    public enum Write {
        WRITTEN,
        DOWNGRADED,
        SKIPPED
    }

    public Write write(BatchItemResult result) {
        Optional<CustomId> customId = CustomId.parse(result.customId());
        if (customId.isEmpty() || !customId.get().is(CustomId.TRIAGE)) {
            log.warn("Ignoring result with unexpected custom id '{}'", result.customId());
            return Write.SKIPPED;
        }

        UUID documentId = customId.get().entityId();

        if (!result.isSucceeded()) {
            String reason = "Batch item " + result.outcome().name().toLowerCase(Locale.ROOT) + ": " + result.error();
            return downgrade(documentId, reason);
        }

        TriageResponseParser.Result parsed = parser.parse(result.content());
        if (parsed instanceof TriageResponseParser.ParsedTriage triage) {
            boolean written = documentRepository.updateTriage(documentId, triage.status(), triage.confidence(), triage.reason());
            return written ? Write.WRITTEN : Write.SKIPPED;
        }
        return downgrade(documentId, "Unparseable response: " + ((TriageResponseParser.ParseError) parsed).message());
    }

    private Write downgrade(UUID documentId, String reason) {
        boolean written = documentRepository.updateTriage(documentId, TriageStatus.UNCERTAIN, 0.0, reason);
        if (written) {
            log.warn("Document {} triaged as Uncertain: {}", documentId, reason);
            return Write.DOWNGRADED;
        }
        return Write.SKIPPED;
    }
}
