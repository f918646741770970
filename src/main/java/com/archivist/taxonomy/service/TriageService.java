package com.archivist.taxonomy.service;

import com.archivist.taxonomy.batch.BatchDispatcher;
import com.archivist.taxonomy.batch.BatchItem;
import com.archivist.taxonomy.batch.BatchItemResult;
import com.archivist.taxonomy.batch.BatchListener;
import com.archivist.taxonomy.batch.CustomId;
import com.archivist.taxonomy.batch.DispatchReport;
import com.archivist.taxonomy.config.PipelineProperties;
import com.archivist.taxonomy.infra.Partitions;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.model.TriageStats;
import com.archivist.taxonomy.repository.DocumentRepository;
import com.archivist.taxonomy.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TriageService {

    static final String STAGE = "triage";

    static final String SYSTEM_PROMPT = """
        You sort documents recovered from a law firm's email archive.
        Classify the document into exactly one category:
        - FirmDrafted: written by the firm itself (contracts, pleadings, opinions, letters it drafted)
        - ThirdParty: written by clients, opposing counsel or other outside parties
        - CourtDoc: issued by a court or public authority (judgments, summons, minutes)
        - Irrelevant: newsletters, spam, automatic notifications, personal messages
        - Uncertain: not enough information to decide
        Answer with a single JSON object and nothing else:
        {"status": "<category>", "confidence": <number between 0 and 1>, "reason": "<one short sentence>"}
        """;

    private final DocumentRepository documentRepository;
    private final SessionRepository sessionRepository;
    private final BatchDispatcher batchDispatcher;
    private final TriageResultWriter resultWriter;
    private final ProgressReporter progressReporter;
    private final PipelineProperties properties;

    public TriageStats triage(UUID sessionId) {
        List<ExtractedDocument> documents = documentRepository.findUntriaged(sessionId);
        log.info("Triage for session {}: {} untriaged documents", sessionId, documents.size());

        DispatchReport report = DispatchReport.EMPTY;
        if (!documents.isEmpty()) {
            List<BatchItem> items = documents.stream().map(this::toItem).toList();
            SessionBatchListener listener = new SessionBatchListener(sessionId, documents.size());
            report = batchDispatcher.dispatch(items, properties.triage().batchSize(), listener);
            log.info("Triage batches for session {}: submitted={}, completed={}, incomplete={}, failed={}, rejected={}, writes={}",
                sessionId, report.submitted(), report.completed(), report.incomplete(), report.failed(),
                report.rejected(), listener.writes);
        }

        TriageStats stats = TriageStats.of(documentRepository.countByTriageStatus(sessionId),
            report.submitted(), report.incomplete(), report.failedOrRejected());
        sessionRepository.updateSessionStats(sessionId, stats);
        return stats;
    }

    BatchItem toItem(ExtractedDocument document) {
        StringBuilder prompt = new StringBuilder();
        appendField(prompt, "File name", document.fileName());
        appendField(prompt, "Email subject", document.emailSubject());
        appendField(prompt, "Email sender", document.emailSender());
        appendField(prompt, "Folder", document.folderPath());
        prompt.append("\n<document>\n")
            .append(Partitions.truncate(document.extractedText(), properties.triage().maxChars()))
            .append("\n</document>");

        return new BatchItem(
            CustomId.format(CustomId.TRIAGE, document.id()),
            SYSTEM_PROMPT,
            prompt.toString(),
            properties.triage().maxTokens()
        );
    }

    private static void appendField(StringBuilder prompt, String label, String value) {
        if (value != null && !value.isBlank()) {
            prompt.append(label).append(": ").append(value.strip()).append('\n');
        }
    }

    private class SessionBatchListener implements BatchListener {

        private final UUID sessionId;
        private final int totalDocuments;
        private final Map<TriageResultWriter.Write, Integer> writes = new EnumMap<>(TriageResultWriter.Write.class);
        private int resultsSeen;

        SessionBatchListener(UUID sessionId, int totalDocuments) {
            this.sessionId = sessionId;
            this.totalDocuments = totalDocuments;
        }

        @Override
        public void onSubmitted(String handle, List<BatchItem> items) {
            sessionRepository.addPendingBatchHandles(sessionId, List.of(handle));
        }

        @Override
        public void onResult(String handle, BatchItemResult result) {
            writes.merge(resultWriter.write(result), 1, Integer::sum);
            resultsSeen++;
        }

        @Override
        public void onMerged(String handle) {
            sessionRepository.removePendingBatchHandle(sessionId, handle);
        }

        @Override
        public void onBatchFinished(int finished, int total) {
            progressReporter.report(sessionId, STAGE, resultsSeen, totalDocuments,
                "Batch " + finished + " of " + total + " finished");
        }
    }
}
