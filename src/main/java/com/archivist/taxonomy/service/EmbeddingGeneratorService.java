package com.archivist.taxonomy.service;

import com.archivist.taxonomy.config.PipelineProperties;
import com.archivist.taxonomy.infra.Partitions;
import com.archivist.taxonomy.model.EmbeddingStats;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.repository.DocumentRepository;
import com.archivist.taxonomy.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingGeneratorService {

    static final String STAGE = "embedding";

    private final DocumentRepository documentRepository;
    private final SessionRepository sessionRepository;
    private final EmbeddingClient embeddingClient;
    private final ProgressReporter progressReporter;
    private final PipelineProperties properties;

    public EmbeddingStats embed(UUID sessionId) {
        List<ExtractedDocument> pending = documentRepository.findPendingEmbedding(sessionId);
        log.info("Embedding {} documents of session {}", pending.size(), sessionId);

        int errored = 0;
        List<ExtractedDocument> embeddable = new ArrayList<>();
        for (ExtractedDocument document : pending) {
            if (document.hasText()) {
                embeddable.add(document);
            } else {
                documentRepository.markEmbeddingFailed(document.id(), "Document has no extracted text");
                errored++;
            }
        }

        int embedded = 0;
        int processed = errored;
        for (List<ExtractedDocument> batch : Partitions.of(embeddable, properties.embedding().batchSize())) {
            int batchEmbedded = embedBatch(batch);
            embedded += batchEmbedded;
            errored += batch.size() - batchEmbedded;
            processed += batch.size();
            progressReporter.report(sessionId, STAGE, processed, pending.size(), embedded + " embedded");
        }

        EmbeddingStats stats = new EmbeddingStats(pending.size(), embedded, errored);
        sessionRepository.updateSessionStats(sessionId, stats);
        log.info("Session {}: embedded {}, failed {}", sessionId, embedded, errored);
        return stats;
    }

    private int embedBatch(List<ExtractedDocument> batch) {
        try {
            List<float[]> vectors = embeddingClient.embedAll(batch.stream().map(this::textOf).toList());
            for (int i = 0; i < batch.size(); i++) {
                documentRepository.updateEmbedding(batch.get(i).id(), vectors.get(i));
            }
            return batch.size();
        } catch (RuntimeException e) {
            log.warn("Embedding batch of {} failed ({}), retrying items one by one", batch.size(), e.getMessage());
        }

        int embedded = 0;
        for (ExtractedDocument document : batch) {
            try {
                float[] vector = embeddingClient.embedAll(List.of(textOf(document))).get(0);
                documentRepository.updateEmbedding(document.id(), vector);
                embedded++;
            } catch (RuntimeException e) {
                log.error("Embedding failed for document {}: {}", document.id(), e.getMessage());
                documentRepository.markEmbeddingFailed(document.id(), e.getMessage());
            }
        }
        return embedded;
    }

    private String textOf(ExtractedDocument document) {
        return Partitions.truncate(document.extractedText().strip(), properties.embedding().maxChars());
    }
}
