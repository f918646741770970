package com.archivist.taxonomy.service;

import com.archivist.taxonomy.batch.BatchDispatcher;
import com.archivist.taxonomy.batch.BatchItem;
import com.archivist.taxonomy.batch.BatchItemResult;
import com.archivist.taxonomy.batch.BatchListener;
import com.archivist.taxonomy.batch.CustomId;
import com.archivist.taxonomy.batch.DispatchReport;
import com.archivist.taxonomy.config.PipelineProperties;
import com.archivist.taxonomy.exception.BatchSubmissionException;
import com.archivist.taxonomy.infra.Partitions;
import com.archivist.taxonomy.model.DocumentCluster;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.model.NamingStats;
import com.archivist.taxonomy.repository.ClusterRepository;
import com.archivist.taxonomy.repository.DocumentRepository;
import com.archivist.taxonomy.repository.SessionRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Suggests a human-readable name for every unnamed, non-noise cluster. A cluster that
 * cannot be named keeps a null name and records why; naming never fails the pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterNamingService {

    static final String STAGE = "naming";
    static final int MAX_NAME_LENGTH = 120;

    private static final String SYSTEM_PROMPT_TEMPLATE = """
        You name clusters of similar documents from a law firm's archive.
        You receive sample documents that all belong to one cluster.
        Propose a short name (2 to 6 words) in %s for the document type they share,
        using the formal terminology a lawyer would use, in the plural.
        Answer with a single JSON object and nothing else: {"name": "<cluster name>"}
        """;

    private final ClusterRepository clusterRepository;
    private final DocumentRepository documentRepository;
    private final SessionRepository sessionRepository;
    private final BatchDispatcher batchDispatcher;
    private final JsonObjectExtractor jsonExtractor;
    private final ProgressReporter progressReporter;
    private final PipelineProperties properties;

    public NamingStats nameClusters(UUID sessionId) {
        List<DocumentCluster> clusters = clusterRepository.findUnnamed(sessionId);
        log.info("Naming {} clusters of session {}", clusters.size(), sessionId);
        if (clusters.isEmpty()) {
            NamingStats stats = new NamingStats(0, 0, 0);
            sessionRepository.updateSessionStats(sessionId, stats);
            return stats;
        }

        List<BatchItem> items = clusters.stream().map(this::toItem).toList();
        NamingListener listener = new NamingListener(sessionId, clusters.size());

        try {
            DispatchReport report = batchDispatcher.dispatch(items, properties.triage().batchSize(), listener);
            for (String handle : report.pendingHandles()) {
                for (UUID clusterId : listener.clustersOf(handle)) {
                    listener.fail(clusterId, "Naming batch " + handle + " did not complete");
                }
            }
        } catch (BatchSubmissionException e) {
            log.error("Naming batches for session {} were all rejected", sessionId, e);
            clusters.forEach(cluster -> listener.fail(cluster.id(), "Batch submission rejected: " + e.getMessage()));
        }

        for (DocumentCluster cluster : clusters) {
            if (!listener.handled.contains(cluster.id())) {
                listener.fail(cluster.id(), "No result returned for cluster");
            }
        }

        NamingStats stats = new NamingStats(clusters.size(), listener.named, listener.failed);
        sessionRepository.updateSessionStats(sessionId, stats);
        log.info("Session {}: named {} of {} clusters, {} failed", sessionId, stats.named(), stats.clusters(), stats.failed());
        return stats;
    }

    BatchItem toItem(DocumentCluster cluster) {
        List<ExtractedDocument> samples = documentRepository.findByIds(cluster.sampleDocumentIds());
        int maxChars = properties.naming().maxCharsPerSample();

        StringBuilder prompt = new StringBuilder("Cluster of ")
            .append(cluster.documentCount())
            .append(" documents. Samples:\n");
        int index = 1;
        for (ExtractedDocument sample : samples) {
            prompt.append("\n### Document ").append(index++).append('\n');
            if (sample.fileName() != null) {
                prompt.append("File name: ").append(sample.fileName()).append('\n');
            }
            if (sample.emailSubject() != null) {
                prompt.append("Email subject: ").append(sample.emailSubject()).append('\n');
            }
            prompt.append(Partitions.truncate(sample.extractedText(), maxChars)).append('\n');
        }

        return new BatchItem(
            CustomId.format(CustomId.CLUSTER, cluster.id()),
            SYSTEM_PROMPT_TEMPLATE.formatted(properties.naming().language()),
            prompt.toString(),
            properties.naming().maxTokens()
        );
    }

    Optional<String> extractName(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }

        Optional<ObjectNode> json = jsonExtractor.firstObject(content);
        if (json.isPresent()) {
            JsonNode name = json.get().get("name");
            if (name != null && name.isTextual() && !name.asText().isBlank()) {
                return Optional.of(cap(name.asText()));
            }
        }

        return content.lines()
            .map(line -> line.replaceAll("^[#>*\\-\\s]+", "").replaceAll("^[\"'`]+|[\"'`]+$", "").strip())
            .filter(line -> !line.isEmpty() && !line.startsWith("```") && !line.startsWith("{"))
            .findFirst()
            .map(ClusterNamingService::cap);
    }

    private static String cap(String name) {
        String trimmed = name.strip();
        return trimmed.length() <= MAX_NAME_LENGTH ? trimmed : trimmed.substring(0, MAX_NAME_LENGTH).strip();
    }

    private class NamingListener implements BatchListener {

        private final UUID sessionId;
        private final int total;
        private final Map<String, List<UUID>> clustersByHandle = new HashMap<>();
        private final Set<UUID> handled = new HashSet<>();
        private int named;
        private int failed;

        NamingListener(UUID sessionId, int total) {
            this.sessionId = sessionId;
            this.total = total;
        }

        List<UUID> clustersOf(String handle) {
            return clustersByHandle.getOrDefault(handle, List.of());
        }

        @Override
        public void onSubmitted(String handle, List<BatchItem> items) {
            clustersByHandle.put(handle, items.stream()
                .map(item -> CustomId.parse(item.customId()).orElseThrow().entityId())
                .toList());
        }

        @Override
        public void onResult(String handle, BatchItemResult result) {
            Optional<CustomId> customId = CustomId.parse(result.customId());
            if (customId.isEmpty() || !customId.get().is(CustomId.CLUSTER)) {
                log.warn("Ignoring naming result with unexpected custom id '{}'", result.customId());
                return;
            }

            UUID clusterId = customId.get().entityId();
            if (!result.isSucceeded()) {
                fail(clusterId, "Batch item " + result.outcome() + ": " + result.error());
                return;
            }

            Optional<String> name = extractName(result.content());
            if (name.isEmpty()) {
                fail(clusterId, "Model returned no usable name");
                return;
            }

            clusterRepository.updateClusterName(clusterId, name.get());
            handled.add(clusterId);
            named++;
            log.debug("Cluster {} named '{}'", clusterId, name.get());
        }

        @Override
        public void onMerged(String handle) {
            progressReporter.report(sessionId, STAGE, handled.size(), total, named + " clusters named");
        }

        void fail(UUID clusterId, String reason) {
            if (!handled.add(clusterId)) {
                return;
            }
            log.warn("Could not name cluster {}: {}", clusterId, reason);
            clusterRepository.markNamingFailed(clusterId, reason);
            failed++;
        }
    }
}
