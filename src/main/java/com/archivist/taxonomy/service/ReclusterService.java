package com.archivist.taxonomy.service;

import com.archivist.taxonomy.config.PipelineProperties;
import com.archivist.taxonomy.infra.RateLimiter;
import com.archivist.taxonomy.model.DocumentCluster;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.model.ReclusterStats;
import com.archivist.taxonomy.repository.ClusterRepository;
import com.archivist.taxonomy.repository.DocumentRepository;
import com.archivist.taxonomy.repository.SessionRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ReclusterService {

    public static final String CHAT_LIMIT = "chat_limit";

    static final String STAGE = "reclustering";
    static final int SINGLE_CLUSTER_THRESHOLD = 3;

    static final String MATCHING_PROMPT = """
        You are a legal document categorization expert for a law firm.
        Match each document annotation (a reviewer's description of what the document really is)
        to the existing cluster whose name describes the same document type.
        Be generous: an annotation such as "invoice" matches a cluster named "Invoices".
        If no cluster fits, list the document as unmatched.
        Answer with a single JSON object and nothing else:
        {"matches": [{"docId": "<document id>", "clusterId": "<cluster id>"}], "unmatched": ["<document id>"]}

        ## Documents
        %s

        ## Existing clusters
        %s
        """;

    static final String GROUPING_PROMPT = """
        You are a legal document categorization expert for a law firm.
        Group these documents by the document type their annotations describe.
        Name each group in %s using formal legal terminology. Prefer groups of two or more
        documents and put unclear annotations into a group named "%s".
        Answer with a single JSON object and nothing else:
        {"groups": [{"name": "<group name>", "docIds": ["<document id>"]}]}

        ## Documents
        %s
        """;

    private final DocumentRepository documentRepository;
    private final ClusterRepository clusterRepository;
    private final SessionRepository sessionRepository;
    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;
    private final JsonObjectExtractor jsonExtractor;
    private final ProgressReporter progressReporter;
    private final PipelineProperties properties;

    public ReclusterService(
        DocumentRepository documentRepository,
        ClusterRepository clusterRepository,
        SessionRepository sessionRepository,
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter,
        JsonObjectExtractor jsonExtractor,
        ProgressReporter progressReporter,
        PipelineProperties properties
    ) {
        this.documentRepository = documentRepository;
        this.clusterRepository = clusterRepository;
        this.sessionRepository = sessionRepository;
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
        this.jsonExtractor = jsonExtractor;
        this.progressReporter = progressReporter;
        this.properties = properties;
    }

    record Match(UUID documentId, UUID clusterId) {}

    record NewGroup(String name, List<UUID> documentIds) {}

    public ReclusterStats recluster(UUID sessionId) {
        List<ExtractedDocument> reclassified = documentRepository.findReclassified(sessionId);
        if (reclassified.isEmpty()) {
            log.info("Session {} has no reclassified documents", sessionId);
            ReclusterStats stats = new ReclusterStats(0, 0, 0, 0);
            sessionRepository.updateSessionStats(sessionId, stats);
            return stats;
        }

        int total = reclassified.size();
        progressReporter.report(sessionId, STAGE, 0, total, "Matching documents to clusters");

        List<DocumentCluster> existing = clusterRepository.findActiveNamed(sessionId);
        List<Match> matches = existing.isEmpty() ? List.of() : matchToClusters(reclassified, existing);

        Map<UUID, List<UUID>> byCluster = matches.stream().collect(Collectors.groupingBy(
            Match::clusterId, LinkedHashMap::new, Collectors.mapping(Match::documentId, Collectors.toList())));
        int matched = 0;
        for (Map.Entry<UUID, List<UUID>> entry : byCluster.entrySet()) {
            matched += documentRepository.reassignToCluster(entry.getValue(), entry.getKey());
            clusterRepository.refreshDocumentCount(entry.getKey());
        }
        progressReporter.report(sessionId, STAGE, matched, total, "Matched " + matched + " documents to existing clusters");

        Set<UUID> matchedIds = matches.stream().map(Match::documentId).collect(Collectors.toSet());
        List<ExtractedDocument> unmatched = reclassified.stream()
            .filter(document -> !matchedIds.contains(document.id()))
            .toList();

        int created = 0;
        if (!unmatched.isEmpty()) {
            progressReporter.report(sessionId, STAGE, matched, total,
                "Creating new clusters for " + unmatched.size() + " unmatched documents");
            for (NewGroup group : groupUnmatched(unmatched)) {
                DocumentCluster cluster = clusterRepository.createNamedCluster(sessionId, group.name(), group.documentIds());
                documentRepository.reassignToCluster(group.documentIds(), cluster.id());
                clusterRepository.refreshDocumentCount(cluster.id());
                created++;
            }
        }

        ReclusterStats stats = new ReclusterStats(total, matched, created, unmatched.size());
        sessionRepository.updateSessionStats(sessionId, stats);
        progressReporter.report(sessionId, STAGE, total, total, "Re-clustering complete");
        log.info("Session {} re-clustered: {} matched to existing clusters, {} new clusters for {} documents",
            sessionId, matched, created, unmatched.size());
        return stats;
    }

    List<Match> matchToClusters(List<ExtractedDocument> documents, List<DocumentCluster> clusters) {
        String documentSection = documents.stream()
            .map(document -> "- Doc ID: " + document.id() + "\n  File: " + document.fileName()
                + "\n  Annotation: \"" + annotationOf(document) + "\"")
            .collect(Collectors.joining("\n\n"));
        String clusterSection = clusters.stream()
            .map(cluster -> "- Cluster ID: " + cluster.id() + "\n  Name: \"" + cluster.suggestedName() + "\"")
            .collect(Collectors.joining("\n\n"));

        Optional<ObjectNode> response = ask(MATCHING_PROMPT.formatted(documentSection, clusterSection));
        if (response.isEmpty()) {
            return List.of();
        }

        Set<UUID> documentIds = documents.stream().map(ExtractedDocument::id).collect(Collectors.toSet());
        Set<UUID> clusterIds = clusters.stream().map(DocumentCluster::id).collect(Collectors.toSet());
        Map<UUID, Match> matches = new LinkedHashMap<>();

        for (JsonNode node : response.get().path("matches")) {
            Optional<UUID> documentId = uuid(node.path("docId").asText(null));
            Optional<UUID> clusterId = uuid(node.path("clusterId").asText(null));
            if (documentId.isPresent() && clusterId.isPresent()
                && documentIds.contains(documentId.get()) && clusterIds.contains(clusterId.get())) {
                matches.putIfAbsent(documentId.get(), new Match(documentId.get(), clusterId.get()));
            }
        }
        return List.copyOf(matches.values());
    }

    List<NewGroup> groupUnmatched(List<ExtractedDocument> documents) {
        List<UUID> allIds = documents.stream().map(ExtractedDocument::id).toList();
        String reviewName = properties.naming().reviewClusterName();
        List<NewGroup> fallback = List.of(new NewGroup(reviewName, allIds));

        if (documents.size() <= SINGLE_CLUSTER_THRESHOLD) {
            return fallback;
        }

        String documentSection = documents.stream()
            .map(document -> "- Doc ID: " + document.id() + "\n  File: " + document.fileName()
                + "\n  Annotation: \"" + annotationOf(document) + "\"")
            .collect(Collectors.joining("\n\n"));

        Optional<ObjectNode> response = ask(
            GROUPING_PROMPT.formatted(properties.naming().language(), reviewName, documentSection));
        if (response.isEmpty()) {
            return fallback;
        }

        Set<UUID> remaining = new LinkedHashSet<>(allIds);
        List<NewGroup> groups = new ArrayList<>();
        for (JsonNode node : response.get().path("groups")) {
            String name = node.path("name").asText("").strip();
            List<UUID> members = new ArrayList<>();
            for (JsonNode id : node.path("docIds")) {
                uuid(id.asText(null)).filter(remaining::remove).ifPresent(members::add);
            }
            if (!members.isEmpty()) {
                groups.add(new NewGroup(name.isEmpty() ? reviewName : name, List.copyOf(members)));
            }
        }

        if (groups.isEmpty()) {
            return fallback;
        }
        if (!remaining.isEmpty()) {
            groups.add(new NewGroup(reviewName, List.copyOf(remaining)));
        }
        return groups;
    }

    private Optional<ObjectNode> ask(String prompt) {
        try {
            String answer = chatLimiter.execute(CHAT_LIMIT, 1, () -> chatModel.chat(prompt));
            Optional<ObjectNode> json = jsonExtractor.firstObject(answer);
            if (json.isEmpty()) {
                log.warn("Chat model answer contained no JSON object");
            }
            return json;
        } catch (RuntimeException e) {
            log.error("Chat model call failed during re-clustering: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    private static String annotationOf(ExtractedDocument document) {
        String note = document.reclassificationNote();
        return note == null || note.isBlank() ? "No annotation" : note.replace('"', '\'');
    }

    private static Optional<UUID> uuid(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value.strip()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
