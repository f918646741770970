package com.archivist.taxonomy.service;

import com.archivist.taxonomy.config.PipelineProperties;
import com.archivist.taxonomy.model.ClusterStats;
import com.archivist.taxonomy.model.DocumentVector;
import com.archivist.taxonomy.repository.DocumentRepository;
import com.archivist.taxonomy.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClusteringService {

    static final String STAGE = "clustering";

    private final DocumentRepository documentRepository;
    private final SessionRepository sessionRepository;
    private final DimensionReducer dimensionReducer;
    private final ClusteringEngine clusteringEngine;
    private final ClusterAssignmentWriter assignmentWriter;
    private final ProgressReporter progressReporter;
    private final PipelineProperties properties;

    public boolean needsClustering(UUID sessionId) {
        return documentRepository.countClusterCandidatesWithoutCluster(sessionId) > 0;
    }

    public Map<UUID, float[]> reduce(UUID sessionId) {
        List<DocumentVector> vectors = documentRepository.findEmbedded(sessionId);
        progressReporter.report(sessionId, "reduction", 0, vectors.size(), "Reducing " + vectors.size() + " vectors");
        Map<UUID, float[]> reduced = dimensionReducer.reduce(vectors);
        progressReporter.report(sessionId, "reduction", reduced.size(), vectors.size(), "Reduction finished");
        return reduced;
    }

    public ClusterStats cluster(UUID sessionId, Map<UUID, float[]> reduced) {
        ClusteringResult result = clusteringEngine.cluster(reduced);
        assignmentWriter.replaceClusters(sessionId, result, properties.naming().sampleSize());

        int clusterCount = result.clusters().size();
        int clustered = result.clusteredCount();
        int largest = result.clusters().stream().mapToInt(ClusteringResult.Group::size).max().orElse(0);
        double average = clusterCount == 0 ? 0.0 : (double) clustered / clusterCount;
        int dimensions = reduced.isEmpty() ? 0 : reduced.values().iterator().next().length;

        ClusterStats stats = new ClusterStats(clusterCount, result.noise().size(), average, largest,
            clustered, dimensions, result.epsilon());
        sessionRepository.updateSessionStats(sessionId, stats);
        progressReporter.report(sessionId, STAGE, reduced.size(), reduced.size(),
            clusterCount + " clusters, " + result.noise().size() + " noise");

        log.info("Session {}: {} clusters (largest {}, average {}), {} noise documents",
            sessionId, clusterCount, largest, String.format("%.1f", average), result.noise().size());
        return stats;
    }
}
