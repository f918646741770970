package com.archivist.taxonomy.service;

import com.archivist.taxonomy.model.ClusterStats;
import com.archivist.taxonomy.model.DocumentCluster;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.support.TestPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.archivist.taxonomy.support.ClusterFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;

class ClusteringServiceTest {

    private TestPipeline pipeline;
    private UUID sessionId;
    private final List<ExtractedDocument> agreements = new ArrayList<>();
    private ExtractedDocument advice;

    @BeforeEach
    void setUp() {
        pipeline = new TestPipeline();
        sessionId = pipeline.store.newSession();
        for (int i = 0; i < 4; i++) {
            agreements.add(candidate(pipeline.store, sessionId, "sla" + i + ".docx", "Service agreement " + i));
        }
        advice = candidate(pipeline.store, sessionId, "advice.docx", "Legal advice");
    }

    @Test
    @DisplayName("Clusters, noise and stats are written for the embedded documents")
    void shouldClusterEmbeddedDocuments() {
        assertThat(pipeline.clusteringService.needsClustering(sessionId)).isTrue();

        Map<UUID, float[]> reduced = pipeline.clusteringService.reduce(sessionId);
        ClusterStats stats = pipeline.clusteringService.cluster(sessionId, reduced);

        assertThat(reduced).hasSize(5);
        assertThat(stats.clusterCount()).isEqualTo(1);
        assertThat(stats.noiseCount()).isEqualTo(1);
        assertThat(stats.largestClusterSize()).isEqualTo(4);
        assertThat(stats.clusteredDocuments()).isEqualTo(4);
        assertThat(stats.averageClusterSize()).isEqualTo(4.0);
        assertThat(stats.reducedDimensions()).isEqualTo(8);

        List<DocumentCluster> clusters = pipeline.store.clusters().findBySession(sessionId);
        assertThat(clusters).hasSize(2);
        DocumentCluster cluster = clusters.get(0);
        assertThat(cluster.noise()).isFalse();
        assertThat(cluster.documentCount()).isEqualTo(4);
        assertThat(cluster.sampleDocumentIds()).hasSize(3);
        assertThat(clusters.get(1).noise()).isTrue();

        assertThat(pipeline.store.document(advice.id()).clusterId()).isEqualTo(clusters.get(1).id());
        assertThat(pipeline.store.document(advice.id()).clusterConfidence()).isZero();
        assertThat(pipeline.store.document(agreements.get(0).id()).clusterConfidence()).isBetween(0.5, 1.0);
        assertThat(pipeline.clusteringService.needsClustering(sessionId)).isFalse();
    }

    @Test
    @DisplayName("Clustering again replaces the previous clusters")
    void shouldReplacePreviousClusters() {
        pipeline.clusteringService.cluster(sessionId, pipeline.clusteringService.reduce(sessionId));
        List<DocumentCluster> first = pipeline.store.clusters().findBySession(sessionId);

        pipeline.clusteringService.cluster(sessionId, pipeline.clusteringService.reduce(sessionId));

        List<DocumentCluster> second = pipeline.store.clusters().findBySession(sessionId);
        assertThat(second).hasSize(2);
        assertThat(second).extracting(DocumentCluster::id).doesNotContainAnyElementsOf(
            first.stream().map(DocumentCluster::id).toList());
    }

    @Test
    @DisplayName("A newly embedded document makes clustering necessary again")
    void shouldNeedClusteringForNewCandidates() {
        pipeline.clusteringService.cluster(sessionId, pipeline.clusteringService.reduce(sessionId));

        candidate(pipeline.store, sessionId, "claim.docx", "Claim form");

        assertThat(pipeline.clusteringService.needsClustering(sessionId)).isTrue();
    }
}
