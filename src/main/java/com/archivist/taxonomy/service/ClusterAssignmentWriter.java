package com.archivist.taxonomy.service;

import com.archivist.taxonomy.model.ClusterAssignment;
import com.archivist.taxonomy.model.DocumentCluster;
import com.archivist.taxonomy.repository.ClusterRepository;
import com.archivist.taxonomy.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterAssignmentWriter {

    private final DocumentRepository documentRepository;
    private final ClusterRepository clusterRepository;

    @Transactional
    public List<DocumentCluster> replaceClusters(UUID sessionId, ClusteringResult result, int sampleSize) {
        documentRepository.clearClusterAssignments(sessionId);
        clusterRepository.deleteBySession(sessionId);

        List<DocumentCluster> created = new ArrayList<>();
        List<ClusterAssignment> assignments = new ArrayList<>();

        for (ClusteringResult.Group group : result.clusters()) {
            DocumentCluster cluster = clusterRepository.createCluster(sessionId, group.memberIds(), false, group.nearest(sampleSize));
            created.add(cluster);
            group.members().forEach(member ->
                assignments.add(new ClusterAssignment(member.documentId(), cluster.id(), member.confidence())));
        }

        if (!result.noise().isEmpty()) {
            DocumentCluster noise = clusterRepository.createCluster(sessionId, result.noise(), true, List.of());
            created.add(noise);
            result.noise().forEach(documentId -> assignments.add(new ClusterAssignment(documentId, noise.id(), 0.0)));
        }

        documentRepository.assignClusters(assignments);
        log.debug("Session {}: wrote {} clusters and {} assignments", sessionId, created.size(), assignments.size());
        return created;
    }
}
