package com.archivist.taxonomy.service;

import com.archivist.taxonomy.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Component
public class DbscanClusteringEngine implements ClusteringEngine {

    private static final double MIN_EPSILON = 1e-6;

    private final PipelineProperties.Clustering settings;
    private final EuclideanDistance distance = new EuclideanDistance();

    public DbscanClusteringEngine(PipelineProperties properties) {
        this.settings = properties.clustering();
    }

    /**
     * Identity-based point: DBSCAN tracks visited points in a hash map, and
     * documents with identical vectors must stay distinct.
     */
    private static final class DocumentPoint implements Clusterable {
        private final UUID documentId;
        private final double[] point;

        private DocumentPoint(UUID documentId, float[] vector) {
            this.documentId = documentId;
            this.point = new double[vector.length];
            for (int i = 0; i < vector.length; i++) {
                this.point[i] = vector[i];
            }
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }

    @Override
    public ClusteringResult cluster(Map<UUID, float[]> points) {
        List<DocumentPoint> input = new ArrayList<>(points.size());
        points.forEach((id, vector) -> input.add(new DocumentPoint(id, vector)));

        if (input.size() < settings.minClusterSize()) {
            log.info("{} points is below the minimum cluster size {}; everything is noise",
                input.size(), settings.minClusterSize());
            return new ClusteringResult(List.of(), input.stream().map(p -> p.documentId).toList(), 0.0);
        }

        double epsilon = settings.epsilon() > 0 ? settings.epsilon() : estimateEpsilon(input);
        int minNeighbours = settings.minClusterSize() - 1;

        DBSCANClusterer<DocumentPoint> clusterer = new DBSCANClusterer<>(epsilon, minNeighbours, distance);
        List<Cluster<DocumentPoint>> found = clusterer.cluster(input);

        List<ClusteringResult.Group> groups = new ArrayList<>();
        Set<DocumentPoint> clustered = new HashSet<>();
        for (Cluster<DocumentPoint> cluster : found) {
            if (cluster.getPoints().size() < settings.minClusterSize()) {
                continue;
            }
            groups.add(toGroup(cluster.getPoints()));
            clustered.addAll(cluster.getPoints());
        }

        groups.sort(Comparator.comparingInt(ClusteringResult.Group::size).reversed()
            .thenComparing(group -> group.members().get(0).documentId().toString()));

        List<UUID> noise = input.stream()
            .filter(point -> !clustered.contains(point))
            .map(point -> point.documentId)
            .toList();

        log.info("DBSCAN (eps={}, minPts={}) found {} clusters and {} noise points among {}",
            epsilon, minNeighbours, groups.size(), noise.size(), input.size());
        return new ClusteringResult(groups, noise, epsilon);
    }

    // Confidence falls linearly from 1 at the centroid to 0.5 at the farthest member.
    private ClusteringResult.Group toGroup(List<DocumentPoint> members) {
        int dimensions = members.get(0).point.length;
        double[] centroid = new double[dimensions];
        for (DocumentPoint member : members) {
            for (int i = 0; i < dimensions; i++) {
                centroid[i] += member.point[i];
            }
        }
        for (int i = 0; i < dimensions; i++) {
            centroid[i] /= members.size();
        }

        record Ranked(DocumentPoint point, double distance) {}

        List<Ranked> ranked = members.stream()
            .map(member -> new Ranked(member, distance.compute(member.point, centroid)))
            .sorted(Comparator.comparingDouble(Ranked::distance)
                .thenComparing(r -> r.point().documentId.toString()))
            .toList();

        double maxDistance = ranked.get(ranked.size() - 1).distance();
        List<ClusteringResult.Member> result = ranked.stream()
            .map(r -> new ClusteringResult.Member(r.point().documentId,
                maxDistance > 0 ? 1.0 - 0.5 * (r.distance() / maxDistance) : 1.0))
            .toList();
        return new ClusteringResult.Group(result);
    }

    // Percentile of each sampled point's distance to its k-th nearest neighbour.
    private double estimateEpsilon(List<DocumentPoint> points) {
        int k = Math.max(1, settings.minClusterSize() - 1);
        int sampleSize = Math.min(points.size(), settings.epsilonSampleSize());
        double stride = (double) points.size() / sampleSize;

        double[] kDistances = new double[sampleSize];
        for (int s = 0; s < sampleSize; s++) {
            DocumentPoint sample = points.get((int) (s * stride));
            double[] distances = new double[points.size() - 1];
            int n = 0;
            for (DocumentPoint other : points) {
                if (other != sample) {
                    distances[n++] = distance.compute(sample.point, other.point);
                }
            }
            Arrays.sort(distances);
            kDistances[s] = distances[Math.min(k, distances.length) - 1];
        }

        Arrays.sort(kDistances);
        int index = (int) Math.round(settings.epsilonPercentile() * (kDistances.length - 1));
        double epsilon = Math.max(MIN_EPSILON, kDistances[index]);
        log.debug("Estimated epsilon {} from {} sampled {}-NN distances", epsilon, sampleSize, k);
        return epsilon;
    }
}
