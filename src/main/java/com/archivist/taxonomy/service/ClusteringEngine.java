package com.archivist.taxonomy.service;

import java.util.Map;
import java.util.UUID;

public interface ClusteringEngine {

    ClusteringResult cluster(Map<UUID, float[]> points);
}
