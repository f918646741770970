package com.archivist.taxonomy.model;

import java.util.UUID;

public record ClusterAssignment(UUID documentId, UUID clusterId, double confidence) {}
