package com.archivist.taxonomy.model;

import java.util.UUID;

public record DocumentVector(UUID documentId, float[] vector) {}
