package com.archivist.taxonomy.service;

import com.archivist.taxonomy.model.DocumentVector;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public interface DimensionReducer {

    Map<UUID, float[]> reduce(List<DocumentVector> vectors);
}
