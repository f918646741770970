package com.archivist.taxonomy.model;

import java.util.EnumMap;
import java.util.Map;

public record TriageCounts(Map<TriageStatus, Integer> byStatus, int untriaged) {

    public TriageCounts {
        EnumMap<TriageStatus, Integer> copy = new EnumMap<>(TriageStatus.class);
        copy.putAll(byStatus);
        byStatus = copy;
    }

    public int count(TriageStatus status) {
        return byStatus.getOrDefault(status, 0);
    }
}
