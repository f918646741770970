package com.archivist.taxonomy.infra;

import java.util.ArrayList;
import java.util.List;

public final class Partitions {

    private Partitions() {
    }

    public static <T> List<List<T>> of(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Partition size must be positive: " + size);
        }
        List<List<T>> partitions = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            partitions.add(List.copyOf(items.subList(start, Math.min(start + size, items.size()))));
        }
        return partitions;
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
