package com.archivist.taxonomy.batch;

import java.util.List;

public record DispatchReport(
    int submitted,
    int completed,
    int incomplete,
    int failed,
    int rejected,
    List<String> pendingHandles
) {

    public static final DispatchReport EMPTY = new DispatchReport(0, 0, 0, 0, 0, List.of());

    public int failedOrRejected() {
        return failed + rejected;
    }
}
