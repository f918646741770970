package com.archivist.taxonomy.batch;

public record RequestCounts(
    int processing,
    int succeeded,
    int errored,
    int canceled,
    int expired
) {

    public static final RequestCounts EMPTY = new RequestCounts(0, 0, 0, 0, 0);

    public int total() {
        return processing + succeeded + errored + canceled + expired;
    }
}
