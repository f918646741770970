package com.archivist.taxonomy.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record StatusTransition(
    Set<PipelineStatus> from,
    PipelineStatus to,
    String error,
    boolean startsRun
) {

    public StatusTransition {
        if (from == null || from.isEmpty()) {
            throw new IllegalArgumentException("Transition needs at least one source status");
        }
        from = Collections.unmodifiableSet(EnumSet.copyOf(from));
    }

    public static StatusTransition start(Set<PipelineStatus> from, PipelineStatus to) {
        return new StatusTransition(from, to, null, true);
    }

    public static StatusTransition advance(PipelineStatus from, PipelineStatus to) {
        return new StatusTransition(EnumSet.of(from), to, null, false);
    }

    public static StatusTransition complete(PipelineStatus from, PipelineStatus to) {
        return new StatusTransition(EnumSet.of(from), to, null, false);
    }

    public static StatusTransition fail(PipelineStatus from, String error) {
        return new StatusTransition(EnumSet.of(from), PipelineStatus.FAILED, error, false);
    }

    public boolean terminal() {
        return to.isTerminal();
    }
}
