package com.archivist.taxonomy.model;

public record TriageStats(
    int firmDrafted,
    int thirdParty,
    int irrelevant,
    int courtDoc,
    int uncertain,
    int untriaged,
    int batchesSubmitted,
    int batchesIncomplete,
    int batchesFailed
) implements StageStats {

    public static TriageStats of(TriageCounts counts, int batchesSubmitted, int batchesIncomplete, int batchesFailed) {
        return new TriageStats(
            counts.count(TriageStatus.FIRM_DRAFTED),
            counts.count(TriageStatus.THIRD_PARTY),
            counts.count(TriageStatus.IRRELEVANT),
            counts.count(TriageStatus.COURT_DOC),
            counts.count(TriageStatus.UNCERTAIN),
            counts.untriaged(),
            batchesSubmitted,
            batchesIncomplete,
            batchesFailed
        );
    }

    public int triaged() {
        return firmDrafted + thirdParty + irrelevant + courtDoc + uncertain;
    }

    @Override
    public String key() {
        return "triage";
    }
}
