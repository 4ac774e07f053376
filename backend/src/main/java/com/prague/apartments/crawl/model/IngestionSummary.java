package com.prague.apartments.crawl.model;

public record IngestionSummary(
    int fetched,
    int skippedLocality,
    int skippedMissingId,
    int skippedDuplicate,
    int inserted,
    boolean fetchFailed,
    String errorCode
) {
    public static IngestionSummary failedFetch(String errorCode) {
        return new IngestionSummary(0, 0, 0, 0, 0, true, errorCode);
    }
}
