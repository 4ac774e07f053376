package com.prague.apartments.crawl.model;

import java.time.Instant;

public record SchedulerStatusResponse(
    boolean running,
    int intervalMs,
    long runsCompleted,
    long runsFailed,
    Instant lastRunStartedAt,
    Instant lastRunFinishedAt,
    Integer lastRunInserted,
    String lastError
) {
}
