package com.prague.apartments.crawl.service;

import com.prague.apartments.config.CrawlerProperties;
import com.prague.apartments.crawl.model.IngestionSummary;
import com.prague.apartments.crawl.model.SchedulerStatusResponse;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls the listing source on a fixed delay from a single worker thread. Failures of one run
 * are logged and never end the loop; {@link #stop()} interrupts the sleep and any in-flight fetch.
 */
@Service
public class IngestionScheduler {
    private static final Logger log = LoggerFactory.getLogger(IngestionScheduler.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final ListingIngestionService ingestionService;
    private final CrawlerProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong runsCompleted = new AtomicLong();
    private final AtomicLong runsFailed = new AtomicLong();
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;
    private AtomicBoolean loopActive;
    private volatile Instant lastRunStartedAt;
    private volatile Instant lastRunFinishedAt;
    private volatile Integer lastRunInserted;
    private volatile String lastError;

    public IngestionScheduler(ListingIngestionService ingestionService, CrawlerProperties properties) {
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getCli().isRun()) {
            log.info("CLI run requested; ingestion scheduler not started");
            return;
        }
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public SchedulerStatusResponse getStatus() {
        return new SchedulerStatusResponse(
            running.get(),
            properties.getScheduler().getIntervalMs(),
            runsCompleted.get(),
            runsFailed.get(),
            lastRunStartedAt,
            lastRunFinishedAt,
            lastRunInserted,
            lastError
        );
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int intervalMs = properties.getScheduler().getIntervalMs();
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("ingestion-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            AtomicBoolean active = new AtomicBoolean(true);
            loopActive = active;
            running.set(true);
            executor.submit(() -> pollLoop(active, intervalMs));
            log.info("Ingestion scheduler started with interval {} ms", intervalMs);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (loopActive != null) {
                loopActive.set(false);
                loopActive = null;
            }
            if (executor != null) {
                executor.shutdownNow();
                try {
                    if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                        log.warn("Ingestion scheduler did not stop within 5 seconds");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Ingestion scheduler stopped");
        }
    }

    private void pollLoop(AtomicBoolean active, int intervalMs) {
        while (active.get() && !Thread.currentThread().isInterrupted()) {
            runTick();
            sleep(intervalMs);
        }
    }

    void runTick() {
        lastRunStartedAt = Instant.now();
        try {
            IngestionSummary summary = ingestionService.ingest();
            lastRunInserted = summary.inserted();
            lastError = summary.fetchFailed() ? summary.errorCode() : null;
            runsCompleted.incrementAndGet();
            log.info("Crawled {} new listings at {}", summary.inserted(), Instant.now());
        } catch (Exception e) {
            runsFailed.incrementAndGet();
            lastRunInserted = null;
            lastError = truncate("exception=" + e.getClass().getSimpleName() + ": " + e.getMessage());
            log.warn("Scheduled ingestion run failed", e);
        } finally {
            lastRunFinishedAt = Instant.now();
        }
    }

    private String truncate(String value) {
        if (value.length() > MAX_ERROR_LENGTH) {
            return value.substring(0, MAX_ERROR_LENGTH);
        }
        return value;
    }

    private void sleep(int intervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(100, intervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
