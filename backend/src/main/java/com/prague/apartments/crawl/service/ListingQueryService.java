package com.prague.apartments.crawl.service;

import com.prague.apartments.config.CrawlerProperties;
import com.prague.apartments.crawl.model.Listing;
import com.prague.apartments.crawl.model.ListingFilter;
import com.prague.apartments.crawl.model.ListingStats;
import com.prague.apartments.crawl.persistence.ListingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;

@Service
public class ListingQueryService {
    private static final Logger log = LoggerFactory.getLogger(ListingQueryService.class);

    private final ListingJdbcRepository repository;
    private final ListingIngestionService ingestionService;
    private final ExecutorService crawlTriggerExecutor;
    private final CrawlerProperties properties;

    public ListingQueryService(
        ListingJdbcRepository repository,
        ListingIngestionService ingestionService,
        @Qualifier("crawlTriggerExecutor") ExecutorService crawlTriggerExecutor,
        CrawlerProperties properties
    ) {
        this.repository = repository;
        this.ingestionService = ingestionService;
        this.crawlTriggerExecutor = crawlTriggerExecutor;
        this.properties = properties;
    }

    public List<Listing> getListings(Integer skip, Integer limit, ListingFilter filter) {
        int safeSkip = skip == null ? 0 : Math.max(0, skip);
        int safeLimit = limit == null
            ? properties.getApi().getDefaultLimit()
            : Math.max(1, Math.min(limit, properties.getApi().getMaxLimit()));
        return repository.findFiltered(filter, safeSkip, safeLimit);
    }

    public Listing getListing(long id) {
        Listing listing = repository.findById(id);
        if (listing == null) {
            throw new ListingNotFoundException("Apartment not found: " + id);
        }
        return listing;
    }

    public List<Listing> getNewListings(Integer hours) {
        int safeHours = hours == null ? properties.getApi().getDefaultNewHours() : Math.max(1, hours);
        Instant cutoff = Instant.now().minus(Duration.ofHours(safeHours));
        return repository.findCreatedSince(cutoff);
    }

    public ListingStats getStats() {
        ListingStats raw = repository.stats();
        return new ListingStats(
            raw.totalListings(),
            round2(raw.averagePrice()),
            round2(raw.averageSize()),
            raw.listingsWithGarage()
        );
    }

    /**
     * Submits one ingestion run and returns without waiting. The caller gets no result;
     * a failure is only logged.
     */
    public void triggerIngestion() {
        crawlTriggerExecutor.submit(() -> {
            try {
                int inserted = ingestionService.runOnce();
                log.info("Manually triggered ingestion stored {} new listings", inserted);
            } catch (Exception e) {
                log.warn("Manually triggered ingestion failed", e);
            }
        });
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
