package com.prague.apartments.crawl.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.prague.apartments.config.CrawlerProperties;
import com.prague.apartments.crawl.extract.ListingFieldExtractor;
import com.prague.apartments.crawl.extract.SrealityEstateParser;
import com.prague.apartments.crawl.http.SrealityEstatesClient;
import com.prague.apartments.crawl.model.HttpFetchResult;
import com.prague.apartments.crawl.model.IngestionSummary;
import com.prague.apartments.crawl.model.Listing;
import com.prague.apartments.crawl.model.NormalizedListing;
import com.prague.apartments.crawl.persistence.DuplicateListingException;
import com.prague.apartments.crawl.persistence.ListingJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.List;

/**
 * One ingestion run: fetch a page of listings, keep the Prague ones that are not stored yet,
 * and insert them in a single transaction.
 */
@Service
public class ListingIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ListingIngestionService.class);

    private final SrealityEstatesClient estatesClient;
    private final SrealityEstateParser estateParser;
    private final ListingFieldExtractor fieldExtractor;
    private final ListingJdbcRepository repository;
    private final TransactionOperations transactionOperations;
    private final CrawlerProperties properties;

    public ListingIngestionService(
        SrealityEstatesClient estatesClient,
        SrealityEstateParser estateParser,
        ListingFieldExtractor fieldExtractor,
        ListingJdbcRepository repository,
        TransactionOperations transactionOperations,
        CrawlerProperties properties
    ) {
        this.estatesClient = estatesClient;
        this.estateParser = estateParser;
        this.fieldExtractor = fieldExtractor;
        this.repository = repository;
        this.transactionOperations = transactionOperations;
        this.properties = properties;
    }

    /**
     * Runs the pipeline once and returns how many listings were stored.
     */
    public int runOnce() {
        return ingest().inserted();
    }

    /**
     * Runs the pipeline once. A failed or unreadable fetch yields an empty summary and leaves
     * the store untouched; storage failures other than duplicates propagate and roll the run back.
     */
    public IngestionSummary ingest() {
        HttpFetchResult result = estatesClient.fetchEstates();
        if (result == null || !result.isSuccessful()) {
            String reason = result == null ? "no_response" : result.failureReason();
            log.warn(
                "Failed to fetch listings from {}: {} {}",
                result == null ? null : result.requestedUrl(),
                reason,
                result == null || result.errorMessage() == null ? "" : result.errorMessage()
            );
            return IngestionSummary.failedFetch(reason);
        }

        List<JsonNode> estates;
        try {
            estates = estateParser.estates(result.body());
        } catch (JsonProcessingException e) {
            log.warn("Listing source returned an unreadable body from {}", result.requestedUrl(), e);
            return IngestionSummary.failedFetch("invalid_json");
        }

        IngestionSummary summary = transactionOperations.execute(status -> storeNewListings(estates));
        log.info(
            "Ingestion run finished: fetched={} skippedLocality={} skippedMissingId={} skippedDuplicate={} inserted={}",
            summary.fetched(),
            summary.skippedLocality(),
            summary.skippedMissingId(),
            summary.skippedDuplicate(),
            summary.inserted()
        );
        return summary;
    }

    private IngestionSummary storeNewListings(List<JsonNode> estates) {
        int skippedLocality = 0;
        int skippedMissingId = 0;
        int skippedDuplicate = 0;
        int inserted = 0;
        String defaultPriceUnit = properties.getUpstream().getDefaultPriceUnit();

        for (JsonNode estate : estates) {
            String locality = estateParser.locality(estate);
            if (!fieldExtractor.isPragueLocality(locality)) {
                skippedLocality++;
                continue;
            }
            Long externalId = estateParser.externalId(estate);
            if (externalId == null) {
                skippedMissingId++;
                continue;
            }
            if (repository.existsByExternalId(externalId)) {
                skippedDuplicate++;
                continue;
            }

            NormalizedListing listing = estateParser.normalize(estate, externalId, defaultPriceUnit);
            try {
                Listing stored = repository.insert(listing, Instant.now());
                inserted++;
                log.info("Added new listing {} ({}) in {}", stored.title(), stored.externalId(), stored.locality());
            } catch (DuplicateListingException e) {
                skippedDuplicate++;
                log.warn("Listing {} was stored concurrently; treating it as existing", e.getExternalId());
            }
        }
        return new IngestionSummary(
            estates.size(),
            skippedLocality,
            skippedMissingId,
            skippedDuplicate,
            inserted,
            false,
            null
        );
    }
}
