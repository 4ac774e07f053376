package com.prague.apartments.crawl.service;

import com.prague.apartments.config.CrawlerProperties;
import com.prague.apartments.crawl.model.IngestionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final ListingIngestionService ingestionService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        ListingIngestionService ingestionService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.ingestionService = ingestionService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        IngestionSummary summary = ingestionService.ingest();
        log.info(
            "CLI ingestion finished: fetchFailed={} errorCode={} fetched={} inserted={} duplicates={}",
            summary.fetchFailed(),
            summary.errorCode(),
            summary.fetched(),
            summary.inserted(),
            summary.skippedDuplicate()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
