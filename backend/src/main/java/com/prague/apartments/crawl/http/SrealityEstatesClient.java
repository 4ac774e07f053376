package com.prague.apartments.crawl.http;

import com.prague.apartments.config.CrawlerProperties;
import com.prague.apartments.crawl.model.HttpFetchResult;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class SrealityEstatesClient {
    private static final String ACCEPT_JSON = "application/json";

    private final UpstreamHttpClient httpClient;
    private final CrawlerProperties properties;

    public SrealityEstatesClient(UpstreamHttpClient httpClient, CrawlerProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    /**
     * Fetches the configured page of apartments-for-rent. Only one page is ever requested per run.
     */
    public HttpFetchResult fetchEstates() {
        return httpClient.get(estatesUrl(), ACCEPT_JSON);
    }

    String estatesUrl() {
        CrawlerProperties.Upstream upstream = properties.getUpstream();
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(upstream.getBaseUrl());
        if (upstream.getCategoryMain() > 0) {
            builder.queryParam("category_main_cb", upstream.getCategoryMain());
        }
        return builder
            .queryParam("category_sub_cb", upstream.getCategorySub())
            .queryParam("category_type_cb", upstream.getCategoryType())
            .queryParam("page", upstream.getPage())
            .build()
            .toUriString();
    }
}
