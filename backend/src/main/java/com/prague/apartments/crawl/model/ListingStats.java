package com.prague.apartments.crawl.model;

public record ListingStats(
    long totalListings,
    double averagePrice,
    double averageSize,
    long listingsWithGarage
) {
}
