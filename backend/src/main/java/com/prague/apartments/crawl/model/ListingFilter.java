package com.prague.apartments.crawl.model;

public record ListingFilter(
    Long minPrice,
    Long maxPrice,
    Integer minSize,
    Integer maxSize,
    Boolean hasGarage,
    String roomLayout
) {
    public static ListingFilter none() {
        return new ListingFilter(null, null, null, null, null, null);
    }
}
