package com.prague.apartments.crawl.model;

import java.time.Instant;
import java.util.List;

public record Listing(
    long id,
    long externalId,
    String title,
    long price,
    String priceUnit,
    String locality,
    Integer sizeSqm,
    String roomLayout,
    boolean hasGarage,
    Double latitude,
    Double longitude,
    List<String> images,
    Instant createdAt,
    Instant updatedAt
) {
}
