package com.prague.apartments.crawl.model;

import java.util.List;

/**
 * A listing derived from one upstream record, not yet stored.
 */
public record NormalizedListing(
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
    List<String> images
) {
    public NormalizedListing {
        images = images == null ? List.of() : List.copyOf(images);
    }
}
