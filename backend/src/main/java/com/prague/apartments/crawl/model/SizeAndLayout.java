package com.prague.apartments.crawl.model;

public record SizeAndLayout(
    Integer sizeSqm,
    String roomLayout
) {
}
