package com.prague.apartments.crawl.model;

public record MessageResponse(String message) {
}
