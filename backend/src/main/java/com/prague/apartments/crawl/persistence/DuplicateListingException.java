package com.prague.apartments.crawl.persistence;

/**
 * Raised when the unique constraint on {@code external_id} rejects an insert.
 */
public class DuplicateListingException extends RuntimeException {
    private final long externalId;

    public DuplicateListingException(long externalId, Throwable cause) {
        super("Listing already stored for external id " + externalId, cause);
        this.externalId = externalId;
    }

    public long getExternalId() {
        return externalId;
    }
}
