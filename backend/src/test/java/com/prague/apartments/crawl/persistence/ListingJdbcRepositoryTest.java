package com.prague.apartments.crawl.persistence;

import com.prague.apartments.crawl.model.Listing;
import com.prague.apartments.crawl.model.ListingFilter;
import com.prague.apartments.crawl.model.ListingStats;
import com.prague.apartments.crawl.model.NormalizedListing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ListingJdbcRepositoryTest {
    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private ListingJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @BeforeEach
    void clearListings() {
        jdbc.update("DELETE FROM listings", new MapSqlParameterSource());
    }

    @Test
    void insertedListingCanBeReadBack() {
        Listing stored = repository.insert(
            listing(501L, 25000L, 54, "2+kk", true, List.of("https://img/1.jpg", "https://img/2.jpg")),
            BASE
        );

        assertTrue(repository.existsByExternalId(501L));
        assertFalse(repository.existsByExternalId(502L));

        Listing loaded = repository.findById(stored.id());
        assertEquals(501L, loaded.externalId());
        assertEquals(25000L, loaded.price());
        assertEquals(54, loaded.sizeSqm());
        assertEquals("2+kk", loaded.roomLayout());
        assertTrue(loaded.hasGarage());
        assertEquals(50.08, loaded.latitude());
        assertEquals(List.of("https://img/1.jpg", "https://img/2.jpg"), loaded.images());
        assertEquals(BASE, loaded.createdAt());
        assertEquals(loaded.createdAt(), loaded.updatedAt());
    }

    @Test
    void nullableAttributesRoundTripAsNull() {
        NormalizedListing sparse = new NormalizedListing(
            601L, "Pronájem bytu", 0L, "za měsíc", "Praha", null, null, false, null, null, List.of()
        );
        Listing stored = repository.insert(sparse, BASE);

        Listing loaded = repository.findById(stored.id());
        assertNull(loaded.sizeSqm());
        assertNull(loaded.roomLayout());
        assertNull(loaded.latitude());
        assertNull(loaded.longitude());
        assertTrue(loaded.images().isEmpty());
    }

    @Test
    void secondInsertWithSameExternalIdIsRejected() {
        repository.insert(listing(701L, 20000L, 40, "1+kk", false, List.of()), BASE);

        DuplicateListingException ex = assertThrows(
            DuplicateListingException.class,
            () -> repository.insert(listing(701L, 21000L, 41, "1+kk", false, List.of()), BASE.plusSeconds(5))
        );
        assertEquals(701L, ex.getExternalId());
        assertEquals(1, repository.findFiltered(ListingFilter.none(), 0, 100).size());
    }

    @Test
    void missingIdReturnsNull() {
        assertNull(repository.findById(999_999L));
    }

    @Test
    void priceRangeIsInclusive() {
        repository.insert(listing(801L, 15000L, 30, "1+kk", false, List.of()), BASE);
        repository.insert(listing(802L, 20000L, 40, "1+1", false, List.of()), BASE.plusSeconds(1));
        repository.insert(listing(803L, 30000L, 60, "2+kk", true, List.of()), BASE.plusSeconds(2));
        repository.insert(listing(804L, 35000L, 80, "3+kk", true, List.of()), BASE.plusSeconds(3));

        List<Listing> rows = repository.findFiltered(
            new ListingFilter(20000L, 30000L, null, null, null, null),
            0,
            100
        );

        assertEquals(List.of(803L, 802L), rows.stream().map(Listing::externalId).toList());
    }

    @Test
    void filtersCombineAndExcludeUnknownSizes() {
        repository.insert(listing(901L, 20000L, 45, "2+kk", true, List.of()), BASE);
        repository.insert(listing(902L, 22000L, 70, "2+kk", true, List.of()), BASE.plusSeconds(1));
        repository.insert(listing(903L, 24000L, 50, "2+kk", false, List.of()), BASE.plusSeconds(2));
        repository.insert(listing(904L, 26000L, null, "2+kk", true, List.of()), BASE.plusSeconds(3));
        repository.insert(listing(905L, 28000L, 55, "3+1", true, List.of()), BASE.plusSeconds(4));

        List<Listing> rows = repository.findFiltered(
            new ListingFilter(null, null, 40, 60, true, "2+kk"),
            0,
            100
        );

        assertEquals(List.of(901L), rows.stream().map(Listing::externalId).toList());
    }

    @Test
    void resultsAreNewestFirstAndPaged() {
        for (int i = 0; i < 5; i++) {
            repository.insert(listing(1000L + i, 20000L, 40, "1+kk", false, List.of()), BASE.plusSeconds(i));
        }

        List<Listing> firstPage = repository.findFiltered(ListingFilter.none(), 0, 2);
        List<Listing> secondPage = repository.findFiltered(ListingFilter.none(), 2, 2);

        assertEquals(List.of(1004L, 1003L), firstPage.stream().map(Listing::externalId).toList());
        assertEquals(List.of(1002L, 1001L), secondPage.stream().map(Listing::externalId).toList());
    }

    @Test
    void createdSinceIncludesBoundary() {
        repository.insert(listing(1101L, 20000L, 40, "1+kk", false, List.of()), BASE.minusSeconds(3600));
        repository.insert(listing(1102L, 20000L, 40, "1+kk", false, List.of()), BASE);
        repository.insert(listing(1103L, 20000L, 40, "1+kk", false, List.of()), BASE.plusSeconds(60));

        List<Listing> rows = repository.findCreatedSince(BASE);

        assertEquals(List.of(1103L, 1102L), rows.stream().map(Listing::externalId).toList());
    }

    @Test
    void statsOnEmptyStoreAreZero() {
        ListingStats stats = repository.stats();

        assertEquals(0L, stats.totalListings());
        assertEquals(0.0, stats.averagePrice());
        assertEquals(0.0, stats.averageSize());
        assertEquals(0L, stats.listingsWithGarage());
    }

    @Test
    void statsAverageOnlyKnownSizes() {
        repository.insert(listing(1201L, 20000L, 40, "1+kk", true, List.of()), BASE);
        repository.insert(listing(1202L, 30000L, 60, "2+kk", false, List.of()), BASE);
        repository.insert(listing(1203L, 25000L, null, null, true, List.of()), BASE);

        ListingStats stats = repository.stats();

        assertEquals(3L, stats.totalListings());
        assertEquals(25000.0, stats.averagePrice(), 0.001);
        assertEquals(50.0, stats.averageSize(), 0.001);
        assertEquals(2L, stats.listingsWithGarage());
    }

    private NormalizedListing listing(
        long externalId,
        long price,
        Integer size,
        String layout,
        boolean garage,
        List<String> images
    ) {
        return new NormalizedListing(
            externalId,
            "Pronájem bytu " + (layout == null ? "" : layout),
            price,
            "za měsíc",
            "Praha 5 - Smíchov",
            size,
            layout,
            garage,
            50.08,
            14.42,
            images
        );
    }
}
