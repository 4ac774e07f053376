package com.prague.apartments.crawl.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prague.apartments.crawl.model.Listing;
import com.prague.apartments.crawl.model.ListingFilter;
import com.prague.apartments.crawl.model.ListingStats;
import com.prague.apartments.crawl.model.NormalizedListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Repository
public class ListingJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ListingJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final String LISTING_COLUMNS = """
        id, external_id, title, price, price_unit, locality, size_sqm, room_layout,
        has_garage, latitude, longitude, images_json, created_at, updated_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public ListingJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean existsByExternalId(long externalId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", externalId);
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM listings
                WHERE external_id = :externalId
                """,
            params,
            Integer.class
        );
        return count != null && count > 0;
    }

    /**
     * Stores a new listing with {@code created_at} and {@code updated_at} both set to {@code now}.
     *
     * @throws DuplicateListingException if a listing with the same external id is already stored
     */
    public Listing insert(NormalizedListing listing, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", listing.externalId())
            .addValue("title", listing.title())
            .addValue("price", listing.price())
            .addValue("priceUnit", listing.priceUnit())
            .addValue("locality", listing.locality())
            .addValue("sizeSqm", listing.sizeSqm(), Types.INTEGER)
            .addValue("roomLayout", listing.roomLayout(), Types.VARCHAR)
            .addValue("hasGarage", listing.hasGarage())
            .addValue("latitude", listing.latitude(), Types.DOUBLE)
            .addValue("longitude", listing.longitude(), Types.DOUBLE)
            .addValue("imagesJson", writeJson(listing.images()), Types.VARCHAR)
            .addValue("createdAt", toTimestamp(now))
            .addValue("updatedAt", toTimestamp(now));

        String sql = """
            INSERT INTO listings (
                external_id, title, price, price_unit, locality, size_sqm, room_layout,
                has_garage, latitude, longitude, images_json, created_at, updated_at
            )
            VALUES (
                :externalId, :title, :price, :priceUnit, :locality, :sizeSqm, :roomLayout,
                :hasGarage, :latitude, :longitude, :imagesJson, :createdAt, :updatedAt
            )
            """;
        if (postgres) {
            sql = sql + "ON CONFLICT (external_id) DO NOTHING\n";
        }

        KeyHolder keyHolder = new GeneratedKeyHolder();
        int inserted;
        try {
            inserted = jdbc.update(sql, params, keyHolder, new String[]{"id"});
        } catch (DuplicateKeyException e) {
            throw new DuplicateListingException(listing.externalId(), e);
        }
        if (inserted == 0) {
            throw new DuplicateListingException(listing.externalId(), null);
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert listing " + listing.externalId());
        }
        return new Listing(
            key.longValue(),
            listing.externalId(),
            listing.title(),
            listing.price(),
            listing.priceUnit(),
            listing.locality(),
            listing.sizeSqm(),
            listing.roomLayout(),
            listing.hasGarage(),
            listing.latitude(),
            listing.longitude(),
            listing.images(),
            now,
            now
        );
    }

    public Listing findById(long id) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id);
        List<Listing> rows = jdbc.query(
            "SELECT " + LISTING_COLUMNS + " FROM listings WHERE id = :id",
            params,
            listingRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<Listing> findFiltered(ListingFilter filter, int offset, int limit) {
        ListingFilter safeFilter = filter == null ? ListingFilter.none() : filter;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("minPrice", safeFilter.minPrice(), Types.BIGINT)
            .addValue("maxPrice", safeFilter.maxPrice(), Types.BIGINT)
            .addValue("minSize", safeFilter.minSize(), Types.INTEGER)
            .addValue("maxSize", safeFilter.maxSize(), Types.INTEGER)
            .addValue("hasGarage", safeFilter.hasGarage(), Types.BOOLEAN)
            .addValue("roomLayout", safeFilter.roomLayout(), Types.VARCHAR)
            .addValue("offset", Math.max(0, offset))
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            "SELECT " + LISTING_COLUMNS + """
                FROM listings
                WHERE (:minPrice IS NULL OR price >= :minPrice)
                  AND (:maxPrice IS NULL OR price <= :maxPrice)
                  AND (:minSize IS NULL OR size_sqm >= :minSize)
                  AND (:maxSize IS NULL OR size_sqm <= :maxSize)
                  AND (:hasGarage IS NULL OR has_garage = :hasGarage)
                  AND (:roomLayout IS NULL OR room_layout = :roomLayout)
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                OFFSET :offset
                """,
            params,
            listingRowMapper()
        );
    }

    public List<Listing> findCreatedSince(Instant since) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("since", toTimestamp(since));
        return jdbc.query(
            "SELECT " + LISTING_COLUMNS + """
                FROM listings
                WHERE created_at >= :since
                ORDER BY created_at DESC, id DESC
                """,
            params,
            listingRowMapper()
        );
    }

    public ListingStats stats() {
        return jdbc.queryForObject(
            """
                SELECT COUNT(*) AS total,
                       AVG(CAST(price AS DOUBLE PRECISION)) AS avg_price,
                       AVG(CAST(size_sqm AS DOUBLE PRECISION)) AS avg_size,
                       SUM(CASE WHEN has_garage THEN 1 ELSE 0 END) AS with_garage
                FROM listings
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new ListingStats(
                rs.getLong("total"),
                rs.getDouble("avg_price"),
                rs.getDouble("avg_size"),
                rs.getLong("with_garage")
            )
        );
    }

    private RowMapper<Listing> listingRowMapper() {
        return (rs, rowNum) -> new Listing(
            rs.getLong("id"),
            rs.getLong("external_id"),
            rs.getString("title"),
            rs.getLong("price"),
            rs.getString("price_unit"),
            rs.getString("locality"),
            nullableInt(rs, "size_sqm"),
            rs.getString("room_layout"),
            rs.getBoolean("has_garage"),
            nullableDouble(rs, "latitude"),
            nullableDouble(rs, "longitude"),
            readJsonList(rs.getString("images_json")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private List<String> readJsonList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<String> parsed = objectMapper.readValue(json, STRING_LIST);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable images_json value, returning no images", e);
            return List.of();
        }
    }

    private String writeJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize listing images", e);
        }
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to plain inserts", e);
            return false;
        }
    }
}
