package com.prague.apartments.crawl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prague.apartments.crawl.model.NormalizedListing;
import com.prague.apartments.crawl.model.SizeAndLayout;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the estates document returned by the listing source and maps single records
 * onto {@link NormalizedListing}.
 */
@Component
public class SrealityEstateParser {
    private final ObjectMapper objectMapper;
    private final ListingFieldExtractor fieldExtractor;

    public SrealityEstateParser(ObjectMapper objectMapper, ListingFieldExtractor fieldExtractor) {
        this.objectMapper = objectMapper;
        this.fieldExtractor = fieldExtractor;
    }

    /**
     * Returns the records under {@code _embedded.estates} in upstream order; empty when absent.
     */
    public List<JsonNode> estates(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root = objectMapper.readTree(body);
        JsonNode estates = root.path("_embedded").path("estates");
        if (!estates.isArray()) {
            return List.of();
        }
        List<JsonNode> out = new ArrayList<>(estates.size());
        estates.forEach(out::add);
        return out;
    }

    public String locality(JsonNode estate) {
        return textOrEmpty(estate.get("locality"));
    }

    /**
     * The upstream {@code hash_id}, or null when it is missing, not numeric, or zero.
     */
    public Long externalId(JsonNode estate) {
        JsonNode node = estate.get("hash_id");
        if (node == null || node.isNull()) {
            return null;
        }
        long value;
        if (node.isNumber()) {
            value = node.asLong();
        } else if (node.isTextual()) {
            try {
                value = Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return value == 0 ? null : value;
    }

    public NormalizedListing normalize(JsonNode estate, long externalId, String defaultPriceUnit) {
        String title = textOrEmpty(estate.get("name"));
        long price = estate.path("price").isNumber() ? estate.path("price").asLong() : 0L;
        // Only an absent unit falls back; an empty one is kept as sent.
        JsonNode unitNode = estate.path("price_czk").path("unit");
        String priceUnit = unitNode.isMissingNode() || unitNode.isNull() ? defaultPriceUnit : unitNode.asText();

        SizeAndLayout sizeAndLayout = fieldExtractor.extractSizeAndLayout(title);
        boolean hasGarage = fieldExtractor.hasGarage(
            stringList(estate.get("labels")),
            stringGroups(estate.get("labelsAll"))
        );

        JsonNode gps = estate.path("gps");
        return new NormalizedListing(
            externalId,
            title,
            price,
            priceUnit,
            locality(estate),
            sizeAndLayout.sizeSqm(),
            sizeAndLayout.roomLayout(),
            hasGarage,
            doubleOrNull(gps.get("lat")),
            doubleOrNull(gps.get("lon")),
            fieldExtractor.extractImages(estate.get("_links"))
        );
    }

    private List<String> stringList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode child : node) {
            if (child.isTextual()) {
                values.add(child.asText());
            }
        }
        return values;
    }

    private List<List<String>> stringGroups(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<List<String>> groups = new ArrayList<>(node.size());
        for (JsonNode child : node) {
            groups.add(stringList(child));
        }
        return groups;
    }

    private Double doubleOrNull(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        return node.asDouble();
    }

    private String textOrEmpty(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return node.asText("");
    }
}
