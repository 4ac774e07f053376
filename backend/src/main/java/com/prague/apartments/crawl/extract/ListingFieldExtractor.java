package com.prague.apartments.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.prague.apartments.crawl.model.SizeAndLayout;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives structured attributes from raw listing fields. Every method is side-effect free.
 */
@Component
public class ListingFieldExtractor {
    private static final Pattern SIZE_PATTERN = Pattern.compile("(\\d+)\\s*m²", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern LAYOUT_PATTERN = Pattern.compile("(\\d+\\+\\w+)", Pattern.UNICODE_CHARACTER_CLASS);

    // Matched case-sensitively, unlike the garage keywords.
    private static final List<String> PRAGUE_KEYWORDS = List.of("Praha", "Prague", "Praze");

    private static final List<String> GARAGE_KEYWORDS = List.of("garage", "garáž", "parkování", "parking_lots");

    /**
     * Scans the title for a size such as {@code "54 m²"} and a layout such as {@code "2+kk"}.
     * The two scans are independent and only the first occurrence of each is used.
     */
    public SizeAndLayout extractSizeAndLayout(String title) {
        if (title == null || title.isEmpty()) {
            return new SizeAndLayout(null, null);
        }
        Integer size = null;
        Matcher sizeMatcher = SIZE_PATTERN.matcher(title);
        if (sizeMatcher.find()) {
            size = parseSize(sizeMatcher.group(1));
        }
        String layout = null;
        Matcher layoutMatcher = LAYOUT_PATTERN.matcher(title);
        if (layoutMatcher.find()) {
            layout = layoutMatcher.group(1);
        }
        return new SizeAndLayout(size, layout);
    }

    public boolean isPragueLocality(String locality) {
        if (locality == null || locality.isEmpty()) {
            return false;
        }
        for (String keyword : PRAGUE_KEYWORDS) {
            if (locality.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasGarage(List<String> labels, List<List<String>> labelGroups) {
        if (labels != null) {
            for (String label : labels) {
                if (matchesGarageKeyword(label)) {
                    return true;
                }
            }
        }
        if (labelGroups != null) {
            for (List<String> group : labelGroups) {
                if (group == null) {
                    continue;
                }
                for (String label : group) {
                    if (matchesGarageKeyword(label)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Returns the {@code href} of every entry under {@code images}, in upstream order.
     */
    public List<String> extractImages(JsonNode links) {
        if (links == null || !links.has("images")) {
            return List.of();
        }
        JsonNode images = links.get("images");
        if (!images.isArray()) {
            return List.of();
        }
        List<String> urls = new ArrayList<>(images.size());
        for (JsonNode image : images) {
            JsonNode href = image.get("href");
            if (href != null && href.isTextual()) {
                urls.add(href.asText());
            }
        }
        return urls;
    }

    private boolean matchesGarageKeyword(String label) {
        if (label == null || label.isEmpty()) {
            return false;
        }
        String lowered = label.toLowerCase(Locale.ROOT);
        for (String keyword : GARAGE_KEYWORDS) {
            if (lowered.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private Integer parseSize(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
