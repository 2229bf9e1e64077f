package com.example.archiver;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Counters from one "Crawl statistics" log entry. A {@code null} component was absent from the entry.
 */
public record CrawlStats(
        Long crawled,
        Long total,
        Long pending,
        Long failed
) {
    public static CrawlStats fromDetails(JsonNode details) {
        return new CrawlStats(
                number(details, "crawled"),
                number(details, "total"),
                number(details, "pending"),
                number(details, "failed")
        );
    }

    private static Long number(JsonNode details, String field) {
        JsonNode node = details.get(field);
        return node != null && node.isIntegralNumber() ? node.asLong() : null;
    }

    static long valueOr(Long value, long fallback) {
        return value == null ? fallback : value;
    }
}
