/* (C)2026 */
package com.ammann.accuracy.enumeration;

/**
 * Closed set of external providers an SEO metric observation can originate from.
 *
 * <p>Used as a lookup key for source reliability and for the expected/available
 * source sets of a metric.
 */
public enum DataSource {
    /** Search console export, first-party. */
    GOOGLE_SEARCH_CONSOLE,
    /** Web analytics property, first-party. */
    GOOGLE_ANALYTICS,
    SERPAPI,
    DATAFORSEO,
    AHREFS_API,
    SEMRUSH_API,
    MOZ_API,
    /** Self-hosted crawler. */
    INTERNAL_CRAWLER
}
