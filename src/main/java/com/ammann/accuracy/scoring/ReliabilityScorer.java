/* (C)2026 */
package com.ammann.accuracy.scoring;

import com.ammann.accuracy.enumeration.DataSource;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static trust score per data source.
 */
@ApplicationScoped
public class ReliabilityScorer {

    static final int UNKNOWN_SOURCE_SCORE = 50;

    private static final Map<DataSource, Integer> RELIABILITY;

    static {
        EnumMap<DataSource, Integer> map = new EnumMap<>(DataSource.class);
        map.put(DataSource.GOOGLE_SEARCH_CONSOLE, 95);
        map.put(DataSource.GOOGLE_ANALYTICS, 95);
        map.put(DataSource.SERPAPI, 85);
        map.put(DataSource.DATAFORSEO, 80);
        map.put(DataSource.AHREFS_API, 85);
        map.put(DataSource.SEMRUSH_API, 85);
        map.put(DataSource.MOZ_API, 75);
        map.put(DataSource.INTERNAL_CRAWLER, 70);
        RELIABILITY = Collections.unmodifiableMap(map);
    }

    /**
     * @param source provider of the observation, may be {@code null}
     * @return reliability in [0, 100]; 50 for a source without an entry
     */
    public int score(DataSource source) {
        if (source == null) {
            return UNKNOWN_SOURCE_SCORE;
        }
        return RELIABILITY.getOrDefault(source, UNKNOWN_SOURCE_SCORE);
    }
}
