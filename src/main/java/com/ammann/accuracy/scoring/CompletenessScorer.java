/* (C)2026 */
package com.ammann.accuracy.scoring;

import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.store.IntegrationStatusProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Scores how many of the sources expected for a metric are connected for a project.
 */
@ApplicationScoped
public class CompletenessScorer {

    private static final Logger LOG = Logger.getLogger(CompletenessScorer.class);

    private static final Set<DataSource> DEFAULT_EXPECTED =
            EnumSet.of(DataSource.GOOGLE_SEARCH_CONSOLE);

    private static final Map<String, Set<DataSource>> EXPECTED_SOURCES =
            Map.of(
                    "organic_clicks",
                    EnumSet.of(DataSource.GOOGLE_SEARCH_CONSOLE, DataSource.GOOGLE_ANALYTICS),
                    "organic_impressions",
                    EnumSet.of(DataSource.GOOGLE_SEARCH_CONSOLE),
                    "keyword_position",
                    EnumSet.of(
                            DataSource.GOOGLE_SEARCH_CONSOLE,
                            DataSource.SERPAPI,
                            DataSource.DATAFORSEO),
                    "page_views",
                    EnumSet.of(DataSource.GOOGLE_ANALYTICS),
                    "bounce_rate",
                    EnumSet.of(DataSource.GOOGLE_ANALYTICS),
                    "backlinks",
                    EnumSet.of(DataSource.AHREFS_API, DataSource.SEMRUSH_API, DataSource.MOZ_API),
                    "domain_rating",
                    EnumSet.of(DataSource.AHREFS_API, DataSource.MOZ_API));

    private final IntegrationStatusProvider integrationStatusProvider;

    @Inject
    public CompletenessScorer(IntegrationStatusProvider integrationStatusProvider) {
        this.integrationStatusProvider = integrationStatusProvider;
    }

    /**
     * @param projectId project whose integrations are checked
     * @param metric metric name; unknown metrics expect a single console source
     * @param timestamp observation time of the primary data point
     * @return completeness in [0, 100]
     */
    public double score(String projectId, String metric, Instant timestamp) {
        Set<DataSource> expected = expectedSources(metric);
        Set<DataSource> available = availableSources(projectId);

        long covered = expected.stream().filter(available::contains).count();
        double completeness = 100.0 * covered / expected.size();

        LOG.debugf(
                "Completeness for project=%s metric=%s at %s: %d/%d expected sources",
                projectId, metric, timestamp, covered, expected.size());

        return Math.min(100.0, completeness);
    }

    public static Set<DataSource> expectedSources(String metric) {
        if (metric == null) {
            return DEFAULT_EXPECTED;
        }
        return EXPECTED_SOURCES.getOrDefault(metric, DEFAULT_EXPECTED);
    }

    private Set<DataSource> availableSources(String projectId) {
        try {
            Set<DataSource> sources = integrationStatusProvider.activeSources(projectId);
            return sources != null ? sources : Set.of();
        } catch (RuntimeException e) {
            LOG.warnf(
                    "Failed to read integration status for project %s, assuming console only: %s",
                    projectId, e.getMessage());
            return DEFAULT_EXPECTED;
        }
    }
}
