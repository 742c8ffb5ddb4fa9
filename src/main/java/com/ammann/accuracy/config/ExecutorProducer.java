/* (C)2026 */
package com.ammann.accuracy.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "ml-scoring-executor" bean used by
 * {@link com.ammann.accuracy.service.MLConfidenceService} to score one batch group
 * concurrently. Parallelism matches the batch group size so a whole group runs at once.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String ML_SCORING_EXECUTOR = "ml-scoring-executor";

    @ConfigProperty(name = "accuracy.ml.batch-size", defaultValue = "10")
    int batchSize;

    /**
     * Produces a named ManagedExecutor for batch ML confidence scoring.
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(ML_SCORING_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createMlScoringExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(Math.max(1, batchSize))
                .maxQueued(-1)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}
