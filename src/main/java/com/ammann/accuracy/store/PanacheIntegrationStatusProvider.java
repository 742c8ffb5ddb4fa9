/* (C)2026 */
package com.ammann.accuracy.store;

import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.exception.StorageException;
import com.ammann.accuracy.model.SourceIntegration;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import java.util.EnumSet;
import java.util.Set;

/**
 * {@link IntegrationStatusProvider} over the {@code source_integrations} table.
 */
@ApplicationScoped
public class PanacheIntegrationStatusProvider implements IntegrationStatusProvider {

    @Override
    @ActivateRequestContext
    public Set<DataSource> activeSources(String projectId) {
        try {
            Set<DataSource> sources = EnumSet.noneOf(DataSource.class);
            SourceIntegration.findActiveByProject(projectId).forEach(i -> sources.add(i.source));
            return sources;
        } catch (RuntimeException e) {
            throw new StorageException(
                    "Failed to read source integrations for project " + projectId, e);
        }
    }
}
