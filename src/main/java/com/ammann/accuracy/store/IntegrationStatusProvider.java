/* (C)2026 */
package com.ammann.accuracy.store;

import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.exception.StorageException;
import java.util.Set;

/**
 * Reports which data sources are currently connected for a project.
 */
public interface IntegrationStatusProvider {

    /**
     * @param projectId project to look up
     * @return the active sources, empty if none are connected
     * @throws StorageException if the integration status cannot be read
     */
    Set<DataSource> activeSources(String projectId);
}
