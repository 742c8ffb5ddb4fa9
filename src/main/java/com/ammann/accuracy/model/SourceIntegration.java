/* (C)2026 */
package com.ammann.accuracy.model;

import com.ammann.accuracy.enumeration.DataSource;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;

/**
 * Connection of a data source to a project. Only active rows count towards completeness.
 */
@Entity
@Table(
        name = "source_integrations",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uk_integration_project_source",
                        columnNames = {"project_id", "source"}),
        indexes = @Index(name = "idx_integration_project", columnList = "project_id"))
public class SourceIntegration extends PanacheEntity {

    @Column(name = "project_id", nullable = false)
    public String projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 40)
    public DataSource source;

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "connected_at")
    public Instant connectedAt;

    public SourceIntegration() {}

    public SourceIntegration(String projectId, DataSource source, boolean active, Instant connectedAt) {
        this.projectId = projectId;
        this.source = source;
        this.active = active;
        this.connectedAt = connectedAt;
    }

    public static List<SourceIntegration> findActiveByProject(String projectId) {
        return list("projectId = ?1 and active = true", projectId);
    }
}
