/* (C)2026 */
package com.ammann.accuracy.model;

import com.ammann.accuracy.dto.SecondaryValueDTO;
import com.ammann.accuracy.enumeration.DataSource;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.time.Instant;

/**
 * Comparison observation stored with an {@link AccuracyReport}.
 */
@Embeddable
public class SecondaryValue {

    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 40)
    public DataSource source;

    @Column(name = "observed_value")
    public double observedValue;

    @Column(name = "observed_at")
    public Instant observedAt;

    public SecondaryValue() {}

    public static SecondaryValue from(SecondaryValueDTO dto) {
        SecondaryValue value = new SecondaryValue();
        value.source = dto.source();
        value.observedValue = dto.value();
        value.observedAt = dto.timestamp();
        return value;
    }

    public SecondaryValueDTO toDTO() {
        return new SecondaryValueDTO(source, observedValue, observedAt);
    }
}
