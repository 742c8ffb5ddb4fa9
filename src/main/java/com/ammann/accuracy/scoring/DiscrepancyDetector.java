/* (C)2026 */
package com.ammann.accuracy.scoring;

import com.ammann.accuracy.dto.DataPointDTO;
import com.ammann.accuracy.dto.DiscrepancyDTO;
import com.ammann.accuracy.enumeration.DiscrepancySeverity;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.jboss.logging.Logger;

/**
 * Classifies the variance between a primary observation and each comparison observation.
 *
 * <p>Pairs at or below the 5% noise floor produce no record at all. A zero primary value
 * produces no records (see {@link RelativeVariance}).
 */
@ApplicationScoped
public class DiscrepancyDetector {

    private static final Logger LOG = Logger.getLogger(DiscrepancyDetector.class);

    /**
     * @param primary validated primary observation
     * @param compare validated comparison observations
     * @return one discrepancy per comparison above the noise floor, in input order
     */
    public List<DiscrepancyDTO> detect(DataPointDTO primary, List<DataPointDTO> compare) {
        if (compare == null || compare.isEmpty()) {
            return List.of();
        }

        List<DiscrepancyDTO> discrepancies = new ArrayList<>();

        for (DataPointDTO comparePoint : compare) {
            OptionalDouble variance = RelativeVariance.between(primary.value(), comparePoint.value());
            if (variance.isEmpty() || variance.getAsDouble() <= RelativeVariance.NOISE_FLOOR) {
                continue;
            }

            DiscrepancySeverity severity = DiscrepancySeverity.fromVariance(variance.getAsDouble());
            discrepancies.add(
                    new DiscrepancyDTO(
                            primary.source(),
                            comparePoint.source(),
                            primary.value(),
                            comparePoint.value(),
                            variance.getAsDouble(),
                            severity,
                            severity.getExplanation()));
        }

        if (!discrepancies.isEmpty()) {
            LOG.debugf(
                    "Detected %d discrepancies for primary %s from %s",
                    discrepancies.size(), primary.id(), primary.source());
        }

        return discrepancies;
    }
}
