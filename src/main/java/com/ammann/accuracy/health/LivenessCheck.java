/* (C)2026 */
package com.ammann.accuracy.health;

import com.ammann.accuracy.ml.SimulatedInferenceModel;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check. Scoring is stateless, so a responding JVM is a live service.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named("alive")
                .up()
                .withData("model-version", SimulatedInferenceModel.MODEL_VERSION)
                .build();
    }

}
