package com.adlanda.ethicsassistant.health;

import com.adlanda.ethicsassistant.model.IngestionResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the last batch ingestion run.
 *
 * UP until a run fails outright (storage unreachable); per-document failures are
 * reported as details and do not take the indicator down.
 */
@Component
public class IngestionHealthIndicator implements HealthIndicator {

    private final Clock clock;

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(true, null, null, null)
    );

    public IngestionHealthIndicator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records a completed batch run.
     */
    public void markCompleted(IngestionResult result) {
        state.set(new HealthState(true, result, null, clock.instant()));
    }

    /**
     * Records a batch run that could not complete.
     */
    public void markFailed(String error) {
        state.set(new HealthState(false, null, error, clock.instant()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();
        String lastRun = current.timestamp() != null ? current.timestamp().toString() : "never";

        if (current.healthy()) {
            Health.Builder builder = Health.up().withDetail("lastRun", lastRun);

            if (current.result() != null) {
                builder.withDetail("filesProcessed", current.result().processed())
                       .withDetail("filesFailed", current.result().failed())
                       .withDetail("chunksIndexed", current.result().totalChunks());
            }

            return builder.build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastAttempt", lastRun)
                .build();
    }

    private record HealthState(
            boolean healthy,
            IngestionResult result,
            String error,
            Instant timestamp
    ) {}
}
