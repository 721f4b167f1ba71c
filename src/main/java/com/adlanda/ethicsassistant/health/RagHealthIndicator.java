package com.adlanda.ethicsassistant.health;

import com.adlanda.ethicsassistant.model.HealthStatus;
import com.adlanda.ethicsassistant.service.AnswerService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Exposes the answer pipeline's dependency health to Actuator as the "rag" contributor.
 */
@Component("rag")
public class RagHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Some dependencies are unavailable");

    private final AnswerService answerService;

    public RagHealthIndicator(AnswerService answerService) {
        this.answerService = answerService;
    }

    @Override
    public Health health() {
        HealthStatus status = answerService.healthCheck();

        Health.Builder builder = switch (status.overall()) {
            case HEALTHY -> Health.up();
            case DEGRADED -> Health.status(DEGRADED);
            case UNHEALTHY -> Health.down();
        };

        builder.withDetail("llmService", status.llmService().value())
               .withDetail("vectorStore", status.vectorStore().value());
        if (status.error() != null) {
            builder.withDetail("error", status.error());
        }
        return builder.build();
    }
}
