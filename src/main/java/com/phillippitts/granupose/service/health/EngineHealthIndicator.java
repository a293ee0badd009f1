package com.phillippitts.granupose.service.health;

import com.phillippitts.granupose.domain.engine.EngineStatusSnapshot;
import com.phillippitts.granupose.service.engine.EngineSupervisor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the supervised engine process.
 *
 * <ul>
 *   <li>UP: engine running</li>
 *   <li>DOWN: engine in error (crashed, failed to launch or watchdog exhausted)</li>
 *   <li>UNKNOWN: stopped, starting or stopping</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class EngineHealthIndicator implements HealthIndicator {

    private final EngineSupervisor supervisor;

    public EngineHealthIndicator(EngineSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public Health health() {
        EngineStatusSnapshot s = supervisor.snapshot();
        Health.Builder builder = switch (s.status()) {
            case RUNNING -> Health.up();
            case ERROR -> Health.down();
            default -> Health.unknown();
        };
        builder.withDetail("status", s.status().wireName())
                .withDetail("autoRestartEnabled", s.autoRestartEnabled())
                .withDetail("restartAttempts", s.restartAttempts() + "/" + s.restartMaxAttempts());
        if (s.pid() != null) {
            builder.withDetail("pid", s.pid());
        }
        if (s.lastError() != null) {
            builder.withDetail("lastError", s.lastError());
        }
        return builder.build();
    }
}
