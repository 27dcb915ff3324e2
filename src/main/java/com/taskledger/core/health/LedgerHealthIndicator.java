package com.taskledger.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Exposes {@link HealthCheckService} through Spring Boot Actuator.
 * Any DOWN component makes the ledger DOWN; a DEGRADED one is reported but keeps it UP.
 */
@Component
public class LedgerHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public LedgerHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var statuses = healthCheckService.checkAll();
        boolean down = statuses.stream().anyMatch(s -> s.status() == HealthStatus.Status.DOWN);
        Health.Builder builder = down ? Health.down() : Health.up();
        for (HealthStatus status : statuses) {
            builder.withDetail(status.component(), Map.of(
                    "status", status.status().name(),
                    "detail", status.detail()));
        }
        return builder.build();
    }
}
