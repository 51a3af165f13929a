package com.phillippitts.pingwatch.service.health;

import com.phillippitts.pingwatch.domain.MonitoringState;
import com.phillippitts.pingwatch.domain.TargetSnapshot;
import com.phillippitts.pingwatch.domain.TargetStatus;
import com.phillippitts.pingwatch.service.monitor.MonitoringService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the monitoring session.
 *
 * <p>Reports target reachability for monitoring and alerting:
 * <ul>
 *   <li>UP: Monitoring running and no target down</li>
 *   <li>DEGRADED: Monitoring running with at least one target down</li>
 *   <li>UNKNOWN: Monitoring not running</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class MonitoringHealthIndicator implements HealthIndicator {

    private final MonitoringService monitoringService;

    public MonitoringHealthIndicator(MonitoringService monitoringService) {
        this.monitoringService = monitoringService;
    }

    @Override
    public Health health() {
        MonitoringState state = monitoringService.getState();
        List<TargetSnapshot> targets = monitoringService.targets();
        long down = targets.stream().filter(t -> t.status() == TargetStatus.DOWN).count();
        long up = targets.stream().filter(t -> t.status() == TargetStatus.UP).count();

        Health.Builder builder = new Health.Builder();
        if (state != MonitoringState.RUNNING) {
            builder.unknown()
                    .withDetail("status", "Monitoring not running");
        } else if (down == 0) {
            builder.up()
                    .withDetail("status", "All targets reachable");
        } else {
            builder.status("DEGRADED")
                    .withDetail("status", down + " target(s) down");
        }
        return builder
                .withDetail("state", state.name())
                .withDetail("targets", targets.size())
                .withDetail("up", up)
                .withDetail("down", down)
                .build();
    }
}
