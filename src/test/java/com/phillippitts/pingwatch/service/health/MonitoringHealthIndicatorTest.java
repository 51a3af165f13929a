package com.phillippitts.pingwatch.service.health;

import com.phillippitts.pingwatch.domain.MonitoringState;
import com.phillippitts.pingwatch.domain.StatisticsSnapshot;
import com.phillippitts.pingwatch.domain.TargetSnapshot;
import com.phillippitts.pingwatch.domain.TargetStatus;
import com.phillippitts.pingwatch.service.monitor.MonitoringService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MonitoringHealthIndicatorTest {

    private MonitoringService monitoringService;
    private MonitoringHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        monitoringService = mock(MonitoringService.class);
        indicator = new MonitoringHealthIndicator(monitoringService);
    }

    private static TargetSnapshot target(String address, TargetStatus status) {
        return new TargetSnapshot(1, address, "", status, "", 1, 0, 0, Duration.ZERO, Duration.ZERO, 0,
                StatisticsSnapshot.EMPTY, 1000, 1000, false);
    }

    @Test
    void shouldReportUnknownWhenNotRunning() {
        when(monitoringService.getState()).thenReturn(MonitoringState.IDLE);
        when(monitoringService.targets()).thenReturn(List.of());

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(health.getDetails()).containsEntry("state", "IDLE").containsEntry("targets", 0);
    }

    @Test
    void shouldReportUpWhenAllTargetsReachable() {
        when(monitoringService.getState()).thenReturn(MonitoringState.RUNNING);
        when(monitoringService.targets()).thenReturn(List.of(
                target("10.0.0.1", TargetStatus.UP), target("10.0.0.2", TargetStatus.UNKNOWN)));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("up", 1L).containsEntry("down", 0L);
    }

    @Test
    void shouldReportDegradedWhenAnyTargetDown() {
        when(monitoringService.getState()).thenReturn(MonitoringState.RUNNING);
        when(monitoringService.targets()).thenReturn(List.of(
                target("10.0.0.1", TargetStatus.UP), target("10.0.0.2", TargetStatus.DOWN)));

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails())
                .containsEntry("down", 1L)
                .containsEntry("status", "1 target(s) down");
    }
}
