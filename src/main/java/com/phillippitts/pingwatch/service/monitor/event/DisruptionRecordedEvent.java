package com.phillippitts.pingwatch.service.monitor.event;

import com.phillippitts.pingwatch.domain.DisruptionEvent;

/**
 * Emitted when a disruption event enters the log or its post-recovery statistics change.
 *
 * @param event the appended or refreshed event
 * @param created true on recovery (event just appended), false on a post-recovery refresh
 */
public record DisruptionRecordedEvent(
        DisruptionEvent event,
        boolean created
) {}
