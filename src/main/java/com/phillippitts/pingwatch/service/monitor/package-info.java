/**
 * Reachability monitoring: per-target state machine, session statistics, the disruption
 * event log and the probe loops that feed them.
 *
 * <p>Key types:
 * <ul>
 *   <li>{@link com.phillippitts.pingwatch.service.monitor.MonitorTarget} - UNKNOWN/UP/DOWN
 *       state machine with session statistics</li>
 *   <li>{@link com.phillippitts.pingwatch.service.monitor.DisruptionEventLog} - append-only,
 *       sortable log of recovered disruptions</li>
 *   <li>{@link com.phillippitts.pingwatch.service.monitor.ProbeLoop} - probe/wait cycle of
 *       one target</li>
 *   <li>{@link com.phillippitts.pingwatch.service.monitor.MonitoringService} - session
 *       lifecycle (start, stop, reset)</li>
 * </ul>
 */
package com.phillippitts.pingwatch.service.monitor;
