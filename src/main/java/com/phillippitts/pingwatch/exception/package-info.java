/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.pingwatch.exception.PingWatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.pingwatch.exception.NoValidTargetsException} - Monitoring was
 *       started without any target that has an address</li>
 *   <li>{@link com.phillippitts.pingwatch.exception.ExportException} - Saving or loading a
 *       report, address list or transcript failed</li>
 *   <li>{@link com.phillippitts.pingwatch.exception.TraceException} - A trace command could not
 *       be started or read; recorded inline, never propagated out of a run</li>
 *   <li>{@link com.phillippitts.pingwatch.exception.TraceAlreadyRunningException} - A second
 *       trace run was requested while one is active</li>
 * </ul>
 *
 * <p>Probe failures are not exceptions at all: they become failed probe outcomes and only
 * increment counters. Only {@code NoValidTargetsException} and {@code ExportException} reach
 * the user, through {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.pingwatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.pingwatch.exception;
