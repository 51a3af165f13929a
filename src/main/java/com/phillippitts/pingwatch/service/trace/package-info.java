/**
 * Path-trace diagnostics: bounded-concurrency trace runs with streaming per-address output
 * and cooperative cancellation.
 *
 * <p>{@link com.phillippitts.pingwatch.service.trace.TraceOrchestrator} drives a run,
 * {@link com.phillippitts.pingwatch.service.trace.TraceSession} holds its buffers and
 * terminal flags, and {@link com.phillippitts.pingwatch.service.trace.TraceSlotLimiter}
 * caps the live subprocesses.
 */
package com.phillippitts.pingwatch.service.trace;
