/**
 * Spring configuration: typed properties, executors and collaborator wiring.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} classes for
 *       monitoring, tracing, export and thread pools</li>
 *   <li>{@code config.logging} - request-scoped Log4j2 ThreadContext (MDC)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.pingwatch.config;
