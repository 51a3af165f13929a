/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package is the HTTP boundary of the application: presentation depends on
 * service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - monitor, disruption, trace and export endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; monitoring and trace logic lives in services, and
 * domain exceptions are mapped to status codes in one place.
 *
 * @see com.phillippitts.pingwatch.presentation.controller
 * @since 1.0
 */
package com.phillippitts.pingwatch.presentation;
