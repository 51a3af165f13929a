/**
 * Domain model shared by the monitoring core, the trace runner and the presentation layer.
 *
 * <p>Everything here is either an immutable record or, in the case of
 * {@link com.phillippitts.pingwatch.domain.DisruptionEvent}, an object whose only mutable
 * part is published through a volatile reference to an immutable snapshot.
 *
 * @since 1.0
 */
package com.phillippitts.pingwatch.domain;
