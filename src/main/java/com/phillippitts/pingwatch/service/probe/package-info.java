/**
 * Echo probing.
 *
 * <p>{@link com.phillippitts.pingwatch.service.probe.Prober} is the seam between the
 * monitoring loop and the network. Two implementations exist: the JVM's
 * {@code InetAddress.isReachable} (default) and the operating system's {@code ping}
 * command, selected with {@code pingwatch.monitor.prober}.
 *
 * @since 1.0
 */
package com.phillippitts.pingwatch.service.probe;
