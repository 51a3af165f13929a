package com.phillippitts.pingwatch.service.probe;

import java.io.IOException;

/**
 * Sends a single echo request to an address.
 *
 * <p>Implementations report a missing or late reply as {@link ProbeResult#failure()}.
 * They may also throw: the probe loop converts every {@link IOException} or runtime
 * exception into a failed probe, so callers never see transport errors.
 */
public interface Prober {

    /**
     * Probes {@code address} once.
     *
     * @param address IP address or host name
     * @param timeoutMs maximum time to wait for a reply
     * @return outcome of the probe
     * @throws IOException on resolution or transport errors
     * @throws InterruptedException if the calling thread is interrupted (monitoring stopped)
     */
    ProbeResult probe(String address, long timeoutMs) throws IOException, InterruptedException;

    /**
     * Short identifier used in logs and metrics tags.
     */
    String name();
}
