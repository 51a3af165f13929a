package com.phillippitts.pingwatch.service.probe;

import com.phillippitts.pingwatch.util.TimeUtils;

import java.io.IOException;
import java.net.InetAddress;

/**
 * Default prober based on {@link InetAddress#isReachable(int)}.
 *
 * <p>The JVM sends an ICMP echo request when it has the privilege to do so and otherwise
 * falls back to a TCP connection attempt on port 7. RTT is measured around the call with
 * {@link System#nanoTime()}. An unresolvable host surfaces as an
 * {@link java.net.UnknownHostException} and is counted as a failed probe by the loop.
 */
public final class InetAddressProber implements Prober {

    @Override
    public ProbeResult probe(String address, long timeoutMs) throws IOException, InterruptedException {
        InetAddress target = InetAddress.getByName(address);
        long start = System.nanoTime();
        boolean reachable = target.isReachable((int) Math.min(Integer.MAX_VALUE, timeoutMs));
        long rtt = TimeUtils.elapsedMillis(start);
        if (Thread.interrupted()) {
            throw new InterruptedException("Probe of " + address + " interrupted");
        }
        return reachable ? ProbeResult.success(rtt) : ProbeResult.failure();
    }

    @Override
    public String name() {
        return "inet";
    }
}
