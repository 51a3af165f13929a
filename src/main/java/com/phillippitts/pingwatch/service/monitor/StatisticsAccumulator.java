package com.phillippitts.pingwatch.service.monitor;

import com.phillippitts.pingwatch.domain.StatisticsSnapshot;

/**
 * Rolling latency statistics over one up session of a target.
 *
 * <p>Keeps running sums so every derived figure is O(1) per sample:
 * <ul>
 *   <li>mean: {@code sum / count}</li>
 *   <li>jitter1 (max-min): {@code max - min}</li>
 *   <li>jitter2 (packet pair): mean of {@code |rtt_i - rtt_(i-1)|} over consecutive samples</li>
 *   <li>standard deviation: population form, {@code sqrt(sumSquares / count - mean²)} with the
 *       variance clamped at zero against floating-point rounding</li>
 * </ul>
 *
 * <p>Not thread-safe; owned by a single {@link MonitorTarget}, which guards it.
 */
final class StatisticsAccumulator {

    private static final long NO_PREVIOUS = -1L;

    private long count;
    private long sum;
    private double sumSquares;
    private long min;
    private long max;
    private long previousRtt = NO_PREVIOUS;
    private long pairDiffSum;
    private long pairCount;

    /**
     * Adds one successful probe's RTT to the session.
     *
     * @param rtt round-trip time in milliseconds, non-negative
     */
    void record(long rtt) {
        if (rtt < 0) {
            throw new IllegalArgumentException("rtt must be non-negative: " + rtt);
        }
        count++;
        sum += rtt;
        sumSquares += (double) rtt * rtt;

        if (count == 1) {
            min = rtt;
            max = rtt;
        } else {
            min = Math.min(min, rtt);
            max = Math.max(max, rtt);
        }

        if (previousRtt != NO_PREVIOUS) {
            pairDiffSum += Math.abs(rtt - previousRtt);
            pairCount++;
        }
        previousRtt = rtt;
    }

    /** Breaks the packet-pair chain so a gap of failed probes does not count as a pair. */
    void breakPairChain() {
        previousRtt = NO_PREVIOUS;
    }

    /** Discards every sample, returning to the state of a new session. */
    void reset() {
        count = 0;
        sum = 0;
        sumSquares = 0.0;
        min = 0;
        max = 0;
        previousRtt = NO_PREVIOUS;
        pairDiffSum = 0;
        pairCount = 0;
    }

    long count() {
        return count;
    }

    double average() {
        return count == 0 ? 0.0 : (double) sum / count;
    }

    long min() {
        return min;
    }

    long max() {
        return max;
    }

    long jitterMaxMin() {
        return max - min;
    }

    double jitterPairAverage() {
        return pairCount == 0 ? 0.0 : (double) pairDiffSum / pairCount;
    }

    double standardDeviation() {
        if (count == 0) {
            return 0.0;
        }
        double mean = average();
        double variance = sumSquares / count - mean * mean;
        return Math.sqrt(Math.max(0.0, variance));
    }

    StatisticsSnapshot snapshot() {
        if (count == 0) {
            return StatisticsSnapshot.EMPTY;
        }
        return new StatisticsSnapshot(average(), min, max, jitterMaxMin(), jitterPairAverage(),
                standardDeviation());
    }
}
