package com.phillippitts.pingwatch.domain;

/**
 * Immutable view of a session's latency statistics.
 *
 * <p>Used for a target's live session figures, for the pre-down snapshot taken when a
 * disruption begins and for the post-recovery figures of a {@link DisruptionEvent}.
 *
 * @param average mean RTT in milliseconds
 * @param min smallest RTT in milliseconds
 * @param max largest RTT in milliseconds
 * @param jitterMaxMin jitter1: {@code max - min}
 * @param jitterPairAverage jitter2: mean absolute difference between consecutive RTTs
 * @param standardDeviation population standard deviation of RTT
 */
public record StatisticsSnapshot(
        double average,
        long min,
        long max,
        long jitterMaxMin,
        double jitterPairAverage,
        double standardDeviation
) {

    /** Statistics of a session without any successful probe. */
    public static final StatisticsSnapshot EMPTY = new StatisticsSnapshot(0.0, 0, 0, 0, 0.0, 0.0);

    /**
     * Statistics of a session holding a single sample.
     *
     * @param rtt the only RTT observed
     * @return snapshot with avg=min=max=rtt and zero jitter/deviation
     */
    public static StatisticsSnapshot ofSingleSample(long rtt) {
        return new StatisticsSnapshot(rtt, rtt, rtt, 0, 0.0, 0.0);
    }
}
