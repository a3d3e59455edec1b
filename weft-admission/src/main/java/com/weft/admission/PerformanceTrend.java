package com.weft.admission;

import java.util.List;

/**
 * Direction of a plugin's execution times: the average of the older half of recent samples against
 * the average of the newer half.
 */
public enum PerformanceTrend {
    /** No execution recorded. */
    NO_DATA,
    /** Fewer than {@value #MIN_SAMPLES} samples. */
    INSUFFICIENT_DATA,
    /** Newer half at least 10% faster. */
    IMPROVING,
    /** Newer half at least 20% slower. */
    DEGRADING,
    STABLE;

    public static final int MIN_SAMPLES = 5;

    static final double IMPROVEMENT_THRESHOLD = 0.1;
    static final double DEGRADATION_THRESHOLD = 0.2;

    /**
     * @param executionTimes seconds, oldest first
     */
    public static PerformanceTrend of(List<Double> executionTimes) {
        if (executionTimes == null || executionTimes.isEmpty()) {
            return NO_DATA;
        }
        if (executionTimes.size() < MIN_SAMPLES) {
            return INSUFFICIENT_DATA;
        }
        int mid = executionTimes.size() / 2;
        double older = mean(executionTimes.subList(0, mid));
        double newer = mean(executionTimes.subList(mid, executionTimes.size()));
        if (older == 0.0) {
            return newer > 0.0 ? DEGRADING : STABLE;
        }
        double change = (newer - older) / older;
        if (change < -IMPROVEMENT_THRESHOLD) return IMPROVING;
        if (change > DEGRADATION_THRESHOLD) return DEGRADING;
        return STABLE;
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (Double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
