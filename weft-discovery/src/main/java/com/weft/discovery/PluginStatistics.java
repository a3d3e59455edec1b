package com.weft.discovery;

/**
 * Aggregate outcome statistics for one indexed plugin. Values are cumulative averages over every
 * recorded outcome; instances are immutable and {@link #record(boolean, double)} returns a new one.
 */
public final class PluginStatistics {

    /** Statistics of a plugin that has never run. */
    public static final PluginStatistics INITIAL = new PluginStatistics(0, 1.0, 0.0);

    private final long usageCount;
    private final double successRate;
    private final double averageExecutionTime;

    public PluginStatistics(long usageCount, double successRate, double averageExecutionTime) {
        this.usageCount = Math.max(0, usageCount);
        this.successRate = successRate;
        this.averageExecutionTime = averageExecutionTime;
    }

    /**
     * Folds one outcome into the averages: {@code rate' = (rate*n + s)/(n+1)},
     * {@code time' = (time*n + t)/(n+1)}, {@code n' = n+1}.
     */
    public PluginStatistics record(boolean success, double executionTimeSeconds) {
        long n = usageCount;
        double s = success ? 1.0 : 0.0;
        double t = Math.max(0.0, executionTimeSeconds);
        double rate = (successRate * n + s) / (n + 1);
        double time = (averageExecutionTime * n + t) / (n + 1);
        return new PluginStatistics(n + 1, rate, time);
    }

    public long getUsageCount() {
        return usageCount;
    }

    public double getSuccessRate() {
        return successRate;
    }

    /** Seconds. */
    public double getAverageExecutionTime() {
        return averageExecutionTime;
    }

    @Override
    public String toString() {
        return "PluginStatistics{usageCount=" + usageCount + ", successRate=" + successRate
                + ", averageExecutionTime=" + averageExecutionTime + "}";
    }
}
