package com.fusiongate.backend.util;

import java.util.List;

/**
 * Numeric primitives shared by every pipeline stage. None of these mutate the history passed in;
 * callers own their buffers.
 */
public final class SignalFilters {

    private SignalFilters() {
    }

    public static double clamp(double value, double lo, double hi) {
        return Math.max(lo, Math.min(hi, value));
    }

    /**
     * Exponential moving average against the last element of {@code history}.
     * Returns {@code value} unchanged when there is no history.
     */
    public static double ema(double value, double alpha, List<Double> history) {
        if (history == null || history.isEmpty()) {
            return value;
        }
        double previous = history.get(history.size() - 1);
        return alpha * value + (1 - alpha) * previous;
    }

    /**
     * Z-score using population variance. Returns 0 for fewer than 2 samples or a flat history.
     */
    public static double zscore(double value, List<Double> history) {
        if (history == null || history.size() < 2) {
            return 0.0;
        }
        double mean = mean(history);
        double variance = 0.0;
        for (double sample : history) {
            double diff = sample - mean;
            variance += diff * diff;
        }
        double stdDev = Math.sqrt(variance / history.size());
        if (stdDev == 0.0) {
            return 0.0;
        }
        return (value - mean) / stdDev;
    }

    /**
     * 60/40 blend of the new value with the average of the last three history points.
     */
    public static double smooth(double value, List<Double> history) {
        if (history == null || history.size() < 3) {
            return value;
        }
        int size = history.size();
        double recent = (history.get(size - 1) + history.get(size - 2) + history.get(size - 3)) / 3.0;
        return 0.6 * value + 0.4 * recent;
    }

    /**
     * Normalized slope over the most recent five points, in [-1, 1].
     */
    public static double trend(List<Double> history) {
        if (history == null || history.size() < 5) {
            return 0.0;
        }
        int last = history.size() - 1;
        double slope = (history.get(last) - history.get(last - 4)) / 4.0;
        return clamp(slope / 10.0, -1.0, 1.0);
    }

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
