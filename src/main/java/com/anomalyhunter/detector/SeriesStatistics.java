package com.anomalyhunter.detector;

import com.anomalyhunter.domain.model.Series;
import com.anomalyhunter.domain.model.SeriesSummary;
import java.util.Arrays;

/**
 * Numeric primitives shared by the detectors.
 *
 * <p>Standard deviation is the population form (divide by n). Percentiles use linear
 * interpolation between closest ranks. Every method accepts arrays of length 0 or 1 and
 * returns 0 where a statistic is undefined.
 */
public final class SeriesStatistics {

    /** Spreads at or below this fraction of the data's magnitude are floating-point noise. */
    public static final double NEGLIGIBLE_SPREAD_RATIO = 1e-9;

    private SeriesStatistics() {}

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /** Mean of {@code values[from, to)}; 0 for an empty range. */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /** Population standard deviation; exactly 0 for fewer than two samples or identical samples. */
    public static double stdDev(double[] values) {
        if (values.length < 2 || min(values) == max(values)) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            double delta = value - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / values.length);
    }

    /**
     * True when {@code spread} is indistinguishable from zero at the scale of {@code values}.
     * A ramp with step 0.1 has a smoothed derivative that is constant up to rounding; its
     * standard deviation is around 1e-17 rather than exactly 0.
     */
    public static boolean isNegligibleSpread(double spread, double[] values) {
        return spread <= NEGLIGIBLE_SPREAD_RATIO * maxAbs(values);
    }

    /** Largest absolute value; 0 for an empty array. */
    public static double maxAbs(double[] values) {
        double peak = 0.0;
        for (double value : values) {
            peak = Math.max(peak, Math.abs(value));
        }
        return peak;
    }

    public static double min(double[] values) {
        return Arrays.stream(values).min().orElse(0.0);
    }

    public static double max(double[] values) {
        return Arrays.stream(values).max().orElse(0.0);
    }

    public static double median(double[] values) {
        return percentile(sortedCopy(values), 50.0);
    }

    public static double[] sortedCopy(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted;
    }

    /**
     * Percentile of an already sorted array, interpolating linearly between ranks.
     *
     * @param percentile 0-100
     */
    public static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = rank - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    /**
     * Simple moving average over full windows only: entry {@code j} averages
     * {@code values[j, j + window)}. Empty when the series is shorter than the window.
     */
    public static double[] movingAverage(double[] values, int window) {
        if (window <= 0 || values.length < window) {
            return new double[0];
        }
        double[] averages = new double[values.length - window + 1];
        for (int j = 0; j < averages.length; j++) {
            averages[j] = mean(values, j, j + window);
        }
        return averages;
    }

    /** Successive differences: {@code result[i] = values[i + 1] - values[i]}. */
    public static double[] differences(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] differences = new double[values.length - 1];
        for (int i = 0; i < differences.length; i++) {
            differences[i] = values[i + 1] - values[i];
        }
        return differences;
    }

    /**
     * Pearson correlation between {@code values[0, n-1)} and {@code values[1, n)}.
     * Returns 0 with fewer than 3 samples or when either side has no variance.
     */
    public static double lag1Autocorrelation(double[] values) {
        int pairs = values.length - 1;
        if (pairs < 2) {
            return 0.0;
        }
        double meanLead = mean(values, 0, pairs);
        double meanLag = mean(values, 1, values.length);
        double covariance = 0.0;
        double varianceLead = 0.0;
        double varianceLag = 0.0;
        for (int i = 0; i < pairs; i++) {
            double lead = values[i] - meanLead;
            double lag = values[i + 1] - meanLag;
            covariance += lead * lag;
            varianceLead += lead * lead;
            varianceLag += lag * lag;
        }
        if (varianceLead == 0.0 || varianceLag == 0.0) {
            return 0.0;
        }
        return covariance / Math.sqrt(varianceLead * varianceLag);
    }

    public static SeriesSummary summarize(Series series) {
        double[] values = series.toArray();
        return SeriesSummary.builder()
                .size(values.length)
                .mean(mean(values))
                .stdDev(stdDev(values))
                .min(min(values))
                .max(max(values))
                .metadata(series.getMetadata())
                .build();
    }
}
