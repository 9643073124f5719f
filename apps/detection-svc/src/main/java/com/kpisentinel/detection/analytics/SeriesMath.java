package com.kpisentinel.detection.analytics;

import com.kpisentinel.detection.model.DescriptiveStatistics;
import java.util.Arrays;

/**
 * Descriptive statistics shared by the detectors. Variance and standard deviation are population
 * measures. Sums always run in index order so repeated calls on the same input agree bit for bit.
 */
public final class SeriesMath {

    private SeriesMath() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        if (Double.isFinite(sum)) {
            return sum / values.length;
        }
        // the plain sum overflows near Double.MAX_VALUE; the mean itself never does
        double scaledSum = 0d;
        for (double value : values) {
            scaledSum += value / values.length;
        }
        return scaledSum;
    }

    public static double variance(double[] values, double mean) {
        if (values.length == 0) {
            return 0d;
        }
        double sumSquaredDiff = 0d;
        for (double value : values) {
            double diff = value - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / values.length;
    }

    public static double variance(double[] values) {
        return variance(values, mean(values));
    }

    public static double std(double[] values, double mean) {
        double variance = variance(values, mean);
        if (Double.isFinite(variance)) {
            return Math.sqrt(variance);
        }
        // squared deviations overflow for very large magnitudes: measure in units of the largest one
        double scale = Math.abs(mean);
        for (double value : values) {
            scale = Math.max(scale, Math.abs(value));
        }
        double sumSquaredDiff = 0d;
        for (double value : values) {
            double diff = value / scale - mean / scale;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length) * scale;
    }

    /**
     * Distance of {@code value} from {@code mean} in units of {@code std}, computed without
     * overflowing when the raw difference exceeds the double range.
     */
    public static double zScore(double value, double mean, double std) {
        double diff = value - mean;
        if (Double.isFinite(diff)) {
            return diff / std;
        }
        return value / std - mean / std;
    }

    public static double std(double[] values) {
        return std(values, mean(values));
    }

    public static double[] sortedCopy(double[] values) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sorted;
    }

    /**
     * Percentile by linear interpolation between the closest ranks.
     *
     * @param sortedValues values in ascending order
     * @param percentile   0 to 100
     */
    public static double percentile(double[] sortedValues, double percentile) {
        if (sortedValues.length == 0) {
            return 0d;
        }
        double index = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    public static double median(double[] values) {
        return percentile(sortedCopy(values), 50);
    }

    public static double min(double[] values) {
        double min = values.length == 0 ? 0d : values[0];
        for (double value : values) {
            min = Math.min(min, value);
        }
        return min;
    }

    public static double max(double[] values) {
        double max = values.length == 0 ? 0d : values[0];
        for (double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }

    public static double clamp(double value, double min, double max) {
        return Math.min(Math.max(value, min), max);
    }

    public static DescriptiveStatistics describe(double[] values) {
        if (values.length == 0) {
            return DescriptiveStatistics.empty();
        }
        double mean = mean(values);
        double variance = variance(values, mean);
        return new DescriptiveStatistics(
                values.length,
                min(values),
                max(values),
                mean,
                median(values),
                std(values, mean),
                variance
        );
    }

    /** Ordinary least-squares line through {@code (x[i], y[i])}. */
    public static LinearFit fitLine(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y differ in length: " + x.length + " != " + y.length);
        }
        if (x.length < 2) {
            return new LinearFit(0d, y.length == 1 ? y[0] : 0d, 0d);
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sxx = 0d;
        double sxy = 0d;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            sxx += dx * dx;
            sxy += dx * (y[i] - meanY);
        }
        if (sxx == 0d) {
            return new LinearFit(0d, meanY, 0d);
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;
        double ssRes = 0d;
        double ssTot = 0d;
        for (int i = 0; i < x.length; i++) {
            double residual = y[i] - (slope * x[i] + intercept);
            double centered = y[i] - meanY;
            ssRes += residual * residual;
            ssTot += centered * centered;
        }
        double rSquared = ssTot == 0d ? 0d : clamp(1 - ssRes / ssTot, 0d, 1d);
        return new LinearFit(slope, intercept, rSquared);
    }

    public record LinearFit(double slope, double intercept, double rSquared) {
    }
}
