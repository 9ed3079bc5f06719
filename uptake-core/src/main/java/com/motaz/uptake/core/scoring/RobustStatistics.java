package com.motaz.uptake.core.scoring;

import java.util.Arrays;

public final class RobustStatistics {

    private RobustStatistics() {
    }

    /** Median; the mean of the two middle values for even lengths. Input is not modified. */
    public static double median(double[] xs) {
        if (xs.length == 0) {
            throw new IllegalArgumentException("median of an empty series");
        }
        double[] copy = Arrays.copyOf(xs, xs.length);
        Arrays.sort(copy);
        int n = copy.length;
        return n % 2 == 1 ? copy[n / 2] : 0.5 * (copy[n / 2 - 1] + copy[n / 2]);
    }

    /** Median absolute deviation from {@code center}. */
    public static double mad(double[] xs, double center) {
        double[] dev = new double[xs.length];
        for (int i = 0; i < xs.length; i++) {
            dev[i] = Math.abs(xs[i] - center);
        }
        return median(dev);
    }

    public static double mean(double[] xs) {
        if (xs.length == 0) {
            throw new IllegalArgumentException("mean of an empty series");
        }
        double s = 0.0;
        for (double v : xs) {
            s += v;
        }
        return s / xs.length;
    }
}
