package org.ctiextract.grid;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleArrays;

/**
 * Scalar reduction applied to the unmasked pixels of a patch.
 */
public enum Statistic {

    MEAN {
        @Override
        public double of(DoubleArrayList values) {
            if (values.isEmpty()) {
                return Double.NaN;
            }
            double sum = 0.0;
            for (int i = 0; i < values.size(); i++) {
                sum += values.getDouble(i);
            }
            return sum / values.size();
        }
    },

    /** Middle value; the mean of the two middle values for an even count. */
    MEDIAN {
        @Override
        public double of(DoubleArrayList values) {
            if (values.isEmpty()) {
                return Double.NaN;
            }
            double[] sorted = values.toDoubleArray();
            DoubleArrays.quickSort(sorted);
            int middle = sorted.length / 2;
            if (sorted.length % 2 == 1) {
                return sorted[middle];
            }
            return (sorted[middle - 1] + sorted[middle]) / 2.0;
        }
    };

    /**
     * Reduces pooled pixel values. The list is not modified.
     *
     * @param values The pooled values.
     * @return The statistic, or {@link Double#NaN} for an empty pool.
     */
    public abstract double of(DoubleArrayList values);

    /**
     * Parses a statistic name case-insensitively ({@code "median"}, {@code "MEAN"}).
     *
     * @param name The name.
     * @return The statistic.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static Statistic fromName(String name) {
        for (Statistic statistic : values()) {
            if (statistic.name().equalsIgnoreCase(name)) {
                return statistic;
            }
        }
        throw new IllegalArgumentException("Unknown statistic: " + name);
    }
}
