/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.tabular;

import java.util.*;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Reducers for use with {@link DataFrame#summarize(Function, Map) summarize}, and row functions for use with
 * {@link DataFrame#apply(Function) apply}.
 *
 * <p>Numeric reducers ignore {@code null} values, non-numeric values, and {@code NaN}. They return {@code null} when no
 * numeric values remain.
 */
public final class Aggregators {
    private Aggregators() {}
    
    /**
     * Returns a reducer that counts the collected values, including {@code null} values.
     *
     * @return a counting reducer
     */
    public static Function<List<Object>, Integer> counter() {
        return List::size;
    }
    
    /**
     * Returns a reducer that sums the numeric values.
     *
     * @return a summing reducer
     */
    public static Function<List<Object>, Double> sum() {
        return values -> {
            double[] numbers = numbers(values);
            if (numbers.length == 0)
                return null;
            double sum = 0;
            for (double number : numbers)
                sum += number;
            return sum;
        };
    }
    
    /**
     * Returns a reducer that averages the numeric values.
     *
     * @return an averaging reducer
     */
    public static Function<List<Object>, Double> mean() {
        return values -> {
            double[] numbers = numbers(values);
            if (numbers.length == 0)
                return null;
            double sum = 0;
            for (double number : numbers)
                sum += number;
            return sum / numbers.length;
        };
    }
    
    /**
     * Returns a reducer that selects the lowest non-null value, in natural order.
     *
     * @return a minimum reducer
     */
    public static Function<List<Object>, Object> min() {
        return values -> values.stream().filter(Objects::nonNull).min(Utils.DEFAULT_COMPARATOR).orElse(null);
    }
    
    /**
     * Returns a reducer that selects the highest non-null value, in natural order.
     *
     * @return a maximum reducer
     */
    public static Function<List<Object>, Object> max() {
        return values -> values.stream().filter(Objects::nonNull).max(Utils.DEFAULT_COMPARATOR).orElse(null);
    }
    
    /**
     * Returns a reducer that computes the p-quantile of the numeric values, interpolating linearly between the two
     * nearest ranks (the R-7 method).
     *
     * @param p the probability, in {@code [0, 1]}
     * @return a quantile reducer
     */
    public static Function<List<Object>, Double> quantile(double p) {
        return values -> {
            double[] numbers = numbers(values);
            Arrays.sort(numbers);
            return quantile(numbers, p);
        };
    }
    
    /**
     * Returns a reducer that computes the first and third quartiles, the interquartile range, and the outlier fences of
     * the numeric values, as a row with the fields {@code q1}, {@code q3}, {@code iqr}, {@code qr_min} and
     * {@code qr_max}.
     *
     * @return a quartiles reducer
     */
    public static Function<List<Object>, Map<String, Object>> quantiles() {
        return values -> {
            double[] numbers = numbers(values);
            Arrays.sort(numbers);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("q1", quantile(numbers, 0.25));
            row.put("q3", quantile(numbers, 0.75));
            return violin().apply(row);
        };
    }
    
    /**
     * Returns a row function that reads the {@code q1} and {@code q3} fields of a row, and returns a copy of the row
     * with the interquartile range {@code iqr}, and the outlier fences {@code qr_min = q1 - 1.5 * iqr} and
     * {@code qr_max = q1 + 1.5 * iqr}. Both fences are measured from {@code q1}. Rows without numeric quartiles are
     * copied with {@code null} values.
     *
     * @return a row function
     */
    public static UnaryOperator<Map<String, Object>> violin() {
        return row -> {
            Map<String, Object> out = new LinkedHashMap<>(row);
            Object q1 = row.get("q1");
            Object q3 = row.get("q3");
            if (q1 instanceof Number && q3 instanceof Number) {
                double lower = ((Number) q1).doubleValue();
                double upper = ((Number) q3).doubleValue();
                double iqr = upper - lower;
                out.put("iqr", iqr);
                out.put("qr_min", lower - 1.5 * iqr);
                out.put("qr_max", lower + 1.5 * iqr);
            } else {
                out.put("iqr", null);
                out.put("qr_min", null);
                out.put("qr_max", null);
            }
            return out;
        };
    }
    
    // Expects sorted input.
    private static Double quantile(double[] sorted, double p) {
        int n = sorted.length;
        if (n == 0 || Double.isNaN(p))
            return null;
        if (p <= 0 || n < 2)
            return sorted[0];
        if (p >= 1)
            return sorted[n - 1];
        double i = (n - 1) * p;
        int i0 = (int) Math.floor(i);
        double value0 = sorted[i0];
        return value0 + (sorted[i0 + 1] - value0) * (i - i0);
    }
    
    private static double[] numbers(List<?> values) {
        return values.stream()
            .filter(value -> value instanceof Number)
            .mapToDouble(value -> ((Number) value).doubleValue())
            .filter(value -> !Double.isNaN(value))
            .toArray();
    }
}
