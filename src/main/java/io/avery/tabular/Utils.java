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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Common utils
 */
class Utils {
    /**
     * Totally unchecked cast, for when a normal cast is illegal, but we know the cast is safe.
     */
    @SuppressWarnings("unchecked")
    static <T> T cast(Object o) {
        return (T) o;
    }
    
    /**
     * Natural order, nulls first/lowest. Numbers of different classes are compared by value.
     */
    static final Comparator<Object> DEFAULT_COMPARATOR = (a, b) -> {
        if (a == b)
            return 0;
        if (a == null)
            return -1;
        if (b == null)
            return 1;
        if (a instanceof Number && b instanceof Number && a.getClass() != b.getClass()) {
            double x = ((Number) a).doubleValue();
            double y = ((Number) b).doubleValue();
            if (Double.isNaN(x) || Double.isNaN(y) || Double.isInfinite(x) || Double.isInfinite(y))
                return Double.compare(x, y);
            return toBigDecimal((Number) a).compareTo(toBigDecimal((Number) b));
        }
        return Utils.<Comparable<Object>>cast(a).compareTo(b);
    };
    
    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal)
            return (BigDecimal) number;
        if (number instanceof BigInteger)
            return new BigDecimal((BigInteger) number);
        if (number instanceof Double || number instanceof Float)
            return BigDecimal.valueOf(number.doubleValue());
        return BigDecimal.valueOf(number.longValue());
    }
    
    /**
     * Returns a value that equals the normalized form of any other value holding the same data. Numbers become
     * {@link BigDecimal}s without trailing zeros, so {@code 1}, {@code 1L} and {@code 1.0} normalize equal. NaN and
     * the infinities become {@link Double}s. Maps, lists and sets are copied with their elements normalized. Anything
     * else is returned as-is.
     */
    static Object normalize(Object value) {
        if (value instanceof Number) {
            Number number = (Number) value;
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d))
                return d;
            return toBigDecimal(number).stripTrailingZeros();
        }
        if (value instanceof Map) {
            Map<Object, Object> normalized = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> normalized.put(k, normalize(v)));
            return normalized;
        }
        if (value instanceof List) {
            List<Object> normalized = new ArrayList<>();
            for (Object element : (List<?>) value)
                normalized.add(normalize(element));
            return normalized;
        }
        if (value instanceof Set) {
            Set<Object> normalized = new HashSet<>();
            for (Object element : (Set<?>) value)
                normalized.add(normalize(element));
            return normalized;
        }
        return value;
    }
    
    /**
     * Returns a new row with the given fields of the given row, in the order of the fields. Fields the row does not
     * have are left out.
     */
    static Map<String, Object> pick(Map<String, ?> row, Collection<String> fields) {
        Map<String, Object> picked = new LinkedHashMap<>();
        for (String field : fields)
            if (row.containsKey(field))
                picked.put(field, row.get(field));
        return picked;
    }
    
    /**
     * Returns a new row with all but the given fields of the given row.
     */
    static Map<String, Object> omit(Map<String, ?> row, Collection<String> fields) {
        Map<String, Object> kept = new LinkedHashMap<>(row);
        kept.keySet().removeAll(fields);
        return kept;
    }
}
