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
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.Collection;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Type inference for single values and for collections of values.
 */
public final class Types {
    private Types() {}
    
    // Tried in order; the first that parses the whole string wins.
    private static final List<Function<CharSequence, ?>> DATE_PARSERS = List.of(
        LocalDate::parse,
        LocalDateTime::parse,
        OffsetDateTime::parse,
        ZonedDateTime::parse,
        Instant::parse,
        text -> DateTimeFormatter.RFC_1123_DATE_TIME.parse(text)
    );
    
    /**
     * Classifies a single value into a {@link ColumnType}.
     *
     * <ul>
     *     <li>{@code null} is {@link ColumnType#NULL}
     *     <li>lists, collections and java arrays are {@link ColumnType#ARRAY}
     *     <li>{@link Date} and {@link Temporal} instances are {@link ColumnType#DATE}
     *     <li>numbers are {@link ColumnType#INTEGER} if they are mathematically integral, otherwise
     *         {@link ColumnType#NUMBER}
     *     <li>booleans are {@link ColumnType#BOOLEAN}
     *     <li>strings are {@link ColumnType#DATE} if they parse as an ISO-8601 or RFC-1123 date or date-time, otherwise
     *         {@link ColumnType#STRING}
     *     <li>anything else, including maps, is {@link ColumnType#OBJECT}
     * </ul>
     *
     * @param value the value to classify
     * @return the type of the value
     */
    public static ColumnType classify(Object value) {
        if (value == null)
            return ColumnType.NULL;
        if (value instanceof Collection || value.getClass().isArray())
            return ColumnType.ARRAY;
        if (value instanceof Date || value instanceof Temporal)
            return ColumnType.DATE;
        if (value instanceof Number)
            return isIntegral((Number) value) ? ColumnType.INTEGER : ColumnType.NUMBER;
        if (value instanceof Boolean)
            return ColumnType.BOOLEAN;
        if (value instanceof CharSequence)
            return isDateString((CharSequence) value) ? ColumnType.DATE : ColumnType.STRING;
        return ColumnType.OBJECT;
    }
    
    /**
     * Infers a common type for the given values. Returns {@link ColumnType#UNDEFINED} if there are no values, and
     * {@link ColumnType#NULL} if every value is {@code null}. Otherwise the first non-null value is classified, and
     * every other non-null value must classify identically, or the result is {@link ColumnType#MIXED}.
     *
     * <p>This checks homogeneity. Schema derivation classifies a single sample value per column instead.
     *
     * @param values the values to inspect
     * @return the common type of the values
     */
    public static ColumnType infer(Collection<?> values) {
        if (values.isEmpty())
            return ColumnType.UNDEFINED;
        ColumnType type = null;
        for (Iterator<?> iter = values.iterator(); iter.hasNext(); ) {
            Object value = iter.next();
            if (value == null)
                continue;
            ColumnType next = classify(value);
            if (type == null)
                type = next;
            else if (type != next)
                return ColumnType.MIXED;
        }
        return type == null ? ColumnType.NULL : type;
    }
    
    static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte
            || number instanceof BigInteger || number instanceof AtomicInteger || number instanceof AtomicLong)
            return true;
        if (number instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) number;
            return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
        }
        double d = number.doubleValue();
        return !Double.isNaN(d) && !Double.isInfinite(d) && d == Math.rint(d);
    }
    
    static boolean isDateString(CharSequence text) {
        if (text.length() == 0)
            return false;
        for (Function<CharSequence, ?> parser : DATE_PARSERS) {
            try {
                parser.apply(text);
                return true;
            } catch (DateTimeParseException e) {
                // Not this format; try the next one.
            }
        }
        return false;
    }
}
