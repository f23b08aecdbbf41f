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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TypesTest {
    
    @Test
    void testClassifyScalars() {
        assertEquals(ColumnType.NULL, Types.classify(null));
        assertEquals(ColumnType.INTEGER, Types.classify(42));
        assertEquals(ColumnType.INTEGER, Types.classify(42L));
        assertEquals(ColumnType.INTEGER, Types.classify(3.0));
        assertEquals(ColumnType.NUMBER, Types.classify(3.5));
        assertEquals(ColumnType.NUMBER, Types.classify(Double.NaN));
        assertEquals(ColumnType.INTEGER, Types.classify(new BigDecimal("2.00")));
        assertEquals(ColumnType.NUMBER, Types.classify(new BigDecimal("2.50")));
        assertEquals(ColumnType.BOOLEAN, Types.classify(true));
        assertEquals(ColumnType.STRING, Types.classify("hello"));
        assertEquals(ColumnType.STRING, Types.classify(""));
    }
    
    @Test
    void testClassifyStructures() {
        assertEquals(ColumnType.ARRAY, Types.classify(List.of(1, 2)));
        assertEquals(ColumnType.ARRAY, Types.classify(new int[0]));
        assertEquals(ColumnType.ARRAY, Types.classify(Set.of("a")));
        assertEquals(ColumnType.OBJECT, Types.classify(Map.of("a", 1)));
        assertEquals(ColumnType.OBJECT, Types.classify(new Object()));
    }
    
    @Test
    void testClassifyDates() {
        assertEquals(ColumnType.DATE, Types.classify(LocalDate.of(2020, 1, 1)));
        assertEquals(ColumnType.DATE, Types.classify(Instant.EPOCH));
        assertEquals(ColumnType.DATE, Types.classify(new Date()));
        assertEquals(ColumnType.DATE, Types.classify("2020-01-01"));
        assertEquals(ColumnType.DATE, Types.classify("2020-01-01T10:15:30"));
        assertEquals(ColumnType.DATE, Types.classify("2020-01-01T10:15:30Z"));
        assertEquals(ColumnType.DATE, Types.classify("2020-01-01T10:15:30+01:00"));
        assertEquals(ColumnType.DATE, Types.classify("Tue, 3 Jun 2008 11:05:30 GMT"));
        assertEquals(ColumnType.STRING, Types.classify("2020-13-45"));
        assertEquals(ColumnType.STRING, Types.classify("sometime in 2020"));
    }
    
    @Test
    void testInfer() {
        assertEquals(ColumnType.UNDEFINED, Types.infer(List.of()));
        assertEquals(ColumnType.NULL, Types.infer(Arrays.asList(null, null)));
        assertEquals(ColumnType.INTEGER, Types.infer(Arrays.asList(1, null, 2)));
        assertEquals(ColumnType.STRING, Types.infer(Arrays.asList(null, "a", "b")));
        assertEquals(ColumnType.MIXED, Types.infer(Arrays.asList(1, "a")));
        assertEquals(ColumnType.MIXED, Types.infer(Arrays.asList(1, 1.5)));
    }
    
    @Test
    void testTags() {
        assertEquals("currency", ColumnType.CURRENCY.tag());
        assertEquals("integer", ColumnType.INTEGER.toString());
        assertEquals(ColumnType.DATE, ColumnType.ofTag("Date"));
        assertThrows(IllegalArgumentException.class, () -> ColumnType.ofTag("decimal"));
    }
}
