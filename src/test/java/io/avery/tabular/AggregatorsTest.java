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

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorsTest {
    
    @Test
    void testCounter() {
        assertEquals(3, Aggregators.counter().apply(values(1, null, "x")));
        assertEquals(0, Aggregators.counter().apply(values()));
    }
    
    @Test
    void testSumAndMean() {
        assertEquals(3.5, Aggregators.sum().apply(values(1, "x", 2.5, null)), 1e-9);
        assertEquals(1.75, Aggregators.mean().apply(values(1, "x", 2.5, null)), 1e-9);
        assertEquals(2.0, Aggregators.mean().apply(values(1, Double.NaN, 3)), 1e-9);
        assertNull(Aggregators.sum().apply(values("x", null)));
        assertNull(Aggregators.mean().apply(values()));
    }
    
    @Test
    void testMinAndMax() {
        assertEquals(1, Aggregators.min().apply(values(3, null, 1, 2)));
        assertEquals(3, Aggregators.max().apply(values(3, null, 1, 2)));
        assertEquals(2.5, Aggregators.max().apply(values(1, 2.5, 2L)));
        assertEquals("a", Aggregators.min().apply(values("b", "a")));
        assertNull(Aggregators.min().apply(values()));
        assertNull(Aggregators.max().apply(values(null, null)));
    }
    
    @Test
    void testQuantile() {
        assertEquals(2.5, Aggregators.quantile(0.5).apply(values(4, 1, 3, 2)), 1e-9);
        assertEquals(1.0, Aggregators.quantile(0.0).apply(values(4, 1, 3, 2)), 1e-9);
        assertEquals(4.0, Aggregators.quantile(1.0).apply(values(4, 1, 3, 2)), 1e-9);
        assertEquals(7.0, Aggregators.quantile(0.9).apply(values(7)), 1e-9);
        assertEquals(13.5, Aggregators.quantile(0.25).apply(values(16, 12, 15)), 1e-9);
        assertNull(Aggregators.quantile(0.5).apply(values()));
    }
    
    @Test
    void testQuantiles() {
        Map<String, Object> box = Aggregators.quantiles().apply(values(12, 15, 16));
        
        assertEquals(List.of("q1", "q3", "iqr", "qr_min", "qr_max"), new ArrayList<>(box.keySet()));
        assertEquals(13.5, (Double) box.get("q1"), 1e-9);
        assertEquals(15.5, (Double) box.get("q3"), 1e-9);
        assertEquals(2.0, (Double) box.get("iqr"), 1e-9);
        assertEquals(10.5, (Double) box.get("qr_min"), 1e-9);
        assertEquals(16.5, (Double) box.get("qr_max"), 1e-9);
    }
    
    @Test
    void testViolin() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("q1", 1.0);
        row.put("q3", 3);
        
        Map<String, Object> out = Aggregators.violin().apply(row);
        
        assertEquals(2.0, (Double) out.get("iqr"), 1e-9);
        assertEquals(-2.0, (Double) out.get("qr_min"), 1e-9);
        assertEquals(4.0, (Double) out.get("qr_max"), 1e-9);
        assertFalse(row.containsKey("iqr"));
        
        Map<String, Object> missing = Aggregators.violin().apply(Map.of("q1", 1.0));
        assertTrue(missing.containsKey("iqr"));
        assertNull(missing.get("iqr"));
        assertNull(missing.get("qr_max"));
    }
    
    @Test
    void testViolinOverApply() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int[] quartiles : new int[][]{ {2, 4}, {0, 0} }) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("q1", quartiles[0]);
            row.put("q3", quartiles[1]);
            rows.add(row);
        }
        DataFrame df = DataFrame.of(rows);
        
        List<Map<String, Object>> out = df.apply(Aggregators.violin());
        
        assertEquals(5.0, (Double) out.get(0).get("qr_max"), 1e-9);
        assertEquals(0.0, (Double) out.get(1).get("iqr"), 1e-9);
    }
    
    private static List<Object> values(Object... values) {
        return Arrays.asList(values);
    }
}
