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

class SchemaTest {
    
    @Test
    void testDeriveFromFirstRow() {
        Schema schema = Schema.derive(List.of(
            row("id", 1, "name", "x", "price", 9.5, "born", "1990-04-01"),
            row("id", 2, "extra", true)
        ));
        
        Schema expected = Schema.of(
            derived("id", ColumnType.INTEGER),
            derived("name", ColumnType.STRING),
            derived("price", ColumnType.NUMBER),
            derived("born", ColumnType.DATE)
        );
        assertEquals(expected, schema);
        assertEquals(List.of("id", "name", "price", "born"), schema.names());
        assertEquals(Map.of("id", 0, "name", 1, "price", 2, "born", 3), schema.columnIndex());
    }
    
    @Test
    void testDeriveEmpty() {
        assertTrue(Schema.derive(List.of()).isEmpty());
        assertEquals(Schema.empty(), Schema.derive(List.of()));
    }
    
    @Test
    void testExplicitMetadata() {
        Schema explicit = Schema.of(Column.of("a", ColumnType.STRING));
        Schema schema = Schema.derive(List.of(row("a", 1, "b", 2)), new FrameOptions().metadata(explicit));
        assertSame(explicit, schema);
        
        Schema derived = Schema.derive(List.of(row("a", 1)), new FrameOptions().metadata(Schema.empty()));
        assertEquals(Schema.of(derived("a", ColumnType.INTEGER)), derived);
    }
    
    @Test
    void testDeepScan() {
        List<Map<String, Object>> rows = List.of(
            row("a", 1, "b", null),
            row("b", "x", "c", true),
            row("b", "y", "d", null)
        );
        
        Schema shallow = Schema.derive(rows);
        assertEquals(Schema.of(derived("a", ColumnType.INTEGER), derived("b", ColumnType.NULL)), shallow);
        
        Schema deep = Schema.derive(rows, new FrameOptions().deepScan(true));
        Schema expected = Schema.of(
            derived("a", ColumnType.INTEGER),
            derived("b", ColumnType.STRING),
            derived("c", ColumnType.BOOLEAN)
        );
        assertEquals(expected, deep);
    }
    
    @Test
    void testDeepScanSample() {
        Map<String, Object> sample = Schema.deepScanSample(List.of(
            row("a", null, "b", 1),
            row("a", "first", "b", 2),
            row("a", "second")
        ));
        assertEquals(row("b", 1, "a", "first"), sample);
        assertEquals(List.of("b", "a"), new ArrayList<>(sample.keySet()));
    }
    
    @Test
    void testCurrencyConvention() {
        Schema schema = Schema.derive(List.of(row("price", 10, "price_currency", "USD", "qty", 1)));
        
        assertEquals(List.of("price", "qty"), schema.names());
        Column price = schema.column("price");
        assertEquals(ColumnType.CURRENCY, price.type());
        assertEquals(Map.of("text", "price", "currency", "price_currency"), price.fields());
        assertEquals(2, price.digits());
        assertEquals(ColumnType.INTEGER, schema.column("qty").type());
    }
    
    @Test
    void testDerivedColumnsCarryDisplayText() {
        Schema schema = Schema.derive(List.of(row("id", 1, "amount", 2.5, "amount_currency", "EUR")));
        
        assertEquals("id", schema.column("id").fields().get("text"));
        assertEquals("amount", schema.column("amount").fields().get("text"));
        assertEquals("id:integer", schema.column("id").toString());
        assertEquals("amount:currency{digits=2, fields={currency=amount_currency}}",
                     schema.column("amount").toString());
        assertEquals("id", schema.column("id").withName("key").fields().get("text"));
        assertTrue(Column.of("id", ColumnType.INTEGER).fields().isEmpty());
    }
    
    @Test
    void testUnmatchedCurrencyColumnGoesLast() {
        Schema schema = Schema.derive(List.of(row("fee_currency", "EUR", "amount", 3)));
        
        assertEquals(List.of("amount", "fee_currency"), schema.names());
        assertEquals(ColumnType.STRING, schema.column("fee_currency").type());
    }
    
    @Test
    void testCustomCurrencySuffix() {
        Schema schema = Schema.derive(List.of(row("cost", 4.25, "cost$", "GBP")),
                                      new FrameOptions().currencySuffix("$"));
        
        assertEquals(List.of("cost"), schema.names());
        assertEquals(ColumnType.CURRENCY, schema.column("cost").type());
        assertEquals("cost$", schema.column("cost").fields().get("currency"));
    }
    
    @Test
    void testPathConvention() {
        List<Map<String, Object>> rows = List.of(row("name", "leaf", "size", 3, "path", "root/branch/leaf"));
        
        Schema schema = Schema.derive(rows, new FrameOptions().path("path"));
        assertEquals(List.of("path", "name", "size"), schema.names());
        assertTrue(schema.column("path").isPath());
        assertEquals("/", schema.column("path").separator());
        assertFalse(schema.column("name").isPath());
        
        Schema piped = Schema.derive(rows, new FrameOptions().path("path").separator("|"));
        assertEquals("|", piped.column("path").separator());
        
        Schema missing = Schema.derive(rows, new FrameOptions().path("lineage"));
        assertEquals(List.of("name", "size", "path"), missing.names());
        assertFalse(missing.column("path").isPath());
    }
    
    @Test
    void testCombineAppendsNewColumns() {
        Schema first = Schema.of(Column.of("a", ColumnType.INTEGER), Column.of("b", ColumnType.STRING));
        Schema second = Schema.of(Column.of("c", ColumnType.BOOLEAN), Column.of("a", ColumnType.INTEGER));
        
        Schema combined = Schema.combine(first, second, false);
        assertEquals(List.of("a", "b", "c"), combined.names());
    }
    
    @Test
    void testCombineConflict() {
        Schema first = Schema.of(Column.of("x", ColumnType.INTEGER), Column.of("y", ColumnType.STRING));
        Schema second = Schema.of(Column.of("x", ColumnType.STRING));
        
        SchemaConflictException e = assertThrows(SchemaConflictException.class,
                                                 () -> Schema.combine(first, second, false));
        assertEquals("x", e.column());
        assertEquals("Metadata conflict: x has conflicting types", e.getMessage());
        
        Schema overwritten = Schema.combine(first, second, true);
        assertEquals(Schema.of(Column.of("x", ColumnType.STRING), Column.of("y", ColumnType.STRING)), overwritten);
    }
    
    @Test
    void testCombineOverwriteKeepsAttributes() {
        Column price = Column.of("price", ColumnType.NUMBER).asCurrency("price_currency");
        Schema combined = Schema.combine(Schema.of(price), Schema.of(Column.of("price", ColumnType.INTEGER)), true);
        
        assertEquals(ColumnType.INTEGER, combined.column("price").type());
        assertEquals("price_currency", combined.column("price").fields().get("currency"));
    }
    
    @Test
    void testLookup() {
        Schema schema = Schema.of(Column.of("a", ColumnType.INTEGER), Column.of("b", ColumnType.STRING));
        
        assertEquals(1, schema.indexOf("b"));
        assertEquals(-1, schema.indexOf("z"));
        assertTrue(schema.contains("a"));
        assertFalse(schema.contains("z"));
        UnknownColumnException e = assertThrows(UnknownColumnException.class, () -> schema.column("z"));
        assertEquals(List.of("z"), e.columns());
    }
    
    @Test
    void testDuplicateColumns() {
        assertThrows(IllegalArgumentException.class,
                     () -> Schema.of(Column.of("a", ColumnType.INTEGER), Column.of("a", ColumnType.STRING)));
    }
    
    @Test
    void testEquality() {
        Schema a = Schema.of(Column.of("a", ColumnType.INTEGER), Column.of("b", ColumnType.STRING));
        Schema b = Schema.of(List.of(Column.of("a", ColumnType.INTEGER), Column.of("b", ColumnType.STRING)));
        Schema reordered = Schema.of(Column.of("b", ColumnType.STRING), Column.of("a", ColumnType.INTEGER));
        
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, reordered);
        assertNotEquals(Schema.of(Column.of("a", ColumnType.INTEGER)),
                        Schema.of(Column.of("a", ColumnType.INTEGER).asPath("/")));
        assertEquals(Column.ofArray("a", Schema.empty()), Column.of("a", ColumnType.ARRAY).withMetadata(Schema.empty()));
    }
    
    private static Column derived(String name, ColumnType type) {
        return Column.of(name, type).withField("text", name);
    }
    
    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2)
            row.put((String) keyValues[i], keyValues[i+1]);
        return row;
    }
}
