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
import java.util.function.BiPredicate;

import static org.junit.jupiter.api.Assertions.*;

class JoinTest {
    private static final BiPredicate<Map<String, Object>, Map<String, Object>> SAME_ID =
        (a, b) -> Objects.equals(a.get("id"), b.get("id"));
    
    @Test
    void testInnerJoin() {
        DataFrame a = DataFrame.of(rows(row("id", 1, "name", "x")));
        DataFrame b = DataFrame.of(rows(row("id", 1, "age", 9), row("id", 2, "age", 5)));
        
        DataFrame joined = a.innerJoin(b, SAME_ID);
        
        assertEquals(List.of(row("id", 1, "name", "x", "age", 9)), joined.rows());
        assertEquals(List.of("id", "name", "age"), joined.schema().names());
    }
    
    @Test
    void testLeftJoinWithoutMatch() {
        DataFrame a = DataFrame.of(rows(row("id", 3, "name", "y")));
        DataFrame b = DataFrame.of(rows(row("id", 1, "age", 9), row("id", 2, "age", 5)));
        
        DataFrame joined = a.join(b, SAME_ID, join -> join.type("left"));
        
        assertEquals(List.of(row("id", 3, "name", "y")), joined.rows());
        assertEquals(List.of("id", "name", "age"), joined.schema().names());
    }
    
    @Test
    void testRowCounts() {
        DataFrame a = DataFrame.of(rows(row("id", 1), row("id", 2, "l", "p"), row("id", 2, "l", "q"), row("id", 3)));
        DataFrame b = DataFrame.of(rows(row("id", 2, "r", "s"), row("id", 2, "r", "t"), row("id", 4, "r", "u")));
        
        assertEquals(4, a.innerJoin(b, SAME_ID).size());
        assertEquals(6, a.leftJoin(b, SAME_ID).size());
        assertEquals(6, a.outerJoin(b, SAME_ID).size());
        assertEquals(7, a.fullJoin(b, SAME_ID).size());
        assertEquals(5, a.rightJoin(b, SAME_ID).size());
    }
    
    @Test
    void testInnerJoinPairOrder() {
        DataFrame a = DataFrame.of(rows(row("id", 1, "l", "a"), row("id", 1, "l", "b")));
        DataFrame b = DataFrame.of(rows(row("id", 1, "r", "c"), row("id", 1, "r", "d")));
        
        List<Map<String, Object>> expected = List.of(
            row("id", 1, "l", "a", "r", "c"),
            row("id", 1, "l", "a", "r", "d"),
            row("id", 1, "l", "b", "r", "c"),
            row("id", 1, "l", "b", "r", "d")
        );
        assertEquals(expected, a.innerJoin(b, SAME_ID).rows());
    }
    
    @Test
    void testLeftValuesWinCollisions() {
        DataFrame a = DataFrame.of(rows(row("id", 1, "v", "left"), row("id", 2, "v", null)));
        DataFrame b = DataFrame.of(rows(row("id", 1, "v", "right"), row("id", 2, "v", "right")));
        
        List<Map<String, Object>> expected = List.of(
            row("id", 1, "v", "left"),
            row("id", 2, "v", null)
        );
        assertEquals(expected, a.innerJoin(b, SAME_ID).rows());
    }
    
    @Test
    void testRightJoinPutsRightOperandFirst() {
        DataFrame a = DataFrame.of(rows(row("id", 1, "name", "x"), row("id", 3, "name", "y")));
        DataFrame b = DataFrame.of(rows(row("id", 1, "age", 9), row("id", 2, "age", 5)));
        
        DataFrame joined = a.rightJoin(b, SAME_ID);
        
        assertEquals(List.of(row("id", 1, "age", 9, "name", "x"), row("id", 2, "age", 5)), joined.rows());
        assertEquals(List.of("id", "age", "name"), new ArrayList<>(joined.rows().get(0).keySet()));
        assertEquals(List.of("id", "age", "name"), joined.schema().names());
    }
    
    @Test
    void testRightJoinPredicateSeesLeftRowFirst() {
        DataFrame a = DataFrame.of(rows(row("k", 1)));
        DataFrame b = DataFrame.of(rows(row("fk", 1), row("fk", 2)));
        
        DataFrame joined = a.rightJoin(b, (l, r) -> l.get("k").equals(r.get("fk")));
        
        assertEquals(List.of(row("fk", 1, "k", 1), row("fk", 2)), joined.rows());
    }
    
    @Test
    void testFullJoinWithRenaming() {
        DataFrame a = DataFrame.of(rows(row("id", 1, "name", "x")));
        DataFrame b = DataFrame.of(rows(row("id", 1, "age", 9), row("id", 2, "age", 5)));
        
        DataFrame joined = a.join(b, SAME_ID, join -> join
            .type(JoinType.FULL)
            .right(Renaming.prefix("b"))
        );
        
        List<Map<String, Object>> expected = List.of(
            row("id", 1, "name", "x", "b_id", 1, "b_age", 9),
            row("b_id", 2, "b_age", 5)
        );
        assertEquals(expected, joined.rows());
        assertEquals(List.of("id", "name", "b_id", "b_age"), joined.schema().names());
    }
    
    @Test
    void testRenamingBothSides() {
        DataFrame a = DataFrame.of(rows(row("id", 1, "name", "x")));
        DataFrame b = DataFrame.of(rows(row("id", 1, "name", "z")));
        
        DataFrame joined = a.join(b, SAME_ID, join -> join
            .left(Renaming.suffix("a"))
            .right(Renaming.suffix("b"))
        );
        
        assertEquals(List.of(row("id_a", 1, "name_a", "x", "id_b", 1, "name_b", "z")), joined.rows());
        assertEquals(List.of("id_a", "name_a", "id_b", "name_b"), joined.schema().names());
    }
    
    @Test
    void testLeftColumnsWinSchemaConflicts() {
        DataFrame a = DataFrame.of(rows(row("id", 1, "v", "s")));
        DataFrame b = DataFrame.of(rows(row("id", 1, "v", 2)));
        
        DataFrame joined = a.innerJoin(b, SAME_ID);
        
        assertEquals(ColumnType.STRING, joined.schema().column("v").type());
    }
    
    @Test
    void testJoinDoesNotModifyOperands() {
        List<Map<String, Object>> left = rows(row("id", 1, "name", "x"), row("id", 2, "name", "y"));
        List<Map<String, Object>> right = rows(row("id", 1, "age", 9), row("id", 3, "age", 4));
        DataFrame a = DataFrame.of(left);
        DataFrame b = DataFrame.of(right);
        
        DataFrame joined = a.fullJoin(b, SAME_ID);
        joined.update(row("touched", true));
        
        assertEquals(rows(row("id", 1, "name", "x"), row("id", 2, "name", "y")), left);
        assertEquals(rows(row("id", 1, "age", 9), row("id", 3, "age", 4)), right);
    }
    
    @Test
    void testNestedJoin() {
        DataFrame orders = DataFrame.of(rows(
            row("customer", 1, "amount", 5),
            row("customer", 1, "amount", 7),
            row("customer", 2, "amount", 1)
        ));
        DataFrame customers = DataFrame.of(rows(row("id", 1, "name", "a"), row("id", 3, "name", "c")));
        
        DataFrame nested = orders.nestedJoin(customers, (o, c) -> o.get("customer").equals(c.get("id")));
        
        List<Map<String, Object>> expected = List.of(
            row("id", 1, "name", "a", "children", List.of(row("customer", 1, "amount", 5), row("customer", 1, "amount", 7))),
            row("id", 3, "name", "c", "children", List.of())
        );
        assertEquals(expected, nested.rows());
        
        Column children = nested.schema().column("children");
        assertEquals(ColumnType.ARRAY, children.type());
        assertEquals(orders.schema(), children.metadata());
        assertEquals(List.of("id", "name", "children"), nested.schema().names());
        
        List<?> nestedRows = (List<?>) nested.rows().get(0).get("children");
        assertNotSame(orders.rows().get(0), nestedRows.get(0));
        assertFalse(customers.rows().get(0).containsKey("children"));
    }
    
    @Test
    void testNestedJoinCustomField() {
        DataFrame items = DataFrame.of(rows(row("parent", "p", "n", 1)));
        DataFrame parents = DataFrame.of(rows(row("key", "p", "items", "stale")));
        
        DataFrame nested = items.nestedJoin(parents, (i, p) -> i.get("parent").equals(p.get("key")), "items");
        
        assertEquals(List.of(row("key", "p", "items", List.of(row("parent", "p", "n", 1)))), nested.rows());
        assertEquals(List.of("key", "items"), nested.schema().names());
        assertEquals(ColumnType.ARRAY, nested.schema().column("items").type());
    }
    
    @Test
    void testJoinTypeTokens() {
        assertEquals(JoinType.INNER, JoinType.of("inner"));
        assertEquals(JoinType.LEFT, JoinType.of("outer"));
        assertEquals(JoinType.FULL, JoinType.of("FULL"));
        assertEquals(JoinType.NESTED, JoinType.of("nested"));
        
        DataFrame a = DataFrame.of(rows(row("id", 1)));
        UnknownJoinTypeException e = assertThrows(UnknownJoinTypeException.class,
                                                  () -> a.join(a, SAME_ID, join -> join.type("sideways")));
        assertEquals("sideways", e.token());
        assertEquals("Unknown join type: sideways", e.getMessage());
    }
    
    @Test
    void testJoinEmptyOperands() {
        DataFrame empty = DataFrame.of(rows());
        DataFrame b = DataFrame.of(rows(row("id", 1, "age", 9)));
        
        assertEquals(List.of(), empty.innerJoin(b, SAME_ID).rows());
        assertEquals(List.of(), empty.leftJoin(b, SAME_ID).rows());
        assertEquals(List.of(row("id", 1, "age", 9)), empty.fullJoin(b, SAME_ID).rows());
        assertEquals(List.of(row("id", 1, "age", 9)), b.leftJoin(empty, SAME_ID).rows());
    }
    
    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2)
            row.put((String) keyValues[i], keyValues[i+1]);
        return row;
    }
    
    @SafeVarargs
    private static List<Map<String, Object>> rows(Map<String, Object>... rows) {
        return new ArrayList<>(Arrays.asList(rows));
    }
}
