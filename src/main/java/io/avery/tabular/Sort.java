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

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * A sort key for {@link DataFrame#sortBy(Sort...)}: a column name and a direction. Values are compared in natural
 * order, with {@code null} (and absent) values lowest, and numbers of different classes compared by value.
 */
public final class Sort {
    private final String column;
    private final boolean ascending;
    
    private Sort(String column, boolean ascending) {
        this.column = Objects.requireNonNull(column);
        this.ascending = ascending;
    }
    
    public static Sort asc(String column) {
        return new Sort(column, true);
    }
    
    public static Sort desc(String column) {
        return new Sort(column, false);
    }
    
    public String column() {
        return column;
    }
    
    public boolean isAscending() {
        return ascending;
    }
    
    Comparator<Map<String, Object>> comparator() {
        Comparator<Map<String, Object>> comparator = (a, b) -> Utils.DEFAULT_COMPARATOR.compare(a.get(column), b.get(column));
        return ascending ? comparator : comparator.reversed();
    }
    
    /**
     * Returns a comparator that applies the given sort keys in order, each breaking the ties of the ones before it.
     */
    static Comparator<Map<String, Object>> comparing(Sort... sorts) {
        Comparator<Map<String, Object>> comparator = (a, b) -> 0;
        for (Sort sort : sorts)
            comparator = comparator.thenComparing(sort.comparator());
        return comparator;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sort))
            return false;
        Sort other = (Sort) o;
        return column.equals(other.column) && ascending == other.ascending;
    }
    
    @Override
    public int hashCode() {
        return 31 * column.hashCode() + Boolean.hashCode(ascending);
    }
    
    @Override
    public String toString() {
        return column + (ascending ? " asc" : " desc");
    }
}
