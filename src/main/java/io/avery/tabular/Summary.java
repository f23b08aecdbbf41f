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

/**
 * A named summary of a rollup: a mapper that extracts a value from each row of a group, and one or more reducers that
 * each turn the collected values of a group into an output field.
 *
 * @see DataFrame#summarize(Function, Map)
 */
public final class Summary {
    final String name;
    final Function<? super Map<String, Object>, ?> mapper;
    final Map<String, Function<? super List<Object>, ?>> reducers;
    
    Summary(String name, Function<? super Map<String, Object>, ?> mapper,
            Map<String, ? extends Function<? super List<Object>, ?>> reducers) {
        this.name = Objects.requireNonNull(name);
        this.mapper = Objects.requireNonNull(mapper);
        if (reducers.isEmpty())
            throw new IllegalArgumentException("A summary needs at least one reducer");
        Map<String, Function<? super List<Object>, ?>> copy = new LinkedHashMap<>(reducers);
        this.reducers = Collections.unmodifiableMap(copy);
    }
    
    /**
     * Returns a summary whose values are collected as-is into the given output field.
     */
    static Summary collecting(String name, Function<? super Map<String, Object>, ?> mapper, String as) {
        Function<? super List<Object>, ?> identity = values -> values;
        return new Summary(name, mapper, Map.of(as, identity));
    }
    
    /**
     * Returns a mapper that picks the given fields from a row into a new row. Fields the row does not have are left
     * out.
     */
    static Function<Map<String, Object>, Object> picking(List<String> fields) {
        List<String> copy = List.copyOf(fields);
        return row -> Utils.pick(row, copy);
    }
    
    public String name() {
        return name;
    }
    
    /**
     * Returns the output field names, in order.
     *
     * @return the output field names
     */
    public Set<String> fields() {
        return reducers.keySet();
    }
    
    @Override
    public String toString() {
        return "Summary[" + name + " -> " + reducers.keySet() + "]";
    }
}
