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

import java.util.Locale;

/**
 * The semantic type of a column, as inferred from its values or declared on its {@link Column metadata}. Formatting
 * components select a formatter from this tag; the engine itself never formats values.
 *
 * <p>{@link #NULL} and {@link #UNDEFINED} are produced by inference only. {@link #CURRENCY} is never inferred from a
 * single value; it is assigned by the currency naming convention during schema derivation.
 *
 * @see Types#classify(Object)
 * @see Types#infer(java.util.Collection)
 */
public enum ColumnType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    DATE,
    ARRAY,
    OBJECT,
    MIXED,
    CURRENCY,
    /** All inspected values were {@code null}. */
    NULL,
    /** There were no values to inspect. */
    UNDEFINED;
    
    private final String tag = name().toLowerCase(Locale.ROOT);
    
    /**
     * Returns the lowercase tag of this type, eg {@code "integer"}.
     *
     * @return the lowercase tag of this type
     */
    public String tag() {
        return tag;
    }
    
    /**
     * Returns the type with the given tag, ignoring case.
     *
     * @param tag the tag
     * @return the type with the given tag
     * @throws IllegalArgumentException if no type has the given tag
     */
    public static ColumnType ofTag(String tag) {
        return valueOf(tag.toUpperCase(Locale.ROOT));
    }
    
    @Override
    public String toString() {
        return tag;
    }
}
