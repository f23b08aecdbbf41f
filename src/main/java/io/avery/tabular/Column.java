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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata describing one column of a {@link Schema schema}: its name, its {@link ColumnType type}, and the optional
 * attributes that formatting and hierarchy components read (display fields, digits, path marker, nested metadata).
 *
 * <p>Columns are immutable. The {@code with*} methods return modified copies.
 *
 * <p>Columns have a value-based {@code equals()} and {@code hashCode()}, covering every attribute. Two schemas are
 * equal only if their columns are pairwise equal, in order.
 */
public final class Column {
    private final String name;
    private final ColumnType type;
    private final Map<String, String> fields;
    private final Integer digits;
    private final boolean path;
    private final String separator;
    private final Schema metadata;
    
    private Column(String name, ColumnType type, Map<String, String> fields, Integer digits, boolean path,
                   String separator, Schema metadata) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.fields = fields;
        this.digits = digits;
        this.path = path;
        this.separator = separator;
        this.metadata = metadata;
    }
    
    /**
     * Creates a column with the given name and type, and no other attributes.
     *
     * @param name the column name
     * @param type the column type
     * @return a new column
     */
    public static Column of(String name, ColumnType type) {
        return new Column(name, type, Collections.emptyMap(), null, false, null, null);
    }
    
    /**
     * Creates an {@link ColumnType#ARRAY array} column whose elements are described by the given nested schema.
     *
     * @param name the column name
     * @param metadata the schema of the array elements
     * @return a new column
     */
    public static Column ofArray(String name, Schema metadata) {
        return new Column(name, ColumnType.ARRAY, Collections.emptyMap(), null, false, null,
                          Objects.requireNonNull(metadata));
    }
    
    public String name() {
        return name;
    }
    
    public ColumnType type() {
        return type;
    }
    
    /**
     * Returns an unmodifiable view of the display-field map. For a {@link ColumnType#CURRENCY currency} column this
     * contains the {@code "currency"} entry, naming the column that holds the currency code.
     *
     * @return the display-field map
     */
    public Map<String, String> fields() {
        return fields;
    }
    
    /**
     * Returns the number of fraction digits to display, or {@code null} if unspecified.
     *
     * @return the number of fraction digits, or {@code null}
     */
    public Integer digits() {
        return digits;
    }
    
    /**
     * Returns {@code true} if this column holds hierarchy paths. The schema only tags the column; it does not interpret
     * the paths.
     *
     * @return {@code true} if this column holds hierarchy paths
     */
    public boolean isPath() {
        return path;
    }
    
    /**
     * Returns the path separator, or {@code null} if this is not a {@link #isPath() path} column.
     *
     * @return the path separator, or {@code null}
     */
    public String separator() {
        return separator;
    }
    
    /**
     * Returns the schema of the elements of an {@link ColumnType#ARRAY array} column, or {@code null} if there is
     * none.
     *
     * @return the nested schema, or {@code null}
     */
    public Schema metadata() {
        return metadata;
    }
    
    public Column withName(String name) {
        return new Column(name, type, fields, digits, path, separator, metadata);
    }
    
    public Column withType(ColumnType type) {
        return new Column(name, type, fields, digits, path, separator, metadata);
    }
    
    public Column withDigits(Integer digits) {
        return new Column(name, type, fields, digits, path, separator, metadata);
    }
    
    public Column withMetadata(Schema metadata) {
        return new Column(name, type, fields, digits, path, separator, metadata);
    }
    
    /**
     * Returns a copy of this column with the given display-field added or replaced.
     *
     * @param key the display-field key
     * @param value the display-field value
     * @return a copy of this column with the display-field set
     */
    public Column withField(String key, String value) {
        Map<String, String> next = new LinkedHashMap<>(fields);
        next.put(key, value);
        return new Column(name, type, Collections.unmodifiableMap(next), digits, path, separator, metadata);
    }
    
    /**
     * Returns a copy of this column tagged as a hierarchy path column with the given separator.
     *
     * @param separator the path separator
     * @return a copy of this column tagged as a path column
     */
    public Column asPath(String separator) {
        return new Column(name, type, fields, digits, true, Objects.requireNonNull(separator), metadata);
    }
    
    /**
     * Returns a copy of this column upgraded to a {@link ColumnType#CURRENCY currency} column, with two fraction digits
     * and its currency code held in the named column.
     *
     * @param currencyColumn the name of the column holding the currency code
     * @return a copy of this column upgraded to a currency column
     */
    public Column asCurrency(String currencyColumn) {
        return withField("currency", currencyColumn).withType(ColumnType.CURRENCY).withDigits(2);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Column))
            return false;
        Column other = (Column) o;
        return name.equals(other.name)
            && type == other.type
            && fields.equals(other.fields)
            && Objects.equals(digits, other.digits)
            && path == other.path
            && Objects.equals(separator, other.separator)
            && Objects.equals(metadata, other.metadata);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, type, fields, digits, path, separator, metadata);
    }
    
    /**
     * Returns a string representation of this column, as the name and type, followed by any other attributes that are
     * set. A {@code text} display field that just repeats the name is left out. For example:
     *
     * <pre>{@code
     * price:currency{digits=2, fields={currency=price_currency}}
     * }</pre>
     *
     * @return a string representation of this column
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append(':').append(type);
        StringBuilder attrs = new StringBuilder();
        String delimiter = "";
        if (digits != null) {
            attrs.append("digits=").append(digits);
            delimiter = ", ";
        }
        Map<String, String> shown = fields;
        if (name.equals(fields.get("text"))) {
            shown = new LinkedHashMap<>(fields);
            shown.remove("text");
        }
        if (!shown.isEmpty()) {
            attrs.append(delimiter).append("fields=").append(shown);
            delimiter = ", ";
        }
        if (path) {
            attrs.append(delimiter).append("path=").append(separator);
            delimiter = ", ";
        }
        if (metadata != null)
            attrs.append(delimiter).append("metadata=").append(metadata);
        if (attrs.length() > 0)
            sb.append('{').append(attrs).append('}');
        return sb.toString();
    }
}
