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

/**
 * An ordered, immutable collection of {@link Column columns} describing the shape of a row collection. Column names
 * are distinct from each other. The order is the order in which columns were first seen (or declared), and is used for
 * display and for the output order of unions.
 *
 * <p>Each schema carries its column index, a mapping from column name to position. The index is built once, when the
 * schema is created, so it can never drift out of sync with the columns. Operations that change the shape of a schema
 * produce a new schema, with a new index.
 */
public final class Schema {
    private static final System.Logger LOG = System.getLogger(Schema.class.getName());
    private static final Schema EMPTY = new Schema(new Column[0]);
    
    final Column[] columns;
    final Map<String, Integer> indexByName;
    
    private Schema(Column[] columns) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < columns.length; i++)
            if (index.putIfAbsent(columns[i].name(), i) != null)
                throw new IllegalArgumentException("Duplicate column: " + columns[i].name());
        this.columns = columns;
        this.indexByName = Collections.unmodifiableMap(index);
    }
    
    /**
     * Returns the empty schema.
     *
     * @return the empty schema
     */
    public static Schema empty() {
        return EMPTY;
    }
    
    /**
     * Returns a schema of the given columns, in order.
     *
     * @param columns the columns
     * @return a schema of the given columns
     * @throws IllegalArgumentException if two columns have the same name
     */
    public static Schema of(Column... columns) {
        return columns.length == 0 ? EMPTY : new Schema(columns.clone());
    }
    
    /**
     * Returns a schema of the given columns, in order.
     *
     * @param columns the columns
     * @return a schema of the given columns
     * @throws IllegalArgumentException if two columns have the same name
     */
    public static Schema of(List<Column> columns) {
        return columns.isEmpty() ? EMPTY : new Schema(columns.toArray(new Column[0]));
    }
    
    // --- derivation ---
    
    /**
     * Derives a schema from the given rows with default options.
     *
     * @param rows the rows
     * @return the derived schema
     * @see #derive(List, FrameOptions)
     */
    public static Schema derive(List<? extends Map<String, ?>> rows) {
        return derive(rows, new FrameOptions());
    }
    
    /**
     * Derives a schema from the given rows.
     *
     * <p>If the options supply explicit {@link FrameOptions#metadata(Schema) metadata}, and it is not empty, it is
     * returned as-is. Otherwise, if there are no rows, the empty schema is returned. Otherwise a sample row is taken -
     * the first row, or a {@link #deepScanSample deep-scan sample} if {@link FrameOptions#deepScan(boolean) deep scan}
     * is enabled - and each of its values is {@link Types#classify classified} to produce a column. Each derived column
     * gets the display field {@code text}, holding the column name.
     *
     * <p>Two naming conventions are then applied:
     * <ul>
     *     <li>If the options name a {@link FrameOptions#path(String) path} column that exists, it is tagged as a path
     *         column with the configured separator, and moved to the front.
     *     <li>A column whose name ends with the {@link FrameOptions#currencySuffix(String) currency suffix} is folded
     *         into the column named without the suffix, if there is one, which becomes a
     *         {@link ColumnType#CURRENCY currency} column. A suffixed column without such a sibling is kept as an
     *         ordinary column, after all other columns.
     * </ul>
     *
     * @param rows the rows
     * @param options the derivation options
     * @return the derived schema
     */
    public static Schema derive(List<? extends Map<String, ?>> rows, FrameOptions options) {
        Schema explicit = options.metadata();
        if (explicit != null && !explicit.isEmpty())
            return explicit;
        if (rows.isEmpty())
            return EMPTY;
        Map<String, ?> sample = options.deepScan() ? deepScanSample(rows) : rows.get(0);
        List<Column> derived = new ArrayList<>(sample.size());
        sample.forEach((name, value) -> derived.add(Column.of(name, Types.classify(value)).withField("text", name)));
        List<Column> tagged = addPathModifier(derived, options.path(), options.separator());
        return of(mergeCurrencyColumns(tagged, options.currencySuffix()));
    }
    
    /**
     * Builds a sample row that represents every column of a sparse row collection. Each row's entries are folded into
     * the sample in order, skipping {@code null} values, and the first value written for a key wins. Columns are
     * ordered by first appearance of a non-null value.
     *
     * @param rows the rows
     * @return a sample row
     */
    public static Map<String, Object> deepScanSample(List<? extends Map<String, ?>> rows) {
        Map<String, Object> sample = new LinkedHashMap<>();
        for (Map<String, ?> row : rows)
            row.forEach((key, value) -> {
                if (value != null)
                    sample.putIfAbsent(key, value);
            });
        return sample;
    }
    
    /**
     * Derives the schema of the elements of an array value. Elements that are not rows have no columns.
     */
    static Schema deriveNested(Object array) {
        Iterator<?> iter;
        if (array instanceof Iterable)
            iter = ((Iterable<?>) array).iterator();
        else if (array instanceof Object[])
            iter = Arrays.asList((Object[]) array).iterator();
        else
            return EMPTY;
        if (!iter.hasNext())
            return EMPTY;
        Object first = iter.next();
        if (!(first instanceof Map))
            return EMPTY;
        List<Column> derived = new ArrayList<>();
        ((Map<?, ?>) first).forEach((name, value) -> derived.add(Column.of(String.valueOf(name), Types.classify(value))));
        return of(derived);
    }
    
    private static List<Column> addPathModifier(List<Column> columns, String path, String separator) {
        if (path == null)
            return columns;
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(path)) {
                List<Column> result = new ArrayList<>(columns.size());
                result.add(columns.get(i).asPath(separator));
                result.addAll(columns.subList(0, i));
                result.addAll(columns.subList(i + 1, columns.size()));
                return result;
            }
        }
        return columns;
    }
    
    private static List<Column> mergeCurrencyColumns(List<Column> input, String suffix) {
        List<Column> columns = new ArrayList<>();
        List<Column> currencyColumns = new ArrayList<>();
        for (Column column : input)
            (column.name().endsWith(suffix) ? currencyColumns : columns).add(column);
        List<Column> unmatched = new ArrayList<>();
        for (Column currency : currencyColumns) {
            String base = currency.name().substring(0, currency.name().length() - suffix.length());
            int index = indexOf(columns, base);
            if (index == -1)
                unmatched.add(currency);
            else
                columns.set(index, columns.get(index).asCurrency(currency.name()));
        }
        columns.addAll(unmatched);
        return columns;
    }
    
    private static int indexOf(List<Column> columns, String name) {
        for (int i = 0; i < columns.size(); i++)
            if (columns.get(i).name().equals(name))
                return i;
        return -1;
    }
    
    // --- combination ---
    
    /**
     * Combines two schemas. The result starts with the columns of {@code first}. Each column of {@code second} is then
     * appended if {@code first} has no column of that name. If {@code first} has a column of that name with the same
     * type, nothing changes. If the types differ, the existing column takes the type from {@code second} when
     * {@code overwrite} is {@code true}, and otherwise the combination fails.
     *
     * @param first the first schema
     * @param second the second schema
     * @param overwrite whether a differing type in {@code second} replaces the type in {@code first}
     * @return the combined schema
     * @throws SchemaConflictException if a column has conflicting types, and {@code overwrite} is {@code false}
     */
    public static Schema combine(Schema first, Schema second, boolean overwrite) {
        List<Column> result = new ArrayList<>(Arrays.asList(first.columns));
        for (Column column : second.columns) {
            int index = first.indexOf(column.name());
            if (index == -1) {
                result.add(column);
                continue;
            }
            Column existing = result.get(index);
            if (existing.type() == column.type())
                continue;
            if (!overwrite)
                throw new SchemaConflictException(column.name());
            LOG.log(System.Logger.Level.DEBUG, "Retyping column ''{0}'' from {1} to {2}",
                    column.name(), existing.type(), column.type());
            result.set(index, existing.withType(column.type()));
        }
        return of(result);
    }
    
    // --- access ---
    
    /**
     * Returns the position of the named column in this schema, or {@code -1} if this schema has no such column.
     *
     * @param name the column name
     * @return the position of the column, or {@code -1}
     */
    public int indexOf(String name) {
        Integer index = indexByName.get(Objects.requireNonNull(name));
        return index != null ? index : -1;
    }
    
    /**
     * Returns {@code true} if this schema has a column with the given name.
     *
     * @param name the column name
     * @return {@code true} if this schema has a column with the given name
     */
    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }
    
    /**
     * Returns the named column, or throws {@link UnknownColumnException} if this schema has no such column.
     *
     * @param name the column name
     * @return the named column
     * @throws UnknownColumnException if this schema has no such column
     */
    public Column column(String name) {
        int index = indexOf(name);
        if (index == -1)
            throw new UnknownColumnException("Unknown column: " + name, List.of(name));
        return columns[index];
    }
    
    /**
     * Returns an unmodifiable view of the columns, in order.
     *
     * @return the columns
     */
    public List<Column> columns() {
        return Collections.unmodifiableList(Arrays.asList(columns));
    }
    
    /**
     * Returns the column names, in order.
     *
     * @return the column names
     */
    public List<String> names() {
        return List.copyOf(indexByName.keySet());
    }
    
    /**
     * Returns the column index: an unmodifiable mapping from column name to position, iterating in column order.
     *
     * @return the column index
     */
    public Map<String, Integer> columnIndex() {
        return indexByName;
    }
    
    public int size() {
        return columns.length;
    }
    
    public boolean isEmpty() {
        return columns.length == 0;
    }
    
    /**
     * Returns {@code true} if and only if the given object is a schema with equal columns, in the same order as this
     * schema.
     *
     * @param o the object to be compared for equality with this schema
     * @return {@code true} if the given object is equal to this schema
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Schema))
            return false;
        return Arrays.equals(columns, ((Schema) o).columns);
    }
    
    @Override
    public int hashCode() {
        return Arrays.hashCode(columns);
    }
    
    @Override
    public String toString() {
        return "Schema" + Arrays.toString(columns);
    }
}
