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
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A collection of rows together with a {@link Schema schema} describing them. A row is an open mapping from column
 * name to value; rows in the same data-frame may have different keys. The schema is derived from the rows when the
 * data-frame is created, unless one is supplied explicitly.
 *
 * <p>Data-frame operations fall into two groups, and the split is part of the contract:
 * <ul>
 *     <li><b>Structural operations</b> return a new data-frame and never modify the rows of their inputs:
 *         {@link #join joins}, {@link #rollup()}, {@link #union}, {@link #minus}, {@link #intersect}, {@link #rename}
 *         and {@link #drop}.
 *     <li><b>In-place operations</b> modify this data-frame and return it: {@link #sortBy(String...) sortBy},
 *         {@link #update}, {@link #delete}, {@link #insert}, {@link #fillMissing} and {@link #fillNull}. A data-frame
 *         created by {@link #of(List)} keeps the caller's list (and row maps) as its backing storage, so callers that
 *         retain the list observe these modifications. Use {@link #copyOf(List)} to give the data-frame private copies
 *         instead.
 * </ul>
 *
 * <p>Some operations are configured in steps, with the configuration held on the data-frame until it is consumed:
 * <ul>
 *     <li>{@link #where} arms a one-shot filter. The next {@link #select}, {@link #update} or {@link #delete} applies
 *         it (or matches every row, if none is armed) and disarms it. Arming again replaces the armed filter.
 *         {@link #apply} applies the armed filter without disarming it.
 *     <li>{@link #groupBy}, {@link #summarize(String, String) summarize}, {@link #align} and {@link #using} configure a
 *         rollup, which {@link #rollup()} executes. A rollup consumes its configuration: the group keys, summaries,
 *         alignment keys and template are cleared once it completes.
 * </ul>
 *
 * <p>Data-frames are not thread-safe.
 */
public class DataFrame {
    final List<Map<String, Object>> rows;
    final FrameOptions options;
    Schema schema;
    
    private final PendingFilter filter = new PendingFilter();
    private final List<String> groupByKeys = new ArrayList<>();
    private final List<Summary> summaries = new ArrayList<>();
    private final List<String> alignByKeys = new ArrayList<>();
    private Map<String, Object> template = Collections.emptyMap();
    
    DataFrame(List<Map<String, Object>> rows, Schema schema, FrameOptions options) {
        this.rows = rows;
        this.schema = schema;
        this.options = options;
    }
    
    /**
     * Creates a data-frame backed by the given rows, deriving its schema with default options.
     *
     * @param rows the rows
     * @return a new data-frame
     * @throws InvalidInputException if the list, or any row in it, is {@code null}
     */
    public static DataFrame of(List<Map<String, Object>> rows) {
        return of(rows, options -> {});
    }
    
    /**
     * Creates a data-frame backed by the given rows, with options as configured by the given configurator consumer.
     * The list and its rows are used as-is, and are modified by in-place operations.
     *
     * @param rows the rows
     * @param config a consumer that configures the options
     * @return a new data-frame
     * @throws InvalidInputException if the list, or any row in it, is {@code null}
     */
    public static DataFrame of(List<Map<String, Object>> rows, Consumer<FrameOptions> config) {
        if (rows == null)
            throw new InvalidInputException("data must be a list of rows");
        for (Map<String, Object> row : rows)
            if (row == null)
                throw new InvalidInputException("data must not contain null rows");
        FrameOptions options = new FrameOptions();
        config.accept(options);
        return new DataFrame(rows, Schema.derive(rows, options), options);
    }
    
    /**
     * Creates a data-frame from copies of the given rows, deriving its schema with default options. In-place
     * operations on the data-frame are not visible through the given list or rows.
     *
     * @param rows the rows
     * @return a new data-frame
     * @throws InvalidInputException if the list, or any row in it, is {@code null}
     */
    public static DataFrame copyOf(List<? extends Map<String, ?>> rows) {
        return copyOf(rows, options -> {});
    }
    
    /**
     * Creates a data-frame from copies of the given rows, with options as configured by the given configurator
     * consumer. In-place operations on the data-frame are not visible through the given list or rows.
     *
     * @param rows the rows
     * @param config a consumer that configures the options
     * @return a new data-frame
     * @throws InvalidInputException if the list, or any row in it, is {@code null}
     */
    public static DataFrame copyOf(List<? extends Map<String, ?>> rows, Consumer<FrameOptions> config) {
        if (rows == null)
            throw new InvalidInputException("data must be a list of rows");
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            if (row == null)
                throw new InvalidInputException("data must not contain null rows");
            copy.add(new LinkedHashMap<>(row));
        }
        return of(copy, config);
    }
    
    private DataFrame derived(List<Map<String, Object>> rows, Schema schema) {
        return new DataFrame(rows, schema, options.copy().metadata(null));
    }
    
    // --- access ---
    
    /**
     * Returns an unmodifiable view of the rows. The rows themselves are not copied.
     *
     * @return the rows
     */
    public List<Map<String, Object>> rows() {
        return Collections.unmodifiableList(rows);
    }
    
    /**
     * Returns the schema describing the rows.
     *
     * @return the schema
     */
    public Schema schema() {
        return schema;
    }
    
    /**
     * Returns the column index: the position of each column in the {@link #schema() schema}.
     *
     * @return the column index
     * @see Schema#columnIndex()
     */
    public Map<String, Integer> columnIndex() {
        return schema.columnIndex();
    }
    
    public int size() {
        return rows.size();
    }
    
    // --- joins ---
    
    /**
     * Returns a new data-frame that joins this (left) data-frame with the given right data-frame, as configured by the
     * given configurator consumer. The predicate is evaluated for every (left, right) pair of rows.
     *
     * @param right the right data-frame
     * @param on the join predicate, over (left row, right row)
     * @param config a consumer that configures the join
     * @return the joined data-frame
     * @throws UnknownJoinTypeException if the configured join type token is unknown
     * @see JoinAPI
     */
    public DataFrame join(DataFrame right,
                          BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on,
                          Consumer<JoinAPI> config) {
        return new JoinAPI().accept(this, right, on, config);
    }
    
    /**
     * Returns a new data-frame holding a merged row for every pair of rows that satisfy the predicate.
     *
     * @param right the right data-frame
     * @param on the join predicate, over (left row, right row)
     * @return the joined data-frame
     */
    public DataFrame innerJoin(DataFrame right, BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on) {
        return join(right, on, join -> join.type(JoinType.INNER));
    }
    
    /**
     * Returns a new data-frame holding a merged row for every pair of rows that satisfy the predicate, and every
     * unmatched row of this data-frame alone.
     *
     * @param right the right data-frame
     * @param on the join predicate, over (left row, right row)
     * @return the joined data-frame
     */
    public DataFrame leftJoin(DataFrame right, BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on) {
        return join(right, on, join -> join.type(JoinType.LEFT));
    }
    
    /**
     * Equivalent to {@link #leftJoin}.
     *
     * @param right the right data-frame
     * @param on the join predicate, over (left row, right row)
     * @return the joined data-frame
     */
    public DataFrame outerJoin(DataFrame right, BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on) {
        return leftJoin(right, on);
    }
    
    /**
     * Returns a new data-frame holding a merged row for every pair of rows that satisfy the predicate, and every
     * unmatched row of the right data-frame alone. The output lists the right data-frame's columns first.
     *
     * @param right the right data-frame
     * @param on the join predicate, over (left row, right row)
     * @return the joined data-frame
     */
    public DataFrame rightJoin(DataFrame right, BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on) {
        return join(right, on, join -> join.type(JoinType.RIGHT));
    }
    
    /**
     * Returns a new data-frame holding a merged row for every pair of rows that satisfy the predicate, and every
     * unmatched row of either data-frame alone.
     *
     * @param right the right data-frame
     * @param on the join predicate, over (left row, right row)
     * @return the joined data-frame
     */
    public DataFrame fullJoin(DataFrame right, BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on) {
        return join(right, on, join -> join.type(JoinType.FULL));
    }
    
    /**
     * Returns a new data-frame holding a copy of each row of the given parent data-frame, with the rows of this (child)
     * data-frame that match it nested under the {@code "children"} field.
     *
     * @param parent the parent data-frame
     * @param on the nesting predicate, over (child row, parent row)
     * @return the nested data-frame
     */
    public DataFrame nestedJoin(DataFrame parent, BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on) {
        return nestedJoin(parent, on, FrameOptions.DEFAULT_CHILDREN_FIELD);
    }
    
    /**
     * Returns a new data-frame holding a copy of each row of the given parent data-frame, with the rows of this (child)
     * data-frame that match it nested under the given field.
     *
     * @param parent the parent data-frame
     * @param on the nesting predicate, over (child row, parent row)
     * @param children the name of the field holding the nested rows
     * @return the nested data-frame
     */
    public DataFrame nestedJoin(DataFrame parent, BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on,
                                String children) {
        return join(parent, on, join -> join.type(JoinType.NESTED).children(children));
    }
    
    // --- rollup ---
    
    /**
     * Sets the columns to group by in the next {@link #rollup()}, replacing any previously set.
     *
     * <p>Columns need not be in the schema. Rows that lack a group column are grouped by the columns they have.
     *
     * @param columns the columns to group by
     * @return this data-frame
     */
    public DataFrame groupBy(String... columns) {
        groupByKeys.clear();
        groupByKeys.addAll(Arrays.asList(columns));
        return this;
    }
    
    /**
     * Adds a summary to the next {@link #rollup()}, that collects the given field of each row (as a row holding only
     * that field) into a list, under the given output field.
     *
     * @param field the field to collect
     * @param as the output field
     * @return this data-frame
     */
    public DataFrame summarize(String field, String as) {
        return summarize(List.of(field), as);
    }
    
    /**
     * Adds a summary to the next {@link #rollup()}, that collects the given fields of each row (as a row holding only
     * those fields) into a list, under the given output field.
     *
     * @param fields the fields to collect
     * @param as the output field
     * @return this data-frame
     */
    public DataFrame summarize(List<String> fields, String as) {
        return addSummary(new Summary(String.join(",", fields), Summary.picking(fields), identityReducer(as)));
    }
    
    /**
     * Adds a summary to the next {@link #rollup()}, that collects the result of applying the given function to each
     * row into a list, under the given output field.
     *
     * @param mapper the function to apply to each row
     * @param as the output field
     * @return this data-frame
     */
    public DataFrame summarize(Function<? super Map<String, Object>, ?> mapper, String as) {
        return addSummary(new Summary(as, mapper, identityReducer(as)));
    }
    
    /**
     * Adds a summary to the next {@link #rollup()}, that collects the given field of each row (as a row holding only
     * that field), and reduces the collected rows with each of the given reducers, into the output field of the same
     * key. Output fields are added in the iteration order of the map.
     *
     * @param field the field to collect
     * @param reducers the reducers, by output field
     * @return this data-frame
     * @see Aggregators
     */
    public DataFrame summarize(String field, Map<String, ? extends Function<? super List<Object>, ?>> reducers) {
        return summarize(List.of(field), reducers);
    }
    
    /**
     * Adds a summary to the next {@link #rollup()}, that collects the given fields of each row (as a row holding only
     * those fields), and reduces the collected rows with each of the given reducers, into the output field of the same
     * key. Output fields are added in the iteration order of the map.
     *
     * @param fields the fields to collect
     * @param reducers the reducers, by output field
     * @return this data-frame
     * @see Aggregators
     */
    public DataFrame summarize(List<String> fields, Map<String, ? extends Function<? super List<Object>, ?>> reducers) {
        return addSummary(new Summary(String.join(",", fields), Summary.picking(fields), reducers));
    }
    
    /**
     * Adds a summary to the next {@link #rollup()}, that collects the result of applying the given function to each
     * row, and reduces the collected values with each of the given reducers, into the output field of the same key.
     * Output fields are added in the iteration order of the map.
     *
     * @param mapper the function to apply to each row
     * @param reducers the reducers, by output field
     * @return this data-frame
     * @see Aggregators
     */
    public DataFrame summarize(Function<? super Map<String, Object>, ?> mapper,
                               Map<String, ? extends Function<? super List<Object>, ?>> reducers) {
        return addSummary(new Summary("summary" + summaries.size(), mapper, reducers));
    }
    
    private DataFrame addSummary(Summary summary) {
        summaries.add(summary);
        return this;
    }
    
    private static Map<String, Function<? super List<Object>, ?>> identityReducer(String as) {
        Function<? super List<Object>, ?> identity = values -> values;
        return Map.of(as, identity);
    }
    
    /**
     * Sets the columns to align groups by in the next {@link #rollup()}, replacing any previously set. Every group's
     * collected rows are padded with a filler row for each combination of values of these columns that occurs in this
     * data-frame, but not in the group. Filler rows are built from the {@link #using template}, and flagged with
     * {@code 0} in the actual-flag field; genuine rows are flagged with {@code 1}.
     *
     * @param columns the columns to align by
     * @return this data-frame
     */
    public DataFrame align(String... columns) {
        alignByKeys.clear();
        alignByKeys.addAll(Arrays.asList(columns));
        return this;
    }
    
    /**
     * Sets the template that filler rows are built from during alignment. Template fields that are group or alignment
     * keys are ignored.
     *
     * @param template the template
     * @return this data-frame
     */
    public DataFrame using(Map<String, ?> template) {
        this.template = new LinkedHashMap<>(Objects.requireNonNull(template));
        return this;
    }
    
    /**
     * Executes the configured rollup, returning a new data-frame with one row per group. Groups appear in order of
     * their first row. Each output row holds the group key values, followed by the output field of every reducer.
     * Group key values are compared by value, so numbers of different classes such as {@code 1} and {@code 1L} fall in
     * the same group; the output row holds the value of the group's first row.
     *
     * <p>If no summaries were added, each group collects its rows, without the group keys, into a list under the
     * configured children field.
     *
     * <p>The output schema holds the group key columns, followed by a column for each reducer output field, typed from
     * the first output row. Output fields holding lists get a nested schema derived from the list.
     *
     * <p>The rollup configuration is cleared once the rollup completes.
     *
     * @return the rolled-up data-frame
     * @throws ConfigurationException if neither group keys nor summaries are configured
     */
    public DataFrame rollup() {
        Rollup.Result result = new Rollup(rows, schema, groupByKeys, summaries, alignByKeys, template,
                                          options.childrenField(), options.actualFlagField()).run();
        groupByKeys.clear();
        summaries.clear();
        alignByKeys.clear();
        template = Collections.emptyMap();
        return derived(result.rows, result.schema);
    }
    
    // --- set operations ---
    
    /**
     * Returns a new data-frame with the rows of this data-frame followed by the rows of the other, without removing
     * duplicates. The schema is the {@link Schema#combine combination} of both schemas.
     *
     * @param other the other data-frame
     * @return the union
     * @throws SchemaConflictException if a column is present in both schemas with different types
     */
    public DataFrame union(DataFrame other) {
        Schema combined = Schema.combine(schema, other.schema, false);
        List<Map<String, Object>> result = new ArrayList<>(rows.size() + other.rows.size());
        for (Map<String, Object> row : rows)
            result.add(new LinkedHashMap<>(row));
        for (Map<String, Object> row : other.rows)
            result.add(new LinkedHashMap<>(row));
        return derived(result, combined);
    }
    
    /**
     * Returns a new data-frame with the rows of this data-frame that are not equal to any row of the other. If the
     * schemas are not equal, this data-frame itself is returned.
     *
     * <p>Rows are compared deeply, and numbers by value, so {@code 1} equals {@code 1L} and {@code 1.0}.
     *
     * @param other the other data-frame
     * @return the difference, or this data-frame if the schemas differ
     */
    public DataFrame minus(DataFrame other) {
        if (!schema.equals(other.schema))
            return this;
        Set<Object> others = other.normalizedRows();
        return derived(filterCopies(row -> !others.contains(Utils.normalize(row))), schema);
    }
    
    /**
     * Returns a new data-frame with the rows of this data-frame that are equal to some row of the other. If the schemas
     * are not equal, an empty data-frame with an empty schema is returned.
     *
     * <p>Rows are compared as in {@link #minus(DataFrame)}.
     *
     * @param other the other data-frame
     * @return the intersection, or an empty data-frame if the schemas differ
     */
    public DataFrame intersect(DataFrame other) {
        if (!schema.equals(other.schema))
            return derived(new ArrayList<>(), Schema.empty());
        Set<Object> others = other.normalizedRows();
        return derived(filterCopies(row -> others.contains(Utils.normalize(row))), schema);
    }
    
    private Set<Object> normalizedRows() {
        Set<Object> normalized = new HashSet<>();
        for (Map<String, Object> row : rows)
            normalized.add(Utils.normalize(row));
        return normalized;
    }
    
    private List<Map<String, Object>> filterCopies(Predicate<? super Map<String, Object>> predicate) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : rows)
            if (predicate.test(row))
                result.add(new LinkedHashMap<>(row));
        return result;
    }
    
    // --- row operations ---
    
    /**
     * Arms the one-shot filter with the given predicate, replacing any predicate already armed.
     *
     * @param predicate the filter predicate
     * @return this data-frame
     */
    public DataFrame where(Predicate<? super Map<String, Object>> predicate) {
        filter.arm(predicate);
        return this;
    }
    
    /**
     * Returns copies of the rows that match the armed filter (or all rows, if none is armed), projected to the given
     * columns (or all fields, if none are given). Fields a row does not have are left out of its projection. Disarms
     * the filter.
     *
     * @param columns the columns to project to
     * @return the selected rows
     */
    public List<Map<String, Object>> select(String... columns) {
        Predicate<? super Map<String, Object>> predicate = filter.take();
        List<String> projection = Arrays.asList(columns);
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : rows)
            if (predicate.test(row))
                result.add(projection.isEmpty() ? new LinkedHashMap<>(row) : Utils.pick(row, projection));
        return result;
    }
    
    /**
     * Returns the result of applying the given function to each row that matches the armed filter (or to all rows, if
     * none is armed). Unlike {@link #select}, this does not disarm the filter.
     *
     * @param fn the function to apply
     * @return the results, in row order
     * @param <R> the result type of the function
     */
    public <R> List<R> apply(Function<? super Map<String, Object>, ? extends R> fn) {
        Predicate<? super Map<String, Object>> predicate = filter.peek();
        List<R> result = new ArrayList<>();
        for (Map<String, Object> row : rows)
            if (predicate.test(row))
                result.add(fn.apply(row));
        return result;
    }
    
    /**
     * Sets the given fields on every row that matches the armed filter (or on all rows, if none is armed), in place.
     * Disarms the filter. The schema is then combined with the schema of the given values, with overwrite, so that an
     * update may add columns or change their types.
     *
     * @param values the fields to set
     * @return this data-frame
     * @throws InvalidInputException if the values are {@code null}
     */
    public DataFrame update(Map<String, ?> values) {
        if (values == null)
            throw new InvalidInputException("value must be an object");
        Predicate<? super Map<String, Object>> predicate = filter.take();
        for (Map<String, Object> row : rows)
            if (predicate.test(row))
                row.putAll(values);
        schema = Schema.combine(schema, Schema.derive(List.of(values)), true);
        return this;
    }
    
    /**
     * Removes every row that matches the armed filter (or all rows, if none is armed) from the backing list, in place.
     * Disarms the filter. The schema is not changed.
     *
     * @return this data-frame
     */
    public DataFrame delete() {
        Predicate<? super Map<String, Object>> predicate = filter.take();
        rows.removeIf(predicate);
        return this;
    }
    
    /**
     * Appends the given row to the backing list, in place. The schema is first combined with the schema of the row,
     * without overwrite, so a row that disagrees with an existing column type is rejected.
     *
     * @param row the row to append
     * @return this data-frame
     * @throws InvalidInputException if the row is {@code null}
     * @throws SchemaConflictException if the row disagrees with the type of an existing column
     */
    public DataFrame insert(Map<String, Object> row) {
        if (row == null)
            throw new InvalidInputException("row must be an object");
        schema = Schema.combine(schema, Schema.derive(List.of(row)), false);
        rows.add(row);
        return this;
    }
    
    /**
     * For each row, and each of the given fields that the row does not have, sets the field to its given default, in
     * place.
     *
     * @param values the defaults, by field
     * @return this data-frame
     */
    public DataFrame fillMissing(Map<String, ?> values) {
        for (Map<String, Object> row : rows)
            values.forEach((key, value) -> {
                if (!row.containsKey(key))
                    row.put(key, value);
            });
        return this;
    }
    
    /**
     * For each row, and each of the given fields that the row has with a {@code null} value, sets the field to its
     * given default, in place. Fields the row does not have are left alone.
     *
     * @param values the defaults, by field
     * @return this data-frame
     */
    public DataFrame fillNull(Map<String, ?> values) {
        for (Map<String, Object> row : rows)
            values.forEach((key, value) -> {
                if (row.containsKey(key) && row.get(key) == null)
                    row.put(key, value);
            });
        return this;
    }
    
    // --- structure ---
    
    /**
     * Sorts the backing list by the given columns, ascending, in place. The sort is stable.
     *
     * @param columns the columns to sort by
     * @return this data-frame
     */
    public DataFrame sortBy(String... columns) {
        Sort[] sorts = new Sort[columns.length];
        for (int i = 0; i < columns.length; i++)
            sorts[i] = Sort.asc(columns[i]);
        return sortBy(sorts);
    }
    
    /**
     * Sorts the backing list by the given sort keys, in place. The sort is stable.
     *
     * @param sorts the sort keys
     * @return this data-frame
     */
    public DataFrame sortBy(Sort... sorts) {
        rows.sort(Sort.comparing(sorts));
        return this;
    }
    
    /**
     * Returns a new data-frame with columns renamed as given, by old name. Each renamed column keeps its position in
     * the schema, and its other attributes. Row fields that are not renamed are kept as-is.
     *
     * @param columns the new column names, by old name
     * @return the renamed data-frame
     * @throws UnknownColumnException if a new name is already a column, or an old name is not
     */
    public DataFrame rename(Map<String, String> columns) {
        List<String> existing = new ArrayList<>();
        Set<String> targets = new HashSet<>();
        for (String target : columns.values())
            if (schema.contains(target) || !targets.add(target))
                existing.add(target);
        if (!existing.isEmpty())
            throw new UnknownColumnException("Cannot rename to an existing column. " + existing, existing);
        List<String> missing = new ArrayList<>();
        for (String source : columns.keySet())
            if (!schema.contains(source))
                missing.add(source);
        if (!missing.isEmpty())
            throw new UnknownColumnException("Cannot rename non-existing column(s) " + missing + ".", missing);
        
        List<Column> renamed = new ArrayList<>(schema.size());
        for (Column column : schema.columns)
            renamed.add(column.withName(columns.getOrDefault(column.name(), column.name())));
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            row.forEach((key, value) -> copy.put(columns.getOrDefault(key, key), value));
            result.add(copy);
        }
        return derived(result, Schema.of(renamed));
    }
    
    /**
     * Returns a new data-frame without the given columns. Names that are not columns are ignored.
     *
     * @param columns the columns to drop
     * @return the reduced data-frame
     */
    public DataFrame drop(String... columns) {
        List<String> dropped = Arrays.asList(columns);
        List<Column> kept = new ArrayList<>(schema.size());
        for (Column column : schema.columns)
            if (!dropped.contains(column.name()))
                kept.add(column);
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows)
            result.add(Utils.omit(row, dropped));
        return derived(result, Schema.of(kept));
    }
    
    /**
     * Returns a string representation of this data-frame. The string representation consists of the characters
     * {@code "DataFrame"}, followed by a list whose first entry is the schema, and whose remaining entries are the
     * rows. For example:
     *
     * <pre>{@code
     * DataFrame[
     *     [id:integer, name:string],
     *     {id=1, name=x},
     *     {id=2, name=y}
     * ]
     * }</pre>
     *
     * @return a string representation of this data-frame
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DataFrame[\n\t").append(schema.columns());
        for (Map<String, Object> row : rows)
            sb.append(",\n\t").append(row);
        return sb.append("\n]").toString();
    }
}
