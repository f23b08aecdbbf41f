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
 * Executes the group-by / summarize / align pipeline configured on a data-frame.
 *
 * <p>General idea:
 * <ol>
 *     <li>bucket rows by the values of the group keys, in order of first appearance. Numbers are compared by value, so
 *         {@code 1}, {@code 1L} and {@code 1.0} share a bucket
 *     <li>per bucket, collect the mapped value of every row, for each summary
 *     <li>if alignment keys are set, pad each collected list with filler rows for the alignment key combinations that
 *         occur somewhere in the input, but not in the list
 *     <li>per bucket, emit one row holding the group key values and the output of every reducer
 * </ol>
 */
final class Rollup {
    private static final System.Logger LOG = System.getLogger(Rollup.class.getName());
    
    private final List<Map<String, Object>> rows;
    private final Schema schema;
    private final List<String> groupByKeys;
    private final List<Summary> summaries;
    private final List<String> alignByKeys;
    private final Map<String, Object> template;
    private final String actualFlagField;
    
    Rollup(List<Map<String, Object>> rows, Schema schema, List<String> groupByKeys, List<Summary> summaries,
           List<String> alignByKeys, Map<String, Object> template, String childrenField, String actualFlagField) {
        if (groupByKeys.isEmpty() && summaries.isEmpty())
            throw new ConfigurationException(
                "Use groupBy to specify the columns to group by or use summarize to add aggregators.");
        this.rows = rows;
        this.schema = schema;
        this.groupByKeys = List.copyOf(groupByKeys);
        this.summaries = summaries.isEmpty()
            ? List.of(defaultSummary(schema, groupByKeys, childrenField))
            : List.copyOf(summaries);
        this.alignByKeys = List.copyOf(alignByKeys);
        this.template = template;
        this.actualFlagField = actualFlagField;
    }
    
    // Collects every non-group field of each row into a list of child rows.
    private static Summary defaultSummary(Schema schema, List<String> groupByKeys, String childrenField) {
        List<String> fields = new ArrayList<>(schema.names());
        fields.removeAll(groupByKeys);
        return Summary.collecting(childrenField, Summary.picking(fields), childrenField);
    }
    
    Result run() {
        // Step 1: Bucket and collect.
        
        Map<Object, Bucket> buckets = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Map<String, Object> key = Utils.pick(row, groupByKeys);
            Bucket bucket = buckets.computeIfAbsent(Utils.normalize(key), k -> new Bucket(key, summaries.size()));
            for (int i = 0; i < summaries.size(); i++)
                bucket.collected.get(i).add(summaries.get(i).mapper.apply(row));
        }
        
        // Step 2: Align.
        
        if (!alignByKeys.isEmpty()) {
            Aligner aligner = new Aligner();
            for (Bucket bucket : buckets.values())
                for (int i = 0; i < bucket.collected.size(); i++)
                    bucket.collected.set(i, aligner.align(bucket.collected.get(i)));
            LOG.log(System.Logger.Level.DEBUG, "Alignment on {0} synthesized {1} rows across {2} groups",
                    alignByKeys, aligner.synthesized, buckets.size());
        }
        
        // Step 3: Reduce.
        
        List<Map<String, Object>> result = new ArrayList<>(buckets.size());
        for (Bucket bucket : buckets.values()) {
            Map<String, Object> out = new LinkedHashMap<>(bucket.key);
            for (int i = 0; i < summaries.size(); i++) {
                List<Object> values = bucket.collected.get(i);
                summaries.get(i).reducers.forEach((field, reducer) -> out.put(field, reducer.apply(values)));
            }
            result.add(out);
        }
        LOG.log(System.Logger.Level.DEBUG, "Rollup of {0} rows by {1} produced {2} groups",
                rows.size(), groupByKeys, result.size());
        
        return new Result(result, buildSchema(result));
    }
    
    // Group-by columns, then one column per reducer field, typed from the first output row. A reducer field that
    // redefines an earlier field replaces its definition, but keeps its position. A group-by column the input schema
    // does not know is typed from the first output row that has it.
    private Schema buildSchema(List<Map<String, Object>> result) {
        Map<String, Column> columns = new LinkedHashMap<>();
        for (String key : groupByKeys)
            columns.put(key, schema.contains(key) ? schema.column(key) : sparseColumn(key, result));
        Map<String, Object> first = result.isEmpty() ? Collections.emptyMap() : result.get(0);
        for (Summary summary : summaries) {
            for (String field : summary.reducers.keySet()) {
                Object value = first.get(field);
                ColumnType type = Types.classify(value);
                columns.put(field, type == ColumnType.ARRAY
                    ? Column.ofArray(field, Schema.deriveNested(value))
                    : Column.of(field, type));
            }
        }
        return Schema.of(new ArrayList<>(columns.values()));
    }
    
    private static Column sparseColumn(String key, List<Map<String, Object>> result) {
        for (Map<String, Object> row : result)
            if (row.containsKey(key))
                return Column.of(key, Types.classify(row.get(key)));
        return Column.of(key, ColumnType.NULL);
    }
    
    /**
     * The group key of a bucket, as first seen, and the mapped values collected for each summary.
     */
    private static final class Bucket {
        final Map<String, Object> key;
        final List<List<Object>> collected;
        
        Bucket(Map<String, Object> key, int summaries) {
            this.key = key;
            this.collected = new ArrayList<>(summaries);
            for (int i = 0; i < summaries; i++)
                collected.add(new ArrayList<>());
        }
    }
    
    /**
     * Pads collected lists so that each holds an entry for every combination of alignment key values found anywhere in
     * the input rows.
     */
    private class Aligner {
        // Normalized combination -> combination as first seen
        final Map<Object, Map<String, Object>> combinations = new LinkedHashMap<>();
        final Map<String, Object> filler;
        int synthesized = 0;
        
        Aligner() {
            for (Map<String, Object> row : rows) {
                Map<String, Object> combination = Utils.pick(row, alignByKeys);
                combinations.putIfAbsent(Utils.normalize(combination), combination);
            }
            List<String> excluded = new ArrayList<>(groupByKeys);
            excluded.addAll(alignByKeys);
            filler = Utils.omit(template, excluded);
        }
        
        List<Object> align(List<Object> values) {
            Set<Object> present = new HashSet<>();
            List<Object> aligned = new ArrayList<>(combinations.size());
            for (Object value : values) {
                if (value instanceof Map) {
                    Map<String, Object> row = new LinkedHashMap<>(Utils.<Map<String, Object>>cast(value));
                    present.add(Utils.normalize(Utils.pick(row, alignByKeys)));
                    row.put(actualFlagField, 1);
                    aligned.add(row);
                } else {
                    aligned.add(value);
                }
            }
            for (Map.Entry<Object, Map<String, Object>> combination : combinations.entrySet()) {
                if (present.contains(combination.getKey()))
                    continue;
                Map<String, Object> row = new LinkedHashMap<>(filler);
                row.putAll(combination.getValue());
                row.put(actualFlagField, 0);
                aligned.add(row);
                synthesized++;
            }
            return aligned;
        }
    }
    
    /**
     * The rows and schema produced by a rollup.
     */
    static final class Result {
        final List<Map<String, Object>> rows;
        final Schema schema;
        
        Result(List<Map<String, Object>> rows, Schema schema) {
            this.rows = rows;
            this.schema = schema;
        }
    }
}
