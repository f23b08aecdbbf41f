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
import java.util.function.UnaryOperator;

/**
 * Describes how to rename the columns of one side of a join: by adding a prefix, or a suffix, joined to the column name
 * with a separator. If both a prefix and a suffix are given, the prefix wins. If neither is given, names are kept.
 *
 * <p>A renaming produces two kinds of function. An {@link #attributeRenamer() attribute renamer} maps a column name to
 * its new name. A {@link #rowRenamer row renamer} maps a row to a copy of the row with renamed keys.
 */
public final class Renaming {
    private static final Renaming NONE = new Renaming(null, null, "_");
    
    // Shared, so that row renamers can recognize it and short-circuit.
    private static final UnaryOperator<String> IDENTITY = name -> name;
    private static final UnaryOperator<Map<String, Object>> IDENTITY_ROW = row -> row;
    
    private final String prefix;
    private final String suffix;
    private final String separator;
    
    private Renaming(String prefix, String suffix, String separator) {
        this.prefix = prefix;
        this.suffix = suffix;
        this.separator = separator;
    }
    
    /**
     * Returns a renaming that keeps names unchanged.
     *
     * @return a renaming that keeps names unchanged
     */
    public static Renaming none() {
        return NONE;
    }
    
    /**
     * Returns a renaming that adds the given prefix, joined with {@code "_"}.
     *
     * @param prefix the prefix
     * @return a prefixing renaming
     */
    public static Renaming prefix(String prefix) {
        return new Renaming(Objects.requireNonNull(prefix), null, "_");
    }
    
    /**
     * Returns a renaming that adds the given suffix, joined with {@code "_"}.
     *
     * @param suffix the suffix
     * @return a suffixing renaming
     */
    public static Renaming suffix(String suffix) {
        return new Renaming(null, Objects.requireNonNull(suffix), "_");
    }
    
    /**
     * Returns a copy of this renaming that joins with the given separator.
     *
     * @param separator the separator
     * @return a copy of this renaming with the given separator
     */
    public Renaming separator(String separator) {
        return new Renaming(prefix, suffix, Objects.requireNonNull(separator));
    }
    
    /**
     * Returns a function that renames a single column name. The function is the identity if this renaming has neither
     * a prefix nor a suffix; otherwise it returns {@code prefix + separator + name}, or
     * {@code name + separator + suffix}.
     *
     * @return a column-name renamer
     */
    public UnaryOperator<String> attributeRenamer() {
        if (prefix != null && !prefix.isEmpty()) {
            String head = prefix + separator;
            return name -> head + name;
        }
        if (suffix != null && !suffix.isEmpty()) {
            String tail = separator + suffix;
            return name -> name + tail;
        }
        return IDENTITY;
    }
    
    /**
     * Returns a function that renames the keys of a row through the given name function, producing a new row. If the
     * name function is the identity renamer, the returned function is the identity, and rows are not copied.
     *
     * <p>Otherwise, a lookup from each of the known keys to its new name is built once. Keys of a row that are not
     * among the known keys are dropped. A row renamer must therefore be built from the exact column names of the rows
     * it will be applied to.
     *
     * @param nameFn the column-name renamer
     * @param knownKeys the column names of the rows to be renamed
     * @return a row renamer
     */
    public static UnaryOperator<Map<String, Object>> rowRenamer(UnaryOperator<String> nameFn,
                                                                Collection<String> knownKeys) {
        if (nameFn == IDENTITY)
            return IDENTITY_ROW;
        Map<String, String> lookup = new HashMap<>();
        for (String key : knownKeys)
            lookup.put(key, nameFn.apply(key));
        return lookupRenamer(lookup);
    }
    
    /**
     * Returns a function that renames the keys of a row through the given lookup, producing a new row, and dropping
     * keys that the lookup does not contain.
     */
    static UnaryOperator<Map<String, Object>> lookupRenamer(Map<String, String> lookup) {
        return row -> {
            Map<String, Object> renamed = new LinkedHashMap<>();
            row.forEach((key, value) -> {
                String name = lookup.get(key);
                if (name != null)
                    renamed.put(name, value);
            });
            return renamed;
        };
    }
    
    /**
     * Returns a copy of the given schema with every column renamed through the given name function.
     */
    static List<Column> rename(Schema schema, UnaryOperator<String> nameFn) {
        List<Column> renamed = new ArrayList<>(schema.size());
        for (Column column : schema.columns)
            renamed.add(column.withName(nameFn.apply(column.name())));
        return renamed;
    }
    
    @Override
    public String toString() {
        if (prefix != null)
            return "Renaming[prefix=" + prefix + ", separator=" + separator + "]";
        if (suffix != null)
            return "Renaming[suffix=" + suffix + ", separator=" + separator + "]";
        return "Renaming[none]";
    }
}
