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

import java.util.Objects;

/**
 * A configurator for the options of a {@link DataFrame data-frame}: how its schema is derived, and the names of the
 * fields that rollups introduce.
 *
 * @see DataFrame#of(java.util.List, java.util.function.Consumer)
 */
public class FrameOptions {
    static final String DEFAULT_SEPARATOR = "/";
    static final String DEFAULT_CURRENCY_SUFFIX = "_currency";
    static final String DEFAULT_CHILDREN_FIELD = "children";
    static final String DEFAULT_ACTUAL_FLAG_FIELD = "_actual";
    
    private Schema metadata = null;
    private boolean deepScan = false;
    private String path = null;
    private String separator = DEFAULT_SEPARATOR;
    private String currencySuffix = DEFAULT_CURRENCY_SUFFIX;
    private String childrenField = DEFAULT_CHILDREN_FIELD;
    private String actualFlagField = DEFAULT_ACTUAL_FLAG_FIELD;
    
    FrameOptions() {}
    
    /**
     * Supplies an explicit schema. A non-empty explicit schema is used verbatim instead of deriving one.
     *
     * @param metadata the explicit schema
     * @return this configurator
     */
    public FrameOptions metadata(Schema metadata) {
        this.metadata = metadata;
        return this;
    }
    
    /**
     * Enables or disables deep scanning. When enabled, the schema is derived from every row rather than the first, so
     * that sparse rows still get every column represented.
     *
     * @param deepScan whether to scan every row
     * @return this configurator
     * @see Schema#deepScanSample
     */
    public FrameOptions deepScan(boolean deepScan) {
        this.deepScan = deepScan;
        return this;
    }
    
    /**
     * Names the column that holds hierarchy paths.
     *
     * @param path the path column name
     * @return this configurator
     */
    public FrameOptions path(String path) {
        this.path = path;
        return this;
    }
    
    /**
     * Sets the separator recorded on the path column. Defaults to {@code "/"}.
     *
     * @param separator the path separator
     * @return this configurator
     */
    public FrameOptions separator(String separator) {
        this.separator = Objects.requireNonNull(separator);
        return this;
    }
    
    /**
     * Sets the suffix that marks currency-code columns. Defaults to {@code "_currency"}.
     *
     * @param currencySuffix the currency suffix
     * @return this configurator
     */
    public FrameOptions currencySuffix(String currencySuffix) {
        this.currencySuffix = Objects.requireNonNull(currencySuffix);
        return this;
    }
    
    /**
     * Sets the name of the field that holds grouped rows when a rollup has no explicit summaries. Defaults to
     * {@code "children"}.
     *
     * @param childrenField the children field name
     * @return this configurator
     */
    public FrameOptions childrenField(String childrenField) {
        this.childrenField = Objects.requireNonNull(childrenField);
        return this;
    }
    
    /**
     * Sets the name of the field that distinguishes genuine rows ({@code 1}) from rows synthesized by alignment
     * ({@code 0}). Defaults to {@code "_actual"}.
     *
     * @param actualFlagField the actual-flag field name
     * @return this configurator
     */
    public FrameOptions actualFlagField(String actualFlagField) {
        this.actualFlagField = Objects.requireNonNull(actualFlagField);
        return this;
    }
    
    Schema metadata() {
        return metadata;
    }
    
    boolean deepScan() {
        return deepScan;
    }
    
    String path() {
        return path;
    }
    
    String separator() {
        return separator;
    }
    
    String currencySuffix() {
        return currencySuffix;
    }
    
    String childrenField() {
        return childrenField;
    }
    
    String actualFlagField() {
        return actualFlagField;
    }
    
    FrameOptions copy() {
        FrameOptions copy = new FrameOptions();
        copy.metadata = metadata;
        copy.deepScan = deepScan;
        copy.path = path;
        copy.separator = separator;
        copy.currencySuffix = currencySuffix;
        copy.childrenField = childrenField;
        copy.actualFlagField = actualFlagField;
        return copy;
    }
}
