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

/**
 * Classes to support relational-style operations on in-memory tables of rows, such as join, group-by / summarize, set
 * operations, and filtered updates. Rows are plain {@code Map<String, Object>} objects, whose keys are column names.
 * Rows need not share a shape: a {@code DataFrame} describes its rows with a {@code Schema} derived from them. For
 * example:
 *
 * <pre>{@code
 *     DataFrame orders = DataFrame.of(orderRows);
 *     DataFrame customers = DataFrame.of(customerRows);
 *
 *     DataFrame totals = orders
 *         .innerJoin(customers, (o, c) -> o.get("customerId").equals(c.get("id")))
 *         .groupBy("country")
 *         .summarize("amount", Map.of(
 *             "orders", Aggregators.counter(),
 *             "total", Aggregators.sum()
 *         ))
 *         .rollup();
 * }</pre>
 *
 * <p>Here we join each order to its customer, group the joined rows by the customer's country, and reduce each group
 * to a count and a total, yielding a new data-frame with one row per country.
 *
 * <h2><a id="Schemas">Schemas and Columns</a></h2>
 *
 * <p>A {@code Schema} is an ordered list of {@code Column} descriptors. Each column has a name and a
 * {@code ColumnType}, and optionally attributes such as the currency column that qualifies an amount, the separator of
 * a hierarchy path column, or the nested schema of a column holding rows. Schemas are derived by classifying the values
 * of a sample row (see {@code Types}), and two naming conventions are applied: a column named {@code <x>_currency}
 * marks column {@code <x>} as a currency amount, and a configured path column is moved to the front.
 *
 * <h2><a id="InPlace">Structural and In-place Operations</a></h2>
 *
 * <p>Joins, rollups, set operations, {@code rename()} and {@code drop()} return new data-frames and leave their inputs
 * alone. {@code update()}, {@code delete()}, {@code insert()}, {@code fillMissing()}, {@code fillNull()} and
 * {@code sortBy()} modify the data-frame they are called on, including the caller's list that backs it, unless the
 * data-frame was created with {@code DataFrame.copyOf()}.
 *
 * <h2><a id="Configurators">Configurators</a></h2>
 *
 * <p>Joins and data-frame creation expose "configurators", which configure how the operation is executed. For example:
 *
 * <pre>{@code
 *     DataFrame joined = people.join(teams, (p, t) -> p.get("team").equals(t.get("id")), join -> join
 *         .type(JoinType.FULL)
 *         .right(Renaming.prefix("team"))
 *     );
 * }</pre>
 *
 * <p>Other operations are configured in steps on the data-frame itself. {@code where()} arms a filter that the next
 * {@code select()}, {@code update()} or {@code delete()} consumes. {@code groupBy()}, {@code summarize()},
 * {@code align()} and {@code using()} configure the next {@code rollup()}, which consumes them.
 */
package io.avery.tabular;
