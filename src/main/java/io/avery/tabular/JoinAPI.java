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
import java.util.function.UnaryOperator;

/**
 * A configurator used to define a join between two {@link DataFrame data-frames}.
 *
 * <p>The configurator selects the {@link JoinType join type}, the {@link Renaming renaming} applied to the columns of
 * each side, and, for nested joins, the name of the field that holds the nested rows. Rows are matched by a predicate
 * that is evaluated for every (left, right) pair of rows, against the rows as they are, before renaming. There is no
 * index acceleration; callers that need it should pre-bucket by key.
 *
 * <p>For the flat join types ({@link JoinType#INNER inner}, {@link JoinType#LEFT left}, {@link JoinType#RIGHT right},
 * {@link JoinType#FULL full}), each matching pair yields one merged row, holding the renamed fields of both rows. When
 * both rows have a field of the same (renamed) name, the left value wins. The output schema is the renamed left schema,
 * followed by the columns of the renamed right schema that the left does not already have. Left columns thus win
 * schema conflicts, just as left values win row conflicts.
 *
 * <p>A right join is computed as a left join with the operands (and their renamings) swapped. The merged rows are not
 * swapped back, so the output schema lists the right operand's columns first, and the right operand's values win
 * collisions.
 *
 * <p>A {@link JoinType#NESTED nested} join treats the left operand as the child rows and the right operand as the
 * parent rows. Each parent row is copied, and the child rows that match it are attached as a list under the configured
 * {@link #children(String) children} field. Renamings do not apply.
 *
 * <p>Joins never modify the rows of their operands.
 *
 * @see DataFrame#join(DataFrame, BiPredicate, Consumer)
 */
public class JoinAPI {
    private static final System.Logger LOG = System.getLogger(JoinAPI.class.getName());
    
    private JoinType type = JoinType.INNER;
    private Renaming left = Renaming.none();
    private Renaming right = Renaming.none();
    private String children = FrameOptions.DEFAULT_CHILDREN_FIELD;
    
    JoinAPI() {}
    
    /**
     * Sets the join type. Defaults to {@link JoinType#INNER}.
     *
     * @param type the join type
     * @return this configurator
     */
    public JoinAPI type(JoinType type) {
        this.type = Objects.requireNonNull(type);
        return this;
    }
    
    /**
     * Sets the join type by its token.
     *
     * @param token the join type token
     * @return this configurator
     * @throws UnknownJoinTypeException if the token does not name a join type
     * @see JoinType#of(String)
     */
    public JoinAPI type(String token) {
        this.type = JoinType.of(token);
        return this;
    }
    
    /**
     * Sets the renaming applied to the columns of the left operand.
     *
     * @param renaming the left renaming
     * @return this configurator
     */
    public JoinAPI left(Renaming renaming) {
        this.left = Objects.requireNonNull(renaming);
        return this;
    }
    
    /**
     * Sets the renaming applied to the columns of the right operand.
     *
     * @param renaming the right renaming
     * @return this configurator
     */
    public JoinAPI right(Renaming renaming) {
        this.right = Objects.requireNonNull(renaming);
        return this;
    }
    
    /**
     * Sets the name of the field that holds the nested rows of a nested join. Defaults to {@code "children"}.
     *
     * @param children the children field name
     * @return this configurator
     */
    public JoinAPI children(String children) {
        this.children = Objects.requireNonNull(children);
        return this;
    }
    
    DataFrame accept(DataFrame lt, DataFrame rt, BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on,
                     Consumer<JoinAPI> config) {
        Objects.requireNonNull(rt);
        Objects.requireNonNull(on);
        config.accept(this);
        
        DataFrame result;
        switch (type) {
            case INNER: result = flatJoin(lt, rt, on, left, right, false, false); break;
            case LEFT:  result = flatJoin(lt, rt, on, left, right, true, false); break;
            case FULL:  result = flatJoin(lt, rt, on, left, right, true, true); break;
            case RIGHT: result = flatJoin(rt, lt, (r, l) -> on.test(l, r), right, left, true, false); break;
            case NESTED: result = nestedJoin(lt, rt, on, children); break;
            default: throw new AssertionError(); // unreachable
        }
        LOG.log(System.Logger.Level.DEBUG, "{0} join of {1} and {2} rows produced {3} rows",
                type, lt.rows.size(), rt.rows.size(), result.rows.size());
        return result;
    }
    
    private static DataFrame flatJoin(DataFrame lt, DataFrame rt,
                                      BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on,
                                      Renaming leftRenaming, Renaming rightRenaming,
                                      boolean retainUnmatchedLeft, boolean retainUnmatchedRight) {
        UnaryOperator<String> renameLeft = leftRenaming.attributeRenamer();
        UnaryOperator<String> renameRight = rightRenaming.attributeRenamer();
        UnaryOperator<Map<String, Object>> leftRow = Renaming.rowRenamer(renameLeft, lt.schema.names());
        UnaryOperator<Map<String, Object>> rightRow = Renaming.rowRenamer(renameRight, rt.schema.names());
        
        Matcher matcher = retainUnmatchedLeft
            ? new LeftMatcher(rt.rows, on, leftRow, rightRow)
            : new InnerMatcher(rt.rows, on, leftRow, rightRow);
        List<Map<String, Object>> joined = new ArrayList<>();
        for (Map<String, Object> row : lt.rows)
            matcher.search(row, joined::add);
        
        if (retainUnmatchedRight) {
            for (Map<String, Object> row : rt.rows) {
                boolean noneMatch = true;
                for (Map<String, Object> other : lt.rows) {
                    if (on.test(other, row)) {
                        noneMatch = false;
                        break;
                    }
                }
                if (noneMatch)
                    joined.add(new LinkedHashMap<>(rightRow.apply(row)));
            }
        }
        
        List<Column> columns = Renaming.rename(lt.schema, renameLeft);
        Set<String> leftNames = new HashSet<>();
        for (Column column : columns)
            leftNames.add(column.name());
        for (Column column : Renaming.rename(rt.schema, renameRight))
            if (!leftNames.contains(column.name()))
                columns.add(column);
        
        return new DataFrame(joined, Schema.of(columns), lt.options);
    }
    
    private static DataFrame nestedJoin(DataFrame child, DataFrame parent,
                                        BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on,
                                        String children) {
        List<Map<String, Object>> nested = new ArrayList<>(parent.rows.size());
        for (Map<String, Object> p : parent.rows) {
            List<Map<String, Object>> matches = new ArrayList<>();
            for (Map<String, Object> c : child.rows)
                if (on.test(c, p))
                    matches.add(new LinkedHashMap<>(c));
            Map<String, Object> row = new LinkedHashMap<>(p);
            row.put(children, matches);
            nested.add(row);
        }
        
        List<Column> columns = new ArrayList<>(parent.schema.size() + 1);
        for (Column column : parent.schema.columns)
            if (!column.name().equals(children))
                columns.add(column);
        columns.add(Column.ofArray(children, child.schema));
        return new DataFrame(nested, Schema.of(columns), parent.options);
    }
    
    interface Matcher {
        void search(Map<String, Object> left, Consumer<Map<String, Object>> sink);
    }
    
    private static class InnerMatcher implements Matcher {
        final List<Map<String, Object>> rightRows;
        final BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on;
        final UnaryOperator<Map<String, Object>> leftRow;
        final UnaryOperator<Map<String, Object>> rightRow;
        
        InnerMatcher(List<Map<String, Object>> rightRows,
                     BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on,
                     UnaryOperator<Map<String, Object>> leftRow,
                     UnaryOperator<Map<String, Object>> rightRow) {
            this.rightRows = rightRows;
            this.on = on;
            this.leftRow = leftRow;
            this.rightRow = rightRow;
        }
        
        @Override
        public void search(Map<String, Object> left, Consumer<Map<String, Object>> sink) {
            Map<String, Object> renamedLeft = null;
            for (Map<String, Object> right : rightRows) {
                if (!on.test(left, right))
                    continue;
                if (renamedLeft == null)
                    renamedLeft = leftRow.apply(left);
                sink.accept(merge(renamedLeft, rightRow.apply(right)));
            }
        }
        
        // Left values win collisions.
        static Map<String, Object> merge(Map<String, Object> left, Map<String, Object> right) {
            Map<String, Object> merged = new LinkedHashMap<>(left);
            right.forEach((key, value) -> {
                if (!merged.containsKey(key))
                    merged.put(key, value);
            });
            return merged;
        }
    }
    
    private static class LeftMatcher extends InnerMatcher {
        LeftMatcher(List<Map<String, Object>> rightRows,
                    BiPredicate<? super Map<String, Object>, ? super Map<String, Object>> on,
                    UnaryOperator<Map<String, Object>> leftRow,
                    UnaryOperator<Map<String, Object>> rightRow) {
            super(rightRows, on, leftRow, rightRow);
        }
        
        @Override
        public void search(Map<String, Object> left, Consumer<Map<String, Object>> sink) {
            class Sink implements Consumer<Map<String, Object>> {
                boolean noneMatch = true;
                public void accept(Map<String, Object> row) {
                    noneMatch = false;
                    sink.accept(row);
                }
            }
            Sink wrapperSink = new Sink();
            super.search(left, wrapperSink);
            if (wrapperSink.noneMatch)
                sink.accept(new LinkedHashMap<>(leftRow.apply(left)));
        }
    }
}
