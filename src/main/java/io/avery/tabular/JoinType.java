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
 * The kinds of join a {@link DataFrame data-frame} supports.
 *
 * @see JoinAPI
 */
public enum JoinType {
    /** Emits a merged row for each matching (left, right) pair. */
    INNER,
    /** As {@link #INNER}, and emits each unmatched left row alone. */
    LEFT,
    /** A {@link #LEFT} join with the operands swapped. */
    RIGHT,
    /** As {@link #LEFT}, and emits each right row that matched no left row alone. */
    FULL,
    /** Attaches the matching rows of one side under a field of each row of the other side, without merging. */
    NESTED;
    
    /**
     * Returns the join type named by the given token, ignoring case. The token {@code "outer"} is accepted as an alias
     * for {@link #LEFT}.
     *
     * @param token the token
     * @return the join type named by the token
     * @throws UnknownJoinTypeException if the token does not name a join type
     */
    public static JoinType of(String token) {
        if (token == null)
            throw new UnknownJoinTypeException(null);
        switch (token.toLowerCase(Locale.ROOT)) {
            case "inner": return INNER;
            case "left":
            case "outer": return LEFT;
            case "right": return RIGHT;
            case "full":  return FULL;
            case "nested": return NESTED;
            default: throw new UnknownJoinTypeException(token);
        }
    }
}
