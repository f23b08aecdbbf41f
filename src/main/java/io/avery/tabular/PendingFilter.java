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

import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * The one-shot row filter of a data-frame. The filter is either idle, or armed with a single predicate. Arming replaces
 * any predicate that is already armed. {@link #take()} returns the armed predicate (or a match-all predicate, when
 * idle) and returns the filter to idle. {@link #peek()} returns the same predicate, without disarming.
 */
final class PendingFilter {
    private static final Predicate<Map<String, Object>> MATCH_ALL = row -> true;
    
    private Predicate<? super Map<String, Object>> armed = null;
    
    void arm(Predicate<? super Map<String, Object>> predicate) {
        armed = Objects.requireNonNull(predicate);
    }
    
    Predicate<? super Map<String, Object>> take() {
        Predicate<? super Map<String, Object>> predicate = peek();
        armed = null;
        return predicate;
    }
    
    Predicate<? super Map<String, Object>> peek() {
        return armed != null ? armed : MATCH_ALL;
    }
}
