/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package jetbrains.helixgraph.traversal.steps;

import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;

/**
 * Skips {@code start} items, then yields items until the position {@code end} is reached. Upstream is
 * never pulled beyond {@code end}.
 */
public final class RangeStep extends TraversalStep {

    @NotNull
    private final Iterator<TraversalResult> upstream;
    private final long start;
    private final long end;
    private long position;

    public RangeStep(@NotNull final Iterator<TraversalResult> upstream, final long start, final long end) {
        if (start < 0 || end < 0) {
            throw new IllegalArgumentException("Range bounds should be non-negative: " + start + ".." + end);
        }
        this.upstream = upstream;
        this.start = start;
        this.end = end;
    }

    @Nullable
    @Override
    protected TraversalResult computeNext() {
        while (position < start && position < end && upstream.hasNext()) {
            upstream.next();
            ++position;
        }
        if (position >= end || !upstream.hasNext()) {
            return null;
        }
        ++position;
        return upstream.next();
    }
}
