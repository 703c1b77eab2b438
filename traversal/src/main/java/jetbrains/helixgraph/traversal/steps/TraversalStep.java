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
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Base of pipeline operators: pulls upstream lazily and computes the next downstream item on demand.
 */
public abstract class TraversalStep implements Iterator<TraversalResult> {

    @Nullable
    private TraversalResult next;
    private boolean finished;

    /**
     * @return next item or {@code null} if there are no more items
     */
    @Nullable
    protected abstract TraversalResult computeNext();

    @Override
    public final boolean hasNext() {
        if (next == null && !finished) {
            next = computeNext();
            if (next == null) {
                finished = true;
            }
        }
        return next != null;
    }

    @Override
    public final TraversalResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final TraversalResult result = next;
        next = null;
        return result;
    }
}
