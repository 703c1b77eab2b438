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

import jetbrains.exodus.ExodusException;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.function.Function;

/**
 * Starts a pipeline from a lazy iterator, e.g. a table scan or a secondary index lookup. An item which
 * cannot be resolved yields a failed item. A failure of the iterator itself ends the source.
 */
public final class SourceStep<T> extends TraversalStep {

    @NotNull
    private final Iterator<T> source;
    @NotNull
    private final Function<T, TraversalValue> resolver;
    private boolean broken;

    public SourceStep(@NotNull final Iterator<T> source, @NotNull final Function<T, TraversalValue> resolver) {
        this.source = source;
        this.resolver = resolver;
    }

    @NotNull
    public static SourceStep<TraversalValue> of(@NotNull final Iterator<? extends TraversalValue> source) {
        @SuppressWarnings("unchecked") final Iterator<TraversalValue> it = (Iterator<TraversalValue>) source;
        return new SourceStep<>(it, Function.identity());
    }

    @Nullable
    @Override
    protected TraversalResult computeNext() {
        while (!broken) {
            final T next;
            try {
                if (!source.hasNext()) {
                    return null;
                }
                next = source.next();
            } catch (ExodusException e) {
                broken = true;
                return TraversalResult.failed(e);
            }
            try {
                final TraversalValue value = resolver.apply(next);
                if (value != null) {
                    return TraversalResult.ok(value);
                }
            } catch (ExodusException e) {
                return TraversalResult.failed(e);
            }
        }
        return null;
    }
}
