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

import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.traversal.TraversalArena;
import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.Set;
import java.util.UUID;

/**
 * Yields the first occurrence of each item, items are identified by id. Failed items pass through.
 */
public final class DedupStep extends TraversalStep {

    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final Set<Object> seen;

    public DedupStep(@NotNull final TraversalArena arena, @NotNull final Iterator<TraversalResult> upstream) {
        this.upstream = upstream;
        seen = arena.newSet();
    }

    @Nullable
    @Override
    protected TraversalResult computeNext() {
        while (upstream.hasNext()) {
            final TraversalResult result = upstream.next();
            if (!result.isOk()) {
                return result;
            }
            final TraversalValue value = result.getValue();
            final UUID id = value.getId();
            if (seen.add(id == null ? value : id)) {
                return result;
            }
        }
        return null;
    }
}
