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
 * Maps each item, a {@code null} result drops the item.
 */
public final class MapStep extends TraversalStep {

    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final Function<TraversalValue, TraversalValue> mapper;

    public MapStep(@NotNull final Iterator<TraversalResult> upstream,
                   @NotNull final Function<TraversalValue, TraversalValue> mapper) {
        this.upstream = upstream;
        this.mapper = mapper;
    }

    @Nullable
    @Override
    protected TraversalResult computeNext() {
        while (upstream.hasNext()) {
            final TraversalResult result = upstream.next();
            if (!result.isOk()) {
                return result;
            }
            try {
                final TraversalValue mapped = mapper.apply(result.getValue());
                if (mapped != null) {
                    return TraversalResult.ok(mapped);
                }
            } catch (ExodusException e) {
                return TraversalResult.failed(e);
            }
        }
        return null;
    }
}
