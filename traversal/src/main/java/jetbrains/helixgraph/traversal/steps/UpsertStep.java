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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Updates the first upstream item, or creates a new one if upstream is empty. If upstream has only
 * failed items then the first failure is yielded and nothing is written.
 */
public final class UpsertStep extends MaterializedStep {

    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final Function<TraversalValue, TraversalValue> updater;
    @NotNull
    private final Supplier<TraversalValue> creator;

    public UpsertStep(@NotNull final Iterator<TraversalResult> upstream,
                      @NotNull final Function<TraversalValue, TraversalValue> updater,
                      @NotNull final Supplier<TraversalValue> creator) {
        this.upstream = upstream;
        this.updater = updater;
        this.creator = creator;
    }

    @NotNull
    @Override
    protected List<TraversalResult> materialize() {
        final List<TraversalResult> items = new ArrayList<>();
        upstream.forEachRemaining(items::add);
        TraversalResult firstFailure = null;
        for (final TraversalResult item : items) {
            if (item.isOk()) {
                return List.of(apply(() -> updater.apply(item.getValue())));
            }
            if (firstFailure == null) {
                firstFailure = item;
            }
        }
        return List.of(firstFailure != null ? firstFailure : apply(creator));
    }

    @NotNull
    private static TraversalResult apply(@NotNull final Supplier<TraversalValue> action) {
        try {
            return TraversalResult.ok(action.get());
        } catch (ExodusException e) {
            return TraversalResult.failed(e);
        }
    }
}
