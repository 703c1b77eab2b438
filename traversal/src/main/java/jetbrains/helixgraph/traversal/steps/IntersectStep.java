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
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Runs the sub-traversal for each upstream item and yields items present in all of the results.
 * Result sets are intersected smallest first, the first empty intersection ends the work.
 */
public final class IntersectStep extends MaterializedStep {

    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final Function<TraversalValue, ? extends Iterator<TraversalResult>> subTraversal;

    public IntersectStep(@NotNull final Iterator<TraversalResult> upstream,
                         @NotNull final Function<TraversalValue, ? extends Iterator<TraversalResult>> subTraversal) {
        this.upstream = upstream;
        this.subTraversal = subTraversal;
    }

    @NotNull
    @Override
    protected List<TraversalResult> materialize() {
        final List<TraversalValue> items = new ArrayList<>();
        while (upstream.hasNext()) {
            final TraversalResult result = upstream.next();
            if (!result.isOk()) {
                return List.of(result);
            }
            items.add(result.getValue());
        }
        if (items.isEmpty()) {
            return Collections.emptyList();
        }
        final List<Map<Object, TraversalValue>> sets = new ArrayList<>(items.size());
        for (final TraversalValue item : items) {
            final Map<Object, TraversalValue> set = new LinkedHashMap<>();
            final Iterator<TraversalResult> it;
            try {
                it = subTraversal.apply(item);
            } catch (ExodusException e) {
                return List.of(TraversalResult.failed(e));
            }
            while (it.hasNext()) {
                final TraversalResult result = it.next();
                if (!result.isOk()) {
                    return List.of(result);
                }
                final TraversalValue value = result.getValue();
                set.putIfAbsent(key(value), value);
            }
            if (set.isEmpty()) {
                return Collections.emptyList();
            }
            sets.add(set);
        }
        sets.sort(Comparator.comparingInt(Map::size));
        final Map<Object, TraversalValue> smallest = sets.get(0);
        final Set<Object> common = new HashSet<>(smallest.keySet());
        for (int i = 1; i < sets.size(); ++i) {
            common.retainAll(sets.get(i).keySet());
            if (common.isEmpty()) {
                return Collections.emptyList();
            }
        }
        final List<TraversalResult> result = new ArrayList<>(common.size());
        for (final Map.Entry<Object, TraversalValue> entry : smallest.entrySet()) {
            if (common.contains(entry.getKey())) {
                result.add(TraversalResult.ok(entry.getValue()));
            }
        }
        return result;
    }

    private static Object key(@NotNull final TraversalValue value) {
        final UUID id = value.getId();
        return id == null ? value : id;
    }
}
