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

import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Sorts items by a property. Items having the property come first, the sort is stable. Failed items are
 * yielded before sorted ones.
 */
public final class OrderByStep extends MaterializedStep {

    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final String property;
    private final boolean descending;

    public OrderByStep(@NotNull final Iterator<TraversalResult> upstream,
                       @NotNull final String property,
                       final boolean descending) {
        this.upstream = upstream;
        this.property = property;
        this.descending = descending;
    }

    @NotNull
    @Override
    protected List<TraversalResult> materialize() {
        final List<TraversalResult> result = new ArrayList<>();
        final List<TraversalValue> values = new ArrayList<>();
        while (upstream.hasNext()) {
            final TraversalResult item = upstream.next();
            if (item.isOk()) {
                values.add(item.getValue());
            } else {
                result.add(item);
            }
        }
        values.sort(comparator());
        for (final TraversalValue value : values) {
            result.add(TraversalResult.ok(value));
        }
        return result;
    }

    @NotNull
    private Comparator<TraversalValue> comparator() {
        return (left, right) -> {
            final Value leftValue = left.getProperty(property);
            final Value rightValue = right.getProperty(property);
            if (leftValue == null || rightValue == null) {
                return leftValue == null ? (rightValue == null ? 0 : 1) : -1;
            }
            final int cmp = leftValue.compareTo(rightValue);
            return descending ? -cmp : cmp;
        };
    }
}
