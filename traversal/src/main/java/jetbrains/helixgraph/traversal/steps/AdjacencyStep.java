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
import jetbrains.helixgraph.TraversalException;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.store.AdjacencyEntry;
import jetbrains.helixgraph.store.AdjacencyTable;
import jetbrains.helixgraph.store.CursorIterator;
import jetbrains.helixgraph.traversal.TraversalContext;
import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.UUID;

/**
 * Walks adjacency of each upstream item by the label. Yields the edges or the items at their other ends,
 * in the latter case the intermediate edge is never loaded.
 */
public final class AdjacencyStep extends TraversalStep {

    @NotNull
    private final TraversalContext context;
    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final String label;
    @NotNull
    private final Direction direction;
    @NotNull
    private final Target target;
    @Nullable
    private CursorIterator<AdjacencyEntry> current;

    public AdjacencyStep(@NotNull final TraversalContext context,
                         @NotNull final Iterator<TraversalResult> upstream,
                         @NotNull final String label,
                         @NotNull final Direction direction,
                         @NotNull final Target target) {
        this.context = context;
        this.upstream = upstream;
        this.label = label;
        this.direction = direction;
        this.target = target;
    }

    @Nullable
    @Override
    protected TraversalResult computeNext() {
        while (true) {
            if (current != null && current.hasNext()) {
                final AdjacencyEntry entry = current.next();
                try {
                    final TraversalValue item = Fetch.byId(context.storage(), context.txn(),
                        target == Target.EDGE ? entry.edgeId() : entry.otherId(), target);
                    if (item != null) {
                        return TraversalResult.ok(item);
                    }
                } catch (ExodusException e) {
                    return TraversalResult.failed(e);
                }
                continue;
            }
            if (!upstream.hasNext()) {
                return null;
            }
            final TraversalResult result = upstream.next();
            if (!result.isOk()) {
                return result;
            }
            final UUID id = result.getValue().getId();
            if (id == null) {
                return TraversalResult.failed(new TraversalException("Cannot walk edges of " + result.getValue()));
            }
            final AdjacencyTable table = direction == Direction.OUT ?
                context.storage().getOutEdges() : context.storage().getInEdges();
            current = context.arena().register(table.iterate(context.txn(), id, label));
        }
    }
}
