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
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.Edge;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.items.NodeWithScore;
import jetbrains.helixgraph.items.PropertyHolder;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.items.VectorWithoutData;
import jetbrains.helixgraph.store.GraphStorage;
import jetbrains.helixgraph.traversal.TraversalContext;
import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges property changes into every upstream item. Upstream is read completely before the first write,
 * so no cursor of the pipeline observes its own modifications.
 */
public final class UpdateStep extends MaterializedStep {

    @NotNull
    private final TraversalContext context;
    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final Map<String, Value> changes;

    public UpdateStep(@NotNull final TraversalContext context,
                      @NotNull final Iterator<TraversalResult> upstream,
                      @NotNull final Map<String, Value> changes) {
        this.context = context;
        this.upstream = upstream;
        this.changes = changes;
    }

    @NotNull
    @Override
    protected List<TraversalResult> materialize() {
        final List<TraversalResult> items = new ArrayList<>();
        upstream.forEachRemaining(items::add);
        final List<TraversalResult> result = new ArrayList<>(items.size());
        for (final TraversalResult item : items) {
            if (!item.isOk()) {
                result.add(item);
                continue;
            }
            try {
                result.add(TraversalResult.ok(update(item.getValue())));
            } catch (ExodusException e) {
                result.add(TraversalResult.failed(e));
            }
        }
        return result;
    }

    @NotNull
    private TraversalValue update(@NotNull final TraversalValue value) {
        final GraphStorage storage = context.storage();
        if (value instanceof Node) {
            return storage.updateNode(context.txn(), (Node) value, changes);
        }
        if (value instanceof NodeWithScore) {
            return storage.updateNode(context.txn(), ((NodeWithScore) value).getNode(), changes);
        }
        if (value instanceof Edge) {
            return storage.updateEdge(context.txn(), (Edge) value, changes);
        }
        if (value instanceof Vector || value instanceof VectorWithoutData) {
            final Map<String, Value> properties = new LinkedHashMap<>(((PropertyHolder) value).getProperties());
            properties.putAll(changes);
            final VectorWithoutData updated = storage.getVectorCore().updateProperties(context.txn(), value.getId(), properties);
            return value instanceof Vector ? updated.withData(((Vector) value).getData()) : updated;
        }
        throw new TraversalException("Cannot update " + value);
    }
}
