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
package jetbrains.helixgraph.traversal;

import jetbrains.helixgraph.TraversalException;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.Edge;
import jetbrains.helixgraph.items.EmptyValue;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.items.NodeWithScore;
import jetbrains.helixgraph.items.PropertyHolder;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.items.VectorWithoutData;
import jetbrains.helixgraph.traversal.steps.FilterStep;
import jetbrains.helixgraph.traversal.steps.UpdateStep;
import jetbrains.helixgraph.traversal.steps.UpsertStep;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pipeline over a read-write transaction. Creation sources are lazy like any other source, the write
 * happens when a terminal pulls the item.
 */
public final class WriteTraversal extends AbstractTraversal<WriteTraversal> {

    private static final Logger logger = LoggerFactory.getLogger(WriteTraversal.class);

    public WriteTraversal(@NotNull final TraversalContext context) {
        this(context, Collections.emptyIterator());
    }

    public WriteTraversal(@NotNull final TraversalContext context, @NotNull final Iterator<TraversalResult> inner) {
        super(context, inner);
        if (!context.isWritable()) {
            throw new TraversalException("Write traversal requires a read-write transaction");
        }
    }

    @NotNull
    @Override
    protected WriteTraversal create(@NotNull final Iterator<TraversalResult> inner) {
        return new WriteTraversal(context, inner);
    }

    @NotNull
    public WriteTraversal addN(@NotNull final String label, @Nullable final Map<String, Value> properties) {
        return create(single(label, l -> storage().addNode(txn(), l, properties)));
    }

    @NotNull
    public WriteTraversal addE(@NotNull final String label,
                               @Nullable final Map<String, Value> properties,
                               @NotNull final UUID from,
                               @NotNull final UUID to) {
        return addE(label, properties, from, to, false);
    }

    /**
     * @param unique if {@code true} then the edge is rejected when {@code from} already has an outgoing edge
     *               of the label
     */
    @NotNull
    public WriteTraversal addE(@NotNull final String label,
                               @Nullable final Map<String, Value> properties,
                               @NotNull final UUID from,
                               @NotNull final UUID to,
                               final boolean unique) {
        return create(single(label, l -> storage().addEdge(txn(), l, properties, from, to, unique)));
    }

    /**
     * Inserts the vector through the vector index.
     */
    @NotNull
    public WriteTraversal insertV(@NotNull final String label,
                                  @NotNull final double[] data,
                                  @Nullable final Map<String, Value> properties) {
        return create(single(label, l -> storage().getVectorCore().insert(txn(), l, data, properties)));
    }

    /**
     * Merges {@code changes} into properties of every upstream item, repairing secondary indices.
     */
    @NotNull
    public WriteTraversal update(@NotNull final Map<String, Value> changes) {
        return create(new UpdateStep(context, upstream(), changes));
    }

    @NotNull
    public WriteTraversal upsertN(@NotNull final String label, @NotNull final Map<String, Value> properties) {
        return create(new UpsertStep(upstream(),
            item -> storage().updateNode(txn(), expect(item, Node.class), properties),
            () -> storage().addNode(txn(), label, properties)));
    }

    @NotNull
    public WriteTraversal upsertE(@NotNull final String label,
                                  @NotNull final Map<String, Value> properties,
                                  @NotNull final UUID from,
                                  @NotNull final UUID to) {
        return create(new UpsertStep(upstream(),
            item -> storage().updateEdge(txn(), expect(item, Edge.class), properties),
            () -> storage().addEdge(txn(), label, properties, from, to, false)));
    }

    @NotNull
    public WriteTraversal upsertV(@NotNull final String label,
                                  @NotNull final double[] data,
                                  @NotNull final Map<String, Value> properties) {
        return create(new UpsertStep(upstream(),
            item -> {
                if (!(item instanceof Vector) && !(item instanceof VectorWithoutData)) {
                    throw new TraversalException("Expected a vector, got " + item);
                }
                final Map<String, Value> merged = new LinkedHashMap<>(((PropertyHolder) item).getProperties());
                merged.putAll(properties);
                return storage().getVectorCore().updateProperties(txn(), ((PropertyHolder) item).getId(), merged);
            },
            () -> storage().getVectorCore().insert(txn(), label, data, properties)));
    }

    /**
     * Filter whose predicate may write through the transaction it gets.
     */
    @NotNull
    public WriteTraversal filterMut(@NotNull final TraversalPredicate predicate) {
        return create(new FilterStep(context, upstream(), predicate));
    }

    /**
     * Deletes every upstream item: nodes with their edges, edges, vectors softly. Upstream is read completely
     * before the first deletion. Items which are already gone, e.g. edges cascaded by a dropped node, are
     * skipped, so is {@linkplain EmptyValue}.
     *
     * @return number of deleted items
     * @throws jetbrains.helixgraph.GraphException the first failed upstream item, nothing is deleted then
     */
    public long drop() {
        final List<TraversalValue> items = new ArrayList<>();
        while (hasNext()) {
            items.add(next().getValue());
        }
        long dropped = 0;
        for (final TraversalValue item : items) {
            final UUID id = item.getId();
            if (item instanceof EmptyValue) {
                continue;
            }
            if (item instanceof Node || item instanceof NodeWithScore) {
                if (storage().nodeExists(txn(), id)) {
                    storage().dropNode(txn(), id);
                    ++dropped;
                }
            } else if (item instanceof Edge) {
                if (storage().edgeExists(txn(), id)) {
                    storage().dropEdge(txn(), id);
                    ++dropped;
                }
            } else if (item instanceof Vector || item instanceof VectorWithoutData) {
                final VectorWithoutData vector = storage().getVectorCore().findVectorWithoutData(txn(), id);
                if (vector != null && !vector.isDeleted()) {
                    storage().dropVector(txn(), id);
                    ++dropped;
                }
            } else {
                throw new TraversalException("Cannot drop " + item);
            }
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Dropped " + dropped + " of " + items.size() + " items");
        }
        return dropped;
    }

    @NotNull
    private static <V extends TraversalValue> V expect(@NotNull final TraversalValue item, @NotNull final Class<V> clazz) {
        if (!clazz.isInstance(item)) {
            throw new TraversalException("Expected " + clazz.getSimpleName() + ", got " + item);
        }
        return clazz.cast(item);
    }
}
