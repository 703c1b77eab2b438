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
import jetbrains.helixgraph.items.PathValue;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.store.AdjacencyEntry;
import jetbrains.helixgraph.store.CursorIterator;
import jetbrains.helixgraph.traversal.TraversalContext;
import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.UUID;

/**
 * For each upstream node finds the shortest path to the target node along outgoing edges of the label.
 * Nodes from which the target is unreachable yield nothing.
 */
public final class ShortestPathStep extends TraversalStep {

    @NotNull
    private final TraversalContext context;
    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final String edgeLabel;
    @NotNull
    private final UUID to;
    @NotNull
    private final PathAlgorithm algorithm;
    @Nullable
    private final String weightProperty;

    public ShortestPathStep(@NotNull final TraversalContext context,
                            @NotNull final Iterator<TraversalResult> upstream,
                            @NotNull final String edgeLabel,
                            @NotNull final UUID to,
                            @NotNull final PathAlgorithm algorithm,
                            @Nullable final String weightProperty) {
        this.context = context;
        this.upstream = upstream;
        this.edgeLabel = edgeLabel;
        this.to = to;
        this.algorithm = algorithm;
        this.weightProperty = weightProperty;
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
            if (!(value instanceof Node)) {
                return TraversalResult.failed(new TraversalException("Expected a node, got " + value));
            }
            try {
                final UUID from = value.getId();
                final Map<UUID, Step> parents = algorithm == PathAlgorithm.BFS ? bfs(from) : dijkstra(from);
                if (parents != null) {
                    return TraversalResult.ok(buildPath(from, parents));
                }
            } catch (ExodusException e) {
                return TraversalResult.failed(e);
            }
        }
        return null;
    }

    @Nullable
    private Map<UUID, Step> bfs(@NotNull final UUID from) {
        final Map<UUID, Step> parents = new HashMap<>();
        final ArrayDeque<UUID> queue = new ArrayDeque<>();
        parents.put(from, null);
        queue.add(from);
        while (!queue.isEmpty()) {
            final UUID current = queue.poll();
            if (current.equals(to)) {
                return parents;
            }
            try (CursorIterator<AdjacencyEntry> it = context.storage().getOutEdges().iterate(context.txn(), current, edgeLabel)) {
                while (it.hasNext()) {
                    final AdjacencyEntry entry = it.next();
                    if (!parents.containsKey(entry.otherId())) {
                        parents.put(entry.otherId(), new Step(current, entry.edgeId()));
                        queue.add(entry.otherId());
                    }
                }
            }
        }
        return null;
    }

    @Nullable
    private Map<UUID, Step> dijkstra(@NotNull final UUID from) {
        final Map<UUID, Step> parents = new HashMap<>();
        final Map<UUID, Double> distances = new HashMap<>();
        final PriorityQueue<Reached> queue = new PriorityQueue<>((left, right) -> Double.compare(left.distance, right.distance));
        parents.put(from, null);
        distances.put(from, 0.0);
        queue.add(new Reached(from, 0.0));
        while (!queue.isEmpty()) {
            final Reached current = queue.poll();
            if (current.distance > distances.get(current.id)) {
                continue;
            }
            if (current.id.equals(to)) {
                return parents;
            }
            try (CursorIterator<AdjacencyEntry> it = context.storage().getOutEdges().iterate(context.txn(), current.id, edgeLabel)) {
                while (it.hasNext()) {
                    final AdjacencyEntry entry = it.next();
                    final double distance = current.distance + weight(context.storage().getEdge(context.txn(), entry.edgeId()));
                    final Double known = distances.get(entry.otherId());
                    if (known == null || distance < known) {
                        distances.put(entry.otherId(), distance);
                        parents.put(entry.otherId(), new Step(current.id, entry.edgeId()));
                        queue.add(new Reached(entry.otherId(), distance));
                    }
                }
            }
        }
        return null;
    }

    private double weight(@NotNull final Edge edge) {
        if (weightProperty == null) {
            return 1.0;
        }
        final Value value = edge.getProperty(weightProperty);
        if (value == null || value.isEmpty()) {
            return 1.0;
        }
        final double result = value.asDouble();
        if (result < 0) {
            throw new TraversalException("Negative weight of edge " + edge.getId() + ": " + result);
        }
        return result;
    }

    @NotNull
    private PathValue buildPath(@NotNull final UUID from, @NotNull final Map<UUID, Step> parents) {
        final List<Node> nodes = new ArrayList<>();
        final List<Edge> edges = new ArrayList<>();
        UUID current = to;
        while (true) {
            nodes.add(context.storage().getNode(context.txn(), current));
            final Step step = parents.get(current);
            if (step == null) {
                break;
            }
            edges.add(context.storage().getEdge(context.txn(), step.edgeId));
            current = step.previous;
        }
        Collections.reverse(nodes);
        Collections.reverse(edges);
        return new PathValue(nodes, edges);
    }

    private record Step(@NotNull UUID previous, @NotNull UUID edgeId) {
    }

    private record Reached(@NotNull UUID id, double distance) {
    }
}
