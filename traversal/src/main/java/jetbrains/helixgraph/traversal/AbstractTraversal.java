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

import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.TraversalException;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.EmptyValue;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.items.ValueItem;
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.store.GraphStorage;
import jetbrains.helixgraph.store.SecondaryIndex;
import jetbrains.helixgraph.traversal.steps.AdjacencyStep;
import jetbrains.helixgraph.traversal.steps.BruteForceSearchStep;
import jetbrains.helixgraph.traversal.steps.DedupStep;
import jetbrains.helixgraph.traversal.steps.Direction;
import jetbrains.helixgraph.traversal.steps.EdgeEndpointStep;
import jetbrains.helixgraph.traversal.steps.Fetch;
import jetbrains.helixgraph.traversal.steps.FilterStep;
import jetbrains.helixgraph.traversal.steps.FullTextSearchStep;
import jetbrains.helixgraph.traversal.steps.IntersectStep;
import jetbrains.helixgraph.traversal.steps.MapStep;
import jetbrains.helixgraph.traversal.steps.OrderByStep;
import jetbrains.helixgraph.traversal.steps.PathAlgorithm;
import jetbrains.helixgraph.traversal.steps.RangeStep;
import jetbrains.helixgraph.traversal.steps.ShortestPathStep;
import jetbrains.helixgraph.traversal.steps.SourceStep;
import jetbrains.helixgraph.traversal.steps.Target;
import jetbrains.helixgraph.traversal.steps.VectorSearchStep;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Lazy pull-based pipeline bound to one transaction and one arena. Each operator wraps the current
 * iterator and returns a new pipeline, sources replace the upstream. Nothing is read until a terminal
 * operation pulls items.
 *
 * @param <T> concrete pipeline type returned by operators
 */
public abstract class AbstractTraversal<T extends AbstractTraversal<T>> implements Iterator<TraversalResult> {

    @NotNull
    protected final TraversalContext context;
    @NotNull
    private final Iterator<TraversalResult> inner;

    protected AbstractTraversal(@NotNull final TraversalContext context, @NotNull final Iterator<TraversalResult> inner) {
        this.context = context;
        this.inner = inner;
    }

    @NotNull
    protected abstract T create(@NotNull Iterator<TraversalResult> inner);

    @NotNull
    public TraversalContext getContext() {
        return context;
    }

    @Override
    public boolean hasNext() {
        return inner.hasNext();
    }

    @Override
    public TraversalResult next() {
        return inner.next();
    }

    // sources

    @NotNull
    public T nFromId(@NotNull final UUID id) {
        return create(single(id, nodeId -> storage().getNode(txn(), nodeId)));
    }

    @NotNull
    public T nFromType(@NotNull final String label) {
        return create(SourceStep.of(context.arena().register(storage().iterateNodes(txn(), label))));
    }

    /**
     * Nodes having the value in the secondary index.
     */
    @NotNull
    public T nFromIndex(@NotNull final String indexName, @NotNull final Object value) {
        return nFromIndex(null, indexName, value);
    }

    /**
     * Nodes of the label having the value in the secondary index.
     */
    @NotNull
    public T nFromIndex(@Nullable final String label, @NotNull final String indexName, @NotNull final Object value) {
        final SecondaryIndex index = storage().getSecondaryIndex(txn(), indexName);
        if (index == null) {
            return create(failed(new TraversalException("Secondary index is not declared: " + indexName)));
        }
        return create(new SourceStep<>(context.arena().register(index.iterate(txn(), Value.from(value))), id -> {
            final Node node = storage().findNode(txn(), id);
            return node == null || (label != null && !label.equals(node.getLabel())) ? null : node;
        }));
    }

    @NotNull
    public T eFromId(@NotNull final UUID id) {
        return create(single(id, edgeId -> storage().getEdge(txn(), edgeId)));
    }

    @NotNull
    public T eFromType(@NotNull final String label) {
        return create(SourceStep.of(context.arena().register(storage().iterateEdges(txn(), label))));
    }

    /**
     * The vector by id, nothing if it is deleted.
     */
    @NotNull
    public T vFromId(@NotNull final UUID id, final boolean withData) {
        return create(single(id, vectorId -> Fetch.byId(storage(), txn(), vectorId,
            withData ? Target.VECTOR : Target.VECTOR_WITHOUT_DATA)));
    }

    /**
     * All vectors of the label which are not deleted.
     */
    @NotNull
    public T vFromType(@NotNull final String label, final boolean withData) {
        return create(new SourceStep<>(context.arena().register(storage().getVectorCore().iterate(txn(), label)),
            vector -> withData ? vector.withData(storage().getVectorCore().getData(txn(), vector.getId())) : vector));
    }

    /**
     * Approximate nearest neighbors of the query among vectors of the label.
     */
    @NotNull
    public T searchV(@NotNull final double[] query, final int k, @NotNull final String label) {
        return searchV(query, k, label, null);
    }

    @NotNull
    public T searchV(@NotNull final double[] query,
                     final int k,
                     @NotNull final String label,
                     @Nullable final Predicate<Vector> filter) {
        return create(new VectorSearchStep(context, query, k, label, filter));
    }

    /**
     * Nodes of the label among the {@code k} best BM25 matches of the query, as
     * {@linkplain jetbrains.helixgraph.items.NodeWithScore} in descending order of score.
     */
    @NotNull
    public T searchBm25(@NotNull final String label, @NotNull final String query, final int k) {
        return create(new FullTextSearchStep(context, label, query, k));
    }

    // graph walks

    @NotNull
    public T outNodes(@NotNull final String edgeLabel) {
        return create(new AdjacencyStep(context, inner, edgeLabel, Direction.OUT, Target.NODE));
    }

    @NotNull
    public T inNodes(@NotNull final String edgeLabel) {
        return create(new AdjacencyStep(context, inner, edgeLabel, Direction.IN, Target.NODE));
    }

    @NotNull
    public T outEdges(@NotNull final String edgeLabel) {
        return create(new AdjacencyStep(context, inner, edgeLabel, Direction.OUT, Target.EDGE));
    }

    @NotNull
    public T inEdges(@NotNull final String edgeLabel) {
        return create(new AdjacencyStep(context, inner, edgeLabel, Direction.IN, Target.EDGE));
    }

    @NotNull
    public T outVectors(@NotNull final String edgeLabel, final boolean withData) {
        return create(new AdjacencyStep(context, inner, edgeLabel, Direction.OUT, vectorTarget(withData)));
    }

    @NotNull
    public T inVectors(@NotNull final String edgeLabel, final boolean withData) {
        return create(new AdjacencyStep(context, inner, edgeLabel, Direction.IN, vectorTarget(withData)));
    }

    /**
     * Source nodes of upstream edges.
     */
    @NotNull
    public T fromNode() {
        return create(new EdgeEndpointStep(context, inner, Direction.IN, Target.NODE));
    }

    /**
     * Destination nodes of upstream edges.
     */
    @NotNull
    public T toNode() {
        return create(new EdgeEndpointStep(context, inner, Direction.OUT, Target.NODE));
    }

    @NotNull
    public T fromVector(final boolean withData) {
        return create(new EdgeEndpointStep(context, inner, Direction.IN, vectorTarget(withData)));
    }

    @NotNull
    public T toVector(final boolean withData) {
        return create(new EdgeEndpointStep(context, inner, Direction.OUT, vectorTarget(withData)));
    }

    @NotNull
    public T shortestPath(@NotNull final String edgeLabel, @NotNull final UUID to) {
        return shortestPath(edgeLabel, to, PathAlgorithm.BFS, null);
    }

    @NotNull
    public T shortestPath(@NotNull final String edgeLabel,
                          @NotNull final UUID to,
                          @NotNull final PathAlgorithm algorithm,
                          @Nullable final String weightProperty) {
        return create(new ShortestPathStep(context, inner, edgeLabel, to, algorithm, weightProperty));
    }

    // vectors

    /**
     * Exact search among upstream vectors.
     */
    @NotNull
    public T bruteForceSearchV(@NotNull final double[] query, final int k) {
        return create(new BruteForceSearchStep(context, inner, query, k));
    }

    // utilities

    /**
     * Items at positions {@code [start, end)}.
     */
    @NotNull
    public T range(final long start, final long end) {
        return create(new RangeStep(inner, start, end));
    }

    @NotNull
    public T take(final long n) {
        return range(0, n);
    }

    @NotNull
    public T dedup() {
        return create(new DedupStep(context.arena(), inner));
    }

    @NotNull
    public T filterRef(@NotNull final TraversalPredicate predicate) {
        return create(new FilterStep(context, inner, predicate));
    }

    @NotNull
    public T filter(@NotNull final Predicate<TraversalValue> predicate) {
        return filterRef((item, txn) -> predicate.test(item));
    }

    /**
     * Maps each item, items mapped to {@code null} are dropped.
     */
    @NotNull
    public T map(@NotNull final Function<TraversalValue, TraversalValue> mapper) {
        return create(new MapStep(inner, mapper));
    }

    /**
     * Projects the property of each item as a scalar value. Items without the property are dropped.
     */
    @NotNull
    public T props(@NotNull final String property) {
        return map(item -> {
            final Value value = item.getProperty(property);
            return value == null ? null : new ValueItem(value);
        });
    }

    @NotNull
    public T orderByAsc(@NotNull final String property) {
        return create(new OrderByStep(inner, property, false));
    }

    @NotNull
    public T orderByDesc(@NotNull final String property) {
        return create(new OrderByStep(inner, property, true));
    }

    /**
     * Items present in the results of the sub-traversal run for every upstream item.
     */
    @NotNull
    public T intersect(@NotNull final Function<TraversalValue, ? extends Iterator<TraversalResult>> subTraversal) {
        return create(new IntersectStep(inner, subTraversal));
    }

    /**
     * Replaces upstream with a single value holding the number of its items.
     */
    @NotNull
    public T countToValue() {
        return create(single(Boolean.TRUE, unused -> new ValueItem(Value.of(count()))));
    }

    // terminals

    /**
     * @throws jetbrains.helixgraph.GraphException the first failed item
     */
    @NotNull
    public List<TraversalValue> collect() {
        final List<TraversalValue> result = new ArrayList<>();
        while (inner.hasNext()) {
            result.add(inner.next().getValue());
        }
        return result;
    }

    /**
     * Collects items skipping failed ones.
     */
    @NotNull
    public List<TraversalValue> collectIgnoringErrors() {
        final List<TraversalValue> result = new ArrayList<>();
        while (inner.hasNext()) {
            final TraversalResult item = inner.next();
            if (item.isOk()) {
                result.add(item.getValue());
            }
        }
        return result;
    }

    @NotNull
    public List<TraversalResult> collectResults() {
        final List<TraversalResult> result = new ArrayList<>();
        inner.forEachRemaining(result::add);
        return result;
    }

    @NotNull
    public List<TraversalValue> collectDedup() {
        return dedup().collect();
    }

    @SuppressWarnings("unchecked")
    @NotNull
    public <V extends TraversalValue> List<V> collectAs(@NotNull final Class<V> clazz) {
        final List<V> result = new ArrayList<>();
        for (final TraversalValue value : collect()) {
            if (!clazz.isInstance(value)) {
                throw new TraversalException("Expected " + clazz.getSimpleName() + ", got " + value);
            }
            result.add((V) value);
        }
        return result;
    }

    /**
     * @return the first item or {@code null} if there are no items
     * @throws jetbrains.helixgraph.GraphException if the first item is failed
     */
    @Nullable
    public TraversalValue first() {
        return inner.hasNext() ? inner.next().getValue() : null;
    }

    /**
     * @return the first item or {@linkplain EmptyValue#INSTANCE} if there are no items
     */
    @NotNull
    public TraversalValue firstOrEmpty() {
        final TraversalValue result = first();
        return result == null ? EmptyValue.INSTANCE : result;
    }

    public long count() {
        long result = 0;
        while (inner.hasNext()) {
            inner.next().getValue();
            ++result;
        }
        return result;
    }

    public boolean exists() {
        while (inner.hasNext()) {
            if (inner.next().isOk()) {
                return true;
            }
        }
        return false;
    }

    public boolean anyMatch(@NotNull final Predicate<TraversalValue> predicate) {
        while (inner.hasNext()) {
            final TraversalResult item = inner.next();
            if (item.isOk() && predicate.test(item.getValue())) {
                return true;
            }
        }
        return false;
    }

    @NotNull
    public GroupBy groupBy(@NotNull final List<String> properties, final boolean count) {
        final Map<String, GroupByItem> groups = new LinkedHashMap<>();
        Grouping.aggregate(collect(), properties).forEach((key, aggregate) ->
            groups.put(key, new GroupByItem(aggregate.values(), aggregate.count())));
        return new GroupBy(count ? GroupBy.Kind.COUNT : GroupBy.Kind.GROUP, groups);
    }

    @NotNull
    public GroupBy groupBy(@NotNull final String... properties) {
        return groupBy(Arrays.asList(properties), false);
    }

    @NotNull
    public Map<String, AggregateItem> aggregateBy(@NotNull final List<String> properties) {
        return Grouping.aggregate(collect(), properties);
    }

    @NotNull
    public Map<String, AggregateItem> aggregateBy(@NotNull final String... properties) {
        return aggregateBy(Arrays.asList(properties));
    }

    // helpers

    @NotNull
    protected GraphStorage storage() {
        return context.storage();
    }

    @NotNull
    protected Transaction txn() {
        return context.txn();
    }

    @NotNull
    protected Iterator<TraversalResult> upstream() {
        return inner;
    }

    @NotNull
    protected static <K> Iterator<TraversalResult> single(@NotNull final K key,
                                                          @NotNull final Function<K, TraversalValue> resolver) {
        return new SourceStep<>(List.of(key).iterator(), resolver);
    }

    @NotNull
    protected static Iterator<TraversalResult> failed(@NotNull final Throwable error) {
        return List.of(TraversalResult.failed(error)).iterator();
    }

    @NotNull
    private static Target vectorTarget(final boolean withData) {
        return withData ? Target.VECTOR : Target.VECTOR_WITHOUT_DATA;
    }
}
