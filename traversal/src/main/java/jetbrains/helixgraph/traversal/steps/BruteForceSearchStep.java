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
import jetbrains.helixgraph.InvalidResultLimitException;
import jetbrains.helixgraph.TraversalException;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.items.VectorWithoutData;
import jetbrains.helixgraph.traversal.TraversalContext;
import jetbrains.helixgraph.traversal.TraversalResult;
import jetbrains.helixgraph.vectorcore.CosineDistance;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Exact search: computes the distance from the query to every upstream vector and yields the {@code k}
 * closest ones in ascending order of distance. Deleted vectors are skipped.
 */
public final class BruteForceSearchStep extends MaterializedStep {

    @NotNull
    private final TraversalContext context;
    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final double[] query;
    private final int k;

    public BruteForceSearchStep(@NotNull final TraversalContext context,
                                @NotNull final Iterator<TraversalResult> upstream,
                                @NotNull final double[] query,
                                final int k) {
        this.context = context;
        this.upstream = upstream;
        this.query = query;
        this.k = k;
    }

    @NotNull
    @Override
    protected List<TraversalResult> materialize() {
        if (k < 0) {
            return List.of(TraversalResult.failed(new InvalidResultLimitException(k)));
        }
        final List<Vector> vectors = new ArrayList<>();
        while (upstream.hasNext()) {
            final TraversalResult result = upstream.next();
            if (!result.isOk()) {
                return List.of(result);
            }
            final TraversalValue value = result.getValue();
            final Vector vector;
            if (value instanceof Vector) {
                vector = (Vector) value;
            } else if (value instanceof VectorWithoutData) {
                try {
                    vector = ((VectorWithoutData) value).withData(
                        context.storage().getVectorCore().getData(context.txn(), value.getId()));
                } catch (ExodusException e) {
                    return List.of(TraversalResult.failed(e));
                }
            } else {
                return List.of(TraversalResult.failed(new TraversalException("Expected a vector, got " + value)));
            }
            if (!vector.isDeleted()) {
                vectors.add(vector.withDistance(CosineDistance.distance(query, vector.getData())));
            }
        }
        vectors.sort(Comparator.comparingDouble(Vector::getDistanceOrMax));
        final List<TraversalResult> result = new ArrayList<>(Math.min(k, vectors.size()));
        for (int i = 0; i < k && i < vectors.size(); ++i) {
            result.add(TraversalResult.ok(vectors.get(i)));
        }
        return result;
    }
}
