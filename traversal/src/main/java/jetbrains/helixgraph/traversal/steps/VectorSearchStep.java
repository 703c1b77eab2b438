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
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.traversal.TraversalContext;
import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Approximate nearest neighbor search through the vector index, yields vectors with distances in
 * ascending order.
 */
public final class VectorSearchStep extends MaterializedStep {

    @NotNull
    private final TraversalContext context;
    @NotNull
    private final double[] query;
    private final int k;
    @NotNull
    private final String label;
    @Nullable
    private final Predicate<Vector> filter;

    public VectorSearchStep(@NotNull final TraversalContext context,
                            @NotNull final double[] query,
                            final int k,
                            @NotNull final String label,
                            @Nullable final Predicate<Vector> filter) {
        this.context = context;
        this.query = query;
        this.k = k;
        this.label = label;
        this.filter = filter;
    }

    @NotNull
    @Override
    protected List<TraversalResult> materialize() {
        final List<Vector> vectors;
        try {
            vectors = context.storage().getVectorCore().search(context.txn(), query, k, label, filter);
        } catch (ExodusException e) {
            return List.of(TraversalResult.failed(e));
        }
        final List<TraversalResult> result = new ArrayList<>(vectors.size());
        for (final Vector vector : vectors) {
            result.add(TraversalResult.ok(vector));
        }
        return result;
    }
}
