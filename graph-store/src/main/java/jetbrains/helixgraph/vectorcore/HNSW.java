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
package jetbrains.helixgraph.vectorcore;

import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.items.VectorWithoutData;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Approximate nearest neighbor index sharing transactions with the graph. Mutating methods require
 * the write transaction.
 */
public interface HNSW {

    /**
     * Finds up to {@code k} closest vectors of the label in ascending order of distance. Deleted vectors
     * and vectors rejected by the filter are skipped.
     */
    @NotNull
    List<Vector> search(@NotNull Transaction txn,
                        @NotNull double[] query,
                        int k,
                        @NotNull String label,
                        @Nullable Predicate<Vector> filter);

    @NotNull
    Vector insert(@NotNull Transaction txn,
                  @NotNull String label,
                  @NotNull double[] data,
                  @Nullable Map<String, Value> properties);

    /**
     * Soft-deletes the vector: it is only flagged, its links stay in the graph.
     */
    void delete(@NotNull Transaction txn, @NotNull UUID id);

    @NotNull
    Vector getFullVector(@NotNull Transaction txn, @NotNull UUID id);

    @NotNull
    VectorWithoutData getVectorWithoutData(@NotNull Transaction txn, @NotNull UUID id);
}
