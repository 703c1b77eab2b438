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

import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.items.VectorWithoutData;
import jetbrains.helixgraph.store.GraphStorage;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.UUID;

public final class Fetch {

    private Fetch() {
    }

    /**
     * Loads the item with the id as the target kind. Deleted vectors are skipped, so {@code null} is
     * returned for them.
     */
    @Nullable
    public static TraversalValue byId(@NotNull final GraphStorage storage,
                               @NotNull final Transaction txn,
                               @NotNull final UUID id,
                               @NotNull final Target target) {
        switch (target) {
            case NODE:
                return storage.getNode(txn, id);
            case EDGE:
                return storage.getEdge(txn, id);
            default: {
                final VectorWithoutData vector = storage.getVectorCore().getVectorWithoutData(txn, id);
                if (vector.isDeleted()) {
                    return null;
                }
                return target == Target.VECTOR ? vector.withData(storage.getVectorCore().getData(txn, id)) : vector;
            }
        }
    }
}
