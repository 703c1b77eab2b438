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
import jetbrains.helixgraph.store.GraphStorage;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;

/**
 * Entry points of traversals. The arena must be closed before the transaction is finished.
 */
public final class G {

    private G() {
    }

    @NotNull
    public static ReadTraversal read(@NotNull final GraphStorage storage,
                                     @NotNull final Transaction txn,
                                     @NotNull final TraversalArena arena) {
        return new ReadTraversal(new TraversalContext(storage, txn, arena));
    }

    @NotNull
    public static WriteTraversal write(@NotNull final GraphStorage storage,
                                       @NotNull final Transaction txn,
                                       @NotNull final TraversalArena arena) {
        return new WriteTraversal(new TraversalContext(storage, txn, arena));
    }

    /**
     * Continues a read traversal from items produced elsewhere, e.g. by a previous pipeline of the same
     * operation.
     */
    @NotNull
    public static ReadTraversal readFrom(@NotNull final TraversalContext context,
                                         @NotNull final Iterator<TraversalResult> items) {
        return new ReadTraversal(context, items);
    }

    @NotNull
    public static WriteTraversal writeFrom(@NotNull final TraversalContext context,
                                           @NotNull final Iterator<TraversalResult> items) {
        return new WriteTraversal(context, items);
    }
}
