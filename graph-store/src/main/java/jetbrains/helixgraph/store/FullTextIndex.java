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
package jetbrains.helixgraph.store;

import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.TraversalException;
import jetbrains.helixgraph.items.Node;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.UUID;

/**
 * Full-text search index kept in sync with nodes. Its documents live in the same transaction as the graph.
 */
public interface FullTextIndex {

    FullTextIndex NONE = new FullTextIndex() {
        @Override
        public void addDocument(@NotNull Transaction txn, @NotNull Node node) {
        }

        @Override
        public void deleteDocument(@NotNull Transaction txn, @NotNull UUID nodeId) {
        }
    };

    void addDocument(@NotNull Transaction txn, @NotNull Node node);

    void deleteDocument(@NotNull Transaction txn, @NotNull UUID nodeId);

    /**
     * @return at most {@code k} best matching documents, in descending order of score
     * @throws jetbrains.helixgraph.InvalidResultLimitException if {@code k} is negative
     */
    @NotNull
    default List<DocumentScore> search(@NotNull Transaction txn, @NotNull String query, int k) {
        throw new TraversalException("Full-text search is not enabled");
    }
}
