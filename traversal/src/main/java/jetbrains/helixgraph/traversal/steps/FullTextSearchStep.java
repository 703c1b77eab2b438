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
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.items.NodeWithScore;
import jetbrains.helixgraph.store.DocumentScore;
import jetbrains.helixgraph.traversal.TraversalContext;
import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * BM25 search over node documents. The best {@code k} documents are selected first and only then
 * filtered by label, so fewer than {@code k} nodes can be yielded.
 */
public final class FullTextSearchStep extends MaterializedStep {

    @NotNull
    private final TraversalContext context;
    @NotNull
    private final String label;
    @NotNull
    private final String query;
    private final int k;

    public FullTextSearchStep(@NotNull final TraversalContext context,
                              @NotNull final String label,
                              @NotNull final String query,
                              final int k) {
        this.context = context;
        this.label = label;
        this.query = query;
        this.k = k;
    }

    @NotNull
    @Override
    protected List<TraversalResult> materialize() {
        final List<TraversalResult> result = new ArrayList<>();
        try {
            for (final DocumentScore document : context.storage().getFullTextIndex().search(context.txn(), query, k)) {
                final Node node = context.storage().findNode(context.txn(), document.id());
                if (node != null && label.equals(node.getLabel())) {
                    result.add(TraversalResult.ok(new NodeWithScore(node, document.score())));
                }
            }
        } catch (ExodusException e) {
            return List.of(TraversalResult.failed(e));
        }
        return result;
    }
}
