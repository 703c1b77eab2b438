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
package jetbrains.helixgraph.items;

import jetbrains.helixgraph.Value;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.UUID;

/**
 * Node paired with its BM25 relevance score, produced by full-text search.
 */
public final class NodeWithScore implements TraversalValue {

    @NotNull
    private final Node node;
    private final double score;

    public NodeWithScore(@NotNull final Node node, final double score) {
        this.node = node;
        this.score = score;
    }

    @NotNull
    public Node getNode() {
        return node;
    }

    public double getScore() {
        return score;
    }

    @NotNull
    @Override
    public UUID getId() {
        return node.getId();
    }

    @NotNull
    @Override
    public String getLabel() {
        return node.getLabel();
    }

    @Nullable
    @Override
    public Value getProperty(@NotNull final String name) {
        final Value result = node.getProperty(name);
        return result == null && "score".equals(name) ? Value.of(score) : result;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof NodeWithScore && node.equals(((NodeWithScore) o).node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }

    @Override
    public String toString() {
        return "NodeWithScore{" + node + ", score=" + score + '}';
    }
}
