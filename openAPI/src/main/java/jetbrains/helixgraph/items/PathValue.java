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

import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Path through the graph: nodes in visiting order and the edges between them, so there is always one node
 * more than edges.
 */
public final class PathValue implements TraversalValue {

    @NotNull
    private final List<Node> nodes;
    @NotNull
    private final List<Edge> edges;

    public PathValue(@NotNull final List<Node> nodes, @NotNull final List<Edge> edges) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
    }

    @NotNull
    public List<Node> getNodes() {
        return nodes;
    }

    @NotNull
    public List<Edge> getEdges() {
        return edges;
    }

    public int length() {
        return edges.size();
    }

    @Nullable
    @Override
    public UUID getId() {
        return null;
    }

    @NotNull
    @Override
    public String getLabel() {
        return "path";
    }

    @Nullable
    @Override
    public Value getProperty(@NotNull final String name) {
        return "length".equals(name) ? Value.of(edges.size()) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathValue)) return false;
        final PathValue that = (PathValue) o;
        return nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return 31 * nodes.hashCode() + edges.hashCode();
    }

    @Override
    public String toString() {
        return "Path" + nodes;
    }
}
