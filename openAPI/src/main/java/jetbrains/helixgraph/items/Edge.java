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

import java.util.Map;
import java.util.UUID;

/**
 * Directed labeled edge. Edges reference their endpoints by id only, endpoints may be nodes or vectors.
 */
public final class Edge extends PropertyHolder {

    @NotNull
    private final UUID fromNode;
    @NotNull
    private final UUID toNode;

    public Edge(@NotNull final UUID id,
                @NotNull final String label,
                final byte version,
                @NotNull final UUID fromNode,
                @NotNull final UUID toNode,
                @Nullable final Map<String, Value> properties) {
        super(id, label, version, properties);
        this.fromNode = fromNode;
        this.toNode = toNode;
    }

    @NotNull
    public UUID getFromNode() {
        return fromNode;
    }

    @NotNull
    public UUID getToNode() {
        return toNode;
    }

    @NotNull
    public Edge withProperties(@Nullable final Map<String, Value> properties) {
        return new Edge(getId(), getLabel(), getVersion(), fromNode, toNode, properties);
    }

    @Nullable
    @Override
    public Value getProperty(@NotNull final String name) {
        final Value result = super.getProperty(name);
        if (result != null) {
            return result;
        }
        switch (name) {
            case "from_node":
                return Value.of(fromNode);
            case "to_node":
                return Value.of(toNode);
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return "Edge{id=" + getId() + ", label=" + getLabel() + ", " + fromNode + " -> " + toNode +
            ", properties=" + getProperties() + '}';
    }
}
