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
 * Item flowing through a traversal pipeline: a node, an edge, a vector (with or without its payload), a path,
 * a scalar value, a node with score or nothing.
 */
public interface TraversalValue {

    /**
     * @return id of the item or {@code null} for items that are not stored entities (paths, values, empty)
     */
    @Nullable
    UUID getId();

    @NotNull
    String getLabel();

    /**
     * Returns a property by name. The names {@code id} and {@code label} resolve to the item's own id and
     * label unless the item has properties with these names.
     */
    @Nullable
    Value getProperty(@NotNull String name);
}
