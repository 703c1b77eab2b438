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

public final class Node extends PropertyHolder {

    public Node(@NotNull final UUID id,
                @NotNull final String label,
                final byte version,
                @Nullable final Map<String, Value> properties) {
        super(id, label, version, properties);
    }

    @NotNull
    public Node withProperties(@Nullable final Map<String, Value> properties) {
        return new Node(getId(), getLabel(), getVersion(), properties);
    }

    @Override
    public String toString() {
        return "Node{id=" + getId() + ", label=" + getLabel() + ", properties=" + getProperties() + '}';
    }
}
