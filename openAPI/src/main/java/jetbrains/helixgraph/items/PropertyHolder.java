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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Common part of stored items: id, label, format version and properties.
 */
public abstract class PropertyHolder implements TraversalValue {

    @NotNull
    private final UUID id;
    @NotNull
    private final String label;
    private final byte version;
    @NotNull
    private final Map<String, Value> properties;

    protected PropertyHolder(@NotNull final UUID id,
                             @NotNull final String label,
                             final byte version,
                             @Nullable final Map<String, Value> properties) {
        this.id = id;
        this.label = label;
        this.version = version;
        this.properties = properties == null || properties.isEmpty() ?
            Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    @NotNull
    @Override
    public UUID getId() {
        return id;
    }

    @NotNull
    @Override
    public String getLabel() {
        return label;
    }

    public byte getVersion() {
        return version;
    }

    @NotNull
    public Map<String, Value> getProperties() {
        return properties;
    }

    @Nullable
    @Override
    public Value getProperty(@NotNull final String name) {
        final Value result = properties.get(name);
        if (result != null) {
            return result;
        }
        switch (name) {
            case "id":
                return Value.of(id);
            case "label":
                return Value.of(label);
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((PropertyHolder) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
