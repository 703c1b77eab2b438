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
 * Scalar value in a pipeline, e.g. a projected property or a count.
 */
public final class ValueItem implements TraversalValue {

    @NotNull
    private final Value value;

    public ValueItem(@NotNull final Value value) {
        this.value = value;
    }

    @NotNull
    public Value getValue() {
        return value;
    }

    @Nullable
    @Override
    public UUID getId() {
        return null;
    }

    @NotNull
    @Override
    public String getLabel() {
        return "value";
    }

    @Nullable
    @Override
    public Value getProperty(@NotNull final String name) {
        return "value".equals(name) ? value : null;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof ValueItem && value.equals(((ValueItem) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
