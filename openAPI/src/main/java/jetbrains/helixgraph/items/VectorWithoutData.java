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
 * Vector metadata without the payload, for operators which need labels and properties only.
 */
public final class VectorWithoutData extends PropertyHolder {

    private final int level;
    private final boolean deleted;

    public VectorWithoutData(@NotNull final UUID id,
                             @NotNull final String label,
                             final byte version,
                             final int level,
                             final boolean deleted,
                             @Nullable final Map<String, Value> properties) {
        super(id, label, version, properties);
        this.level = level;
        this.deleted = deleted;
    }

    public int getLevel() {
        return level;
    }

    public boolean isDeleted() {
        return deleted;
    }

    @NotNull
    public Vector withData(@NotNull final double[] data) {
        return new Vector(getId(), getLabel(), getVersion(), level, deleted, data, getProperties(), null);
    }

    @NotNull
    public VectorWithoutData withProperties(@Nullable final Map<String, Value> properties) {
        return new VectorWithoutData(getId(), getLabel(), getVersion(), level, deleted, properties);
    }

    @NotNull
    public VectorWithoutData markDeleted() {
        return new VectorWithoutData(getId(), getLabel(), getVersion(), level, true, getProperties());
    }

    @Override
    public String toString() {
        return "VectorWithoutData{id=" + getId() + ", label=" + getLabel() + ", level=" + level +
            (deleted ? ", deleted" : "") + '}';
    }
}
