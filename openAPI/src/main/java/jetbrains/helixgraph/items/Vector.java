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
 * Stored vector with its payload. The distance is set only on vectors produced by a search.
 */
public final class Vector extends PropertyHolder {

    private final int level;
    private final boolean deleted;
    @NotNull
    private final double[] data;
    @Nullable
    private final Double distance;

    public Vector(@NotNull final UUID id,
                  @NotNull final String label,
                  final byte version,
                  final int level,
                  final boolean deleted,
                  @NotNull final double[] data,
                  @Nullable final Map<String, Value> properties,
                  @Nullable final Double distance) {
        super(id, label, version, properties);
        this.level = level;
        this.deleted = deleted;
        this.data = data;
        this.distance = distance;
    }

    public int getLevel() {
        return level;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * @return the payload, callers must not modify it
     */
    @NotNull
    public double[] getData() {
        return data;
    }

    public int getDimension() {
        return data.length;
    }

    @Nullable
    public Double getDistance() {
        return distance;
    }

    public double getDistanceOrMax() {
        return distance == null ? Double.MAX_VALUE : distance;
    }

    @NotNull
    public Vector withDistance(final double distance) {
        return new Vector(getId(), getLabel(), getVersion(), level, deleted, data, getProperties(), distance);
    }

    @NotNull
    public Vector withProperties(@Nullable final Map<String, Value> properties) {
        return new Vector(getId(), getLabel(), getVersion(), level, deleted, data, properties, distance);
    }

    @NotNull
    public VectorWithoutData withoutData() {
        return new VectorWithoutData(getId(), getLabel(), getVersion(), level, deleted, getProperties());
    }

    @Nullable
    @Override
    public Value getProperty(@NotNull final String name) {
        final Value result = super.getProperty(name);
        if (result == null && "distance".equals(name) && distance != null) {
            return Value.of((double) distance);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Vector{id=" + getId() + ", label=" + getLabel() + ", level=" + level +
            ", dimension=" + data.length + (distance == null ? "" : ", distance=" + distance) +
            (deleted ? ", deleted" : "") + '}';
    }
}
