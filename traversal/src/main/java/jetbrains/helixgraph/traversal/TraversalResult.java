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
package jetbrains.helixgraph.traversal;

import jetbrains.helixgraph.GraphException;
import jetbrains.helixgraph.items.TraversalValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One pulled item of a pipeline: either a value or the error which occurred while producing it.
 * Errors travel downstream as failed items, so a terminal decides whether to stop or to skip them.
 */
public final class TraversalResult {

    @Nullable
    private final TraversalValue value;
    @Nullable
    private final GraphException error;

    private TraversalResult(@Nullable final TraversalValue value, @Nullable final GraphException error) {
        this.value = value;
        this.error = error;
    }

    @NotNull
    public static TraversalResult ok(@NotNull final TraversalValue value) {
        return new TraversalResult(value, null);
    }

    @NotNull
    public static TraversalResult failed(@NotNull final Throwable error) {
        return new TraversalResult(null, GraphException.wrap(error));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @throws GraphException if the item is failed
     */
    @NotNull
    public TraversalValue getValue() {
        if (error != null) {
            throw error;
        }
        //noinspection ConstantConditions
        return value;
    }

    @Nullable
    public TraversalValue getValueOrNull() {
        return value;
    }

    @Nullable
    public GraphException getError() {
        return error;
    }

    @Override
    public String toString() {
        return error == null ? String.valueOf(value) : "Failed{" + error.getMessage() + '}';
    }
}
