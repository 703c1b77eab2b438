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

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import jetbrains.helixgraph.GraphException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scope of one top-level operation. Cursors opened by operators and scratch sets they allocate are
 * registered here and released together when the arena is closed, which must happen before the
 * transaction of the operation is finished. Items produced by the operation must not be used after that.
 */
public final class TraversalArena implements AutoCloseable {

    @NotNull
    private final List<AutoCloseable> resources = new ArrayList<>();
    @NotNull
    private final List<Set<?>> sets = new ArrayList<>();
    private boolean closed;

    @NotNull
    public <T extends AutoCloseable> T register(@NotNull final T resource) {
        checkNotClosed();
        resources.add(resource);
        return resource;
    }

    @NotNull
    public <T> Set<T> newSet() {
        checkNotClosed();
        final Set<T> result = new ObjectOpenHashSet<>();
        sets.add(result);
        return result;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (final Set<?> set : sets) {
            set.clear();
        }
        sets.clear();
        Exception failure = null;
        for (final AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        resources.clear();
        if (failure != null) {
            throw GraphException.wrap(failure);
        }
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("Arena is already closed");
        }
    }
}
