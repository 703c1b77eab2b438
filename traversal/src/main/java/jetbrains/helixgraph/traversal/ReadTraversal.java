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

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.Iterator;

/**
 * Pipeline over a read-only transaction. Mutating operators are not available on it.
 */
public final class ReadTraversal extends AbstractTraversal<ReadTraversal> {

    public ReadTraversal(@NotNull final TraversalContext context) {
        this(context, Collections.emptyIterator());
    }

    public ReadTraversal(@NotNull final TraversalContext context, @NotNull final Iterator<TraversalResult> inner) {
        super(context, inner);
    }

    @NotNull
    @Override
    protected ReadTraversal create(@NotNull final Iterator<TraversalResult> inner) {
        return new ReadTraversal(context, inner);
    }
}
