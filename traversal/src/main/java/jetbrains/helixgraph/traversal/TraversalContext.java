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

import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.store.GraphStorage;
import org.jetbrains.annotations.NotNull;

/**
 * Storage, transaction and arena shared by all operators of one pipeline.
 */
public record TraversalContext(@NotNull GraphStorage storage,
                               @NotNull Transaction txn,
                               @NotNull TraversalArena arena) {

    public boolean isWritable() {
        return !txn.isReadonly();
    }
}
