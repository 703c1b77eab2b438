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
package jetbrains.helixgraph.traversal.dispatch;

import jetbrains.helixgraph.store.GraphStorage;
import org.jetbrains.annotations.NotNull;

/**
 * Compiled query. A handler opens its own transaction, runs its pipelines to completion and returns
 * either the result or a continuation waiting for an external asynchronous operation.
 */
@FunctionalInterface
public interface QueryHandler {

    @NotNull
    HandlerResult handle(@NotNull GraphStorage storage, @NotNull QueryRequest request);
}
