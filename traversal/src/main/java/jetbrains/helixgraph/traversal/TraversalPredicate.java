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
import jetbrains.helixgraph.items.TraversalValue;
import org.jetbrains.annotations.NotNull;

/**
 * Filter predicate with access to the transaction of the pipeline. An exception thrown by the predicate
 * turns the item into a failed one.
 */
@FunctionalInterface
public interface TraversalPredicate {

    boolean test(@NotNull TraversalValue item, @NotNull Transaction txn);
}
