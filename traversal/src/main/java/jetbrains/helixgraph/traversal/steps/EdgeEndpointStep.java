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
package jetbrains.helixgraph.traversal.steps;

import jetbrains.exodus.ExodusException;
import jetbrains.helixgraph.TraversalException;
import jetbrains.helixgraph.items.Edge;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.traversal.TraversalContext;
import jetbrains.helixgraph.traversal.TraversalResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;

/**
 * Resolves the source ({@linkplain Direction#IN}) or the destination ({@linkplain Direction#OUT}) of each
 * upstream edge.
 */
public final class EdgeEndpointStep extends TraversalStep {

    @NotNull
    private final TraversalContext context;
    @NotNull
    private final Iterator<TraversalResult> upstream;
    @NotNull
    private final Direction direction;
    @NotNull
    private final Target target;

    public EdgeEndpointStep(@NotNull final TraversalContext context,
                            @NotNull final Iterator<TraversalResult> upstream,
                            @NotNull final Direction direction,
                            @NotNull final Target target) {
        this.context = context;
        this.upstream = upstream;
        this.direction = direction;
        this.target = target;
    }

    @Nullable
    @Override
    protected TraversalResult computeNext() {
        while (upstream.hasNext()) {
            final TraversalResult result = upstream.next();
            if (!result.isOk()) {
                return result;
            }
            final TraversalValue value = result.getValue();
            if (!(value instanceof Edge)) {
                return TraversalResult.failed(new TraversalException("Expected an edge, got " + value));
            }
            final Edge edge = (Edge) value;
            try {
                final TraversalValue endpoint = Fetch.byId(context.storage(), context.txn(),
                    direction == Direction.IN ? edge.getFromNode() : edge.getToNode(), target);
                if (endpoint != null) {
                    return TraversalResult.ok(endpoint);
                }
            } catch (ExodusException e) {
                return TraversalResult.failed(e);
            }
        }
        return null;
    }
}
