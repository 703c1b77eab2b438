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
package jetbrains.helixgraph.store;

import jetbrains.exodus.ArrayByteIterable;
import jetbrains.exodus.ByteIterable;
import jetbrains.helixgraph.Ids;
import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Value of an adjacency record: {@code edge id | id of the node at the other end}.
 */
public record AdjacencyEntry(@NotNull UUID edgeId, @NotNull UUID otherId) {

    @NotNull
    public ArrayByteIterable toEntry() {
        final byte[] bytes = new byte[Ids.ID_LENGTH * 2];
        Ids.writeBytes(edgeId, bytes, 0);
        Ids.writeBytes(otherId, bytes, Ids.ID_LENGTH);
        return new ArrayByteIterable(bytes);
    }

    @NotNull
    public static AdjacencyEntry fromEntry(@NotNull final ByteIterable entry) {
        final byte[] bytes = ByteIterables.toArray(entry);
        return new AdjacencyEntry(Ids.fromBytes(bytes, 0), Ids.fromBytes(bytes, Ids.ID_LENGTH));
    }
}
