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
 * Ids are stored as 16 big-endian bytes, so the key order of id-keyed stores is the creation order.
 */
public final class IdBinding {

    private IdBinding() {
    }

    @NotNull
    public static ArrayByteIterable idToEntry(@NotNull final UUID id) {
        return new ArrayByteIterable(Ids.toBytes(id));
    }

    @NotNull
    public static UUID entryToId(@NotNull final ByteIterable entry) {
        return Ids.fromBytes(ByteIterables.toArray(entry), 0);
    }
}
