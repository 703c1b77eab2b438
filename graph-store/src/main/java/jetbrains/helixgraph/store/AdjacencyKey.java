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
import jetbrains.helixgraph.Ids;
import net.jpountz.xxhash.XXHash32;
import net.jpountz.xxhash.XXHashFactory;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Key of an adjacency record: {@code node id (16 bytes) | label hash (4 bytes)}, both big-endian. The label
 * hash is XXH32 of the UTF-8 label with zero seed.
 */
public final class AdjacencyKey {

    public static final int LENGTH = Ids.ID_LENGTH + Integer.BYTES;

    private static final XXHash32 hash32 = XXHashFactory.fastestInstance().hash32();

    private AdjacencyKey() {
    }

    public static int labelHash(@NotNull final String label) {
        final byte[] bytes = label.getBytes(StandardCharsets.UTF_8);
        return hash32.hash(bytes, 0, bytes.length, 0);
    }

    @NotNull
    public static ArrayByteIterable keyToEntry(@NotNull final UUID nodeId, @NotNull final String label) {
        return keyToEntry(nodeId, labelHash(label));
    }

    @NotNull
    public static ArrayByteIterable keyToEntry(@NotNull final UUID nodeId, final int labelHash) {
        final byte[] bytes = new byte[LENGTH];
        Ids.writeBytes(nodeId, bytes, 0);
        bytes[Ids.ID_LENGTH] = (byte) (labelHash >>> 24);
        bytes[Ids.ID_LENGTH + 1] = (byte) (labelHash >>> 16);
        bytes[Ids.ID_LENGTH + 2] = (byte) (labelHash >>> 8);
        bytes[Ids.ID_LENGTH + 3] = (byte) labelHash;
        return new ArrayByteIterable(bytes);
    }

    public static int entryToLabelHash(@NotNull final byte[] key) {
        return ((key[Ids.ID_LENGTH] & 0xff) << 24) | ((key[Ids.ID_LENGTH + 1] & 0xff) << 16) |
            ((key[Ids.ID_LENGTH + 2] & 0xff) << 8) | (key[Ids.ID_LENGTH + 3] & 0xff);
    }
}
