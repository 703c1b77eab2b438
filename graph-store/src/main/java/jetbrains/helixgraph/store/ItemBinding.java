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
import jetbrains.exodus.util.LightOutputStream;
import jetbrains.helixgraph.DecodeException;
import jetbrains.helixgraph.Ids;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.Edge;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.items.VectorWithoutData;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * Stored item layout: {@code u64 little-endian label length | label UTF-8 | version byte}, then the
 * item-specific part and the property block. Edges store their endpoints, vector records store the
 * deleted flag and the HNSW level.
 */
public final class ItemBinding {

    private ItemBinding() {
    }

    @NotNull
    public static ArrayByteIterable nodeToEntry(@NotNull final String label,
                                                final byte version,
                                                @Nullable final Map<String, Value> properties) {
        final LightOutputStream output = new LightOutputStream();
        writeHeader(output, label, version);
        ValueBinding.writeProperties(output, properties);
        return output.asArrayByteIterable();
    }

    @NotNull
    public static Node entryToNode(@NotNull final UUID id, @NotNull final ByteIterable entry) {
        final ByteBuffer input = ByteBuffer.wrap(ByteIterables.toArray(entry));
        final String label = readLabel(input);
        try {
            final byte version = input.get();
            return new Node(id, label, version, ValueBinding.readProperties(input));
        } catch (BufferUnderflowException e) {
            throw new DecodeException("Truncated node " + id, e);
        }
    }

    @NotNull
    public static ArrayByteIterable edgeToEntry(@NotNull final String label,
                                                final byte version,
                                                @NotNull final UUID from,
                                                @NotNull final UUID to,
                                                @Nullable final Map<String, Value> properties) {
        final LightOutputStream output = new LightOutputStream();
        writeHeader(output, label, version);
        output.write(Ids.toBytes(from));
        output.write(Ids.toBytes(to));
        ValueBinding.writeProperties(output, properties);
        return output.asArrayByteIterable();
    }

    @NotNull
    public static Edge entryToEdge(@NotNull final UUID id, @NotNull final ByteIterable entry) {
        final ByteBuffer input = ByteBuffer.wrap(ByteIterables.toArray(entry));
        final String label = readLabel(input);
        try {
            final byte version = input.get();
            final byte[] ids = new byte[Ids.ID_LENGTH * 2];
            input.get(ids);
            return new Edge(id, label, version, Ids.fromBytes(ids, 0), Ids.fromBytes(ids, Ids.ID_LENGTH),
                ValueBinding.readProperties(input));
        } catch (BufferUnderflowException e) {
            throw new DecodeException("Truncated edge " + id, e);
        }
    }

    @NotNull
    public static ArrayByteIterable vectorToEntry(@NotNull final String label,
                                                  final byte version,
                                                  final boolean deleted,
                                                  final int level,
                                                  @Nullable final Map<String, Value> properties) {
        final LightOutputStream output = new LightOutputStream();
        writeHeader(output, label, version);
        output.write(deleted ? 1 : 0);
        output.write(ByteBuffer.allocate(Integer.BYTES).putInt(level).array());
        ValueBinding.writeProperties(output, properties);
        return output.asArrayByteIterable();
    }

    @NotNull
    public static ArrayByteIterable vectorToEntry(@NotNull final VectorWithoutData vector) {
        return vectorToEntry(vector.getLabel(), vector.getVersion(), vector.isDeleted(), vector.getLevel(),
            vector.getProperties());
    }

    @NotNull
    public static VectorWithoutData entryToVector(@NotNull final UUID id, @NotNull final ByteIterable entry) {
        final ByteBuffer input = ByteBuffer.wrap(ByteIterables.toArray(entry));
        final String label = readLabel(input);
        try {
            final byte version = input.get();
            final boolean deleted = input.get() != 0;
            final int level = input.getInt();
            return new VectorWithoutData(id, label, version, level, deleted, ValueBinding.readProperties(input));
        } catch (BufferUnderflowException e) {
            throw new DecodeException("Truncated vector " + id, e);
        }
    }

    /**
     * Reads only the label, without decoding the rest of the item.
     */
    @NotNull
    public static String entryToLabel(@NotNull final ByteIterable entry) {
        return readLabel(ByteBuffer.wrap(ByteIterables.toArray(entry)));
    }

    private static void writeHeader(@NotNull final LightOutputStream output,
                                    @NotNull final String label,
                                    final byte version) {
        final byte[] labelBytes = label.getBytes(StandardCharsets.UTF_8);
        output.write(ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(labelBytes.length).array());
        output.write(labelBytes);
        output.write(version);
    }

    @NotNull
    private static String readLabel(@NotNull final ByteBuffer input) {
        if (input.remaining() < Long.BYTES) {
            throw new IllegalStateException("Corrupted item header: " + input.remaining() + " bytes");
        }
        final long length = input.order(ByteOrder.LITTLE_ENDIAN).getLong();
        input.order(ByteOrder.BIG_ENDIAN);
        // the version byte follows the label
        if (length < 0 || length >= input.remaining()) {
            throw new IllegalStateException("Corrupted item header: label length " + length +
                " exceeds " + input.remaining() + " bytes");
        }
        final byte[] label = new byte[(int) length];
        input.get(label);
        return new String(label, StandardCharsets.UTF_8);
    }
}
