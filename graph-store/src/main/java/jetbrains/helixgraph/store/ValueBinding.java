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
import jetbrains.exodus.util.LightOutputStream;
import jetbrains.helixgraph.DecodeException;
import jetbrains.helixgraph.Ids;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.ValueType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary form of property values and property maps. A value is its type tag followed by the payload,
 * multi-byte numbers are big-endian. A property map is a presence byte, the number of entries and then
 * entries as length-prefixed names followed by values.
 */
public final class ValueBinding {

    private ValueBinding() {
    }

    /**
     * Serialized value used as a secondary index key.
     */
    @NotNull
    public static ArrayByteIterable valueToEntry(@NotNull final Value value) {
        final LightOutputStream output = new LightOutputStream();
        writeValue(output, value);
        return output.asArrayByteIterable();
    }

    public static void writeValue(@NotNull final LightOutputStream output, @NotNull final Value value) {
        final ValueType type = value.getType();
        output.write(type.ordinal());
        switch (type) {
            case EMPTY:
                break;
            case STRING:
                writeString(output, value.asString());
                break;
            case I32:
                output.write(ByteBuffer.allocate(Integer.BYTES).putInt(value.asInt()).array());
                break;
            case I64:
                output.write(ByteBuffer.allocate(Long.BYTES).putLong(value.asLong()).array());
                break;
            case F32:
                output.write(ByteBuffer.allocate(Float.BYTES).putFloat(value.asFloat()).array());
                break;
            case F64:
                output.write(ByteBuffer.allocate(Double.BYTES).putDouble(value.asDouble()).array());
                break;
            case BOOLEAN:
                output.write(value.asBoolean() ? 1 : 0);
                break;
            case ID:
                output.write(Ids.toBytes(value.asId()));
                break;
            case ARRAY: {
                final List<Value> values = value.asArray();
                writeInt(output, values.size());
                for (final Value item : values) {
                    writeValue(output, item);
                }
                break;
            }
            case OBJECT:
                writeMap(output, value.asObject());
                break;
        }
    }

    @NotNull
    public static Value readValue(@NotNull final ByteBuffer input) {
        final int tag = input.get() & 0xff;
        final ValueType[] types = ValueType.values();
        if (tag >= types.length) {
            throw new DecodeException("Unknown value type tag: " + tag);
        }
        switch (types[tag]) {
            case EMPTY:
                return Value.EMPTY;
            case STRING:
                return Value.of(readString(input));
            case I32:
                return Value.of(input.getInt());
            case I64:
                return Value.of(input.getLong());
            case F32:
                return Value.of(input.getFloat());
            case F64:
                return Value.of(input.getDouble());
            case BOOLEAN:
                return Value.of(input.get() != 0);
            case ID: {
                final byte[] id = new byte[Ids.ID_LENGTH];
                input.get(id);
                return Value.of(Ids.fromBytes(id, 0));
            }
            case ARRAY: {
                final int size = readSize(input);
                final List<Value> values = new ArrayList<>(size);
                for (int i = 0; i < size; ++i) {
                    values.add(readValue(input));
                }
                return Value.ofArray(values);
            }
            default:
                return Value.ofObject(readMap(input));
        }
    }

    public static void writeProperties(@NotNull final LightOutputStream output,
                                       @Nullable final Map<String, Value> properties) {
        if (properties == null || properties.isEmpty()) {
            output.write(0);
        } else {
            output.write(1);
            writeMap(output, properties);
        }
    }

    @Nullable
    public static Map<String, Value> readProperties(@NotNull final ByteBuffer input) {
        try {
            if (!input.hasRemaining() || input.get() == 0) {
                return null;
            }
            return readMap(input);
        } catch (BufferUnderflowException e) {
            throw new DecodeException("Truncated property map", e);
        }
    }

    private static void writeMap(@NotNull final LightOutputStream output, @NotNull final Map<String, Value> map) {
        writeInt(output, map.size());
        for (final Map.Entry<String, Value> entry : map.entrySet()) {
            writeString(output, entry.getKey());
            writeValue(output, entry.getValue());
        }
    }

    private static Map<String, Value> readMap(@NotNull final ByteBuffer input) {
        final int size = readSize(input);
        final Map<String, Value> result = new LinkedHashMap<>(size * 2);
        for (int i = 0; i < size; ++i) {
            final String name = readString(input);
            result.put(name, readValue(input));
        }
        return result;
    }

    private static void writeString(@NotNull final LightOutputStream output, @NotNull final String value) {
        final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeInt(output, bytes.length);
        output.write(bytes);
    }

    private static String readString(@NotNull final ByteBuffer input) {
        final byte[] bytes = new byte[readSize(input)];
        input.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void writeInt(@NotNull final LightOutputStream output, final int value) {
        output.write(ByteBuffer.allocate(Integer.BYTES).putInt(value).array());
    }

    private static int readSize(@NotNull final ByteBuffer input) {
        final int size = input.getInt();
        if (size < 0 || size > input.remaining()) {
            throw new DecodeException("Invalid size: " + size);
        }
        return size;
    }
}
