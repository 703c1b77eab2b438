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
package jetbrains.helixgraph;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Property value of a node, an edge or a vector. Values are immutable. Numbers of different types are
 * comparable with each other.
 */
public final class Value implements Comparable<Value> {

    public static final Value EMPTY = new Value(ValueType.EMPTY, null);

    @NotNull
    private final ValueType type;
    private final Object value;

    private Value(@NotNull final ValueType type, final Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value of(@NotNull final String value) {
        return new Value(ValueType.STRING, value);
    }

    public static Value of(final int value) {
        return new Value(ValueType.I32, value);
    }

    public static Value of(final long value) {
        return new Value(ValueType.I64, value);
    }

    public static Value of(final float value) {
        return new Value(ValueType.F32, value);
    }

    public static Value of(final double value) {
        return new Value(ValueType.F64, value);
    }

    public static Value of(final boolean value) {
        return new Value(ValueType.BOOLEAN, value);
    }

    public static Value of(@NotNull final UUID value) {
        return new Value(ValueType.ID, value);
    }

    public static Value ofArray(@NotNull final List<Value> values) {
        return new Value(ValueType.ARRAY, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public static Value ofObject(@NotNull final Map<String, Value> values) {
        return new Value(ValueType.OBJECT, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Converts a plain Java object (string, boxed primitive, UUID, list or map of such objects) to a value.
     */
    @SuppressWarnings("unchecked")
    public static Value from(@Nullable final Object object) {
        if (object == null) {
            return EMPTY;
        }
        if (object instanceof Value) {
            return (Value) object;
        }
        if (object instanceof String) {
            return of((String) object);
        }
        if (object instanceof Integer || object instanceof Short || object instanceof Byte) {
            return of(((Number) object).intValue());
        }
        if (object instanceof Long) {
            return of((long) (Long) object);
        }
        if (object instanceof Float) {
            return of((float) (Float) object);
        }
        if (object instanceof Double) {
            return of((double) (Double) object);
        }
        if (object instanceof Boolean) {
            return of((boolean) (Boolean) object);
        }
        if (object instanceof UUID) {
            return of((UUID) object);
        }
        if (object instanceof List) {
            final List<Value> values = new ArrayList<>();
            for (final Object item : (List<Object>) object) {
                values.add(from(item));
            }
            return ofArray(values);
        }
        if (object instanceof Map) {
            final Map<String, Value> values = new LinkedHashMap<>();
            for (final Map.Entry<Object, Object> entry : ((Map<Object, Object>) object).entrySet()) {
                values.put(String.valueOf(entry.getKey()), from(entry.getValue()));
            }
            return ofObject(values);
        }
        throw new IllegalArgumentException("Unsupported value type: " + object.getClass().getName());
    }

    @NotNull
    public ValueType getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    @NotNull
    public String asString() {
        check(ValueType.STRING);
        return (String) value;
    }

    public long asLong() {
        if (!type.isIntegral()) {
            throw new DecodeException("Value of type " + type + " is not an integer");
        }
        return ((Number) value).longValue();
    }

    public int asInt() {
        return Math.toIntExact(asLong());
    }

    public double asDouble() {
        if (!type.isNumber()) {
            throw new DecodeException("Value of type " + type + " is not a number");
        }
        return ((Number) value).doubleValue();
    }

    public float asFloat() {
        return (float) asDouble();
    }

    public boolean asBoolean() {
        check(ValueType.BOOLEAN);
        return (Boolean) value;
    }

    @NotNull
    public UUID asId() {
        check(ValueType.ID);
        return (UUID) value;
    }

    @SuppressWarnings("unchecked")
    @NotNull
    public List<Value> asArray() {
        check(ValueType.ARRAY);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    @NotNull
    public Map<String, Value> asObject() {
        check(ValueType.OBJECT);
        return (Map<String, Value>) value;
    }

    @Override
    public int compareTo(@NotNull final Value other) {
        if (type.isNumber() && other.type.isNumber()) {
            if (type.isIntegral() && other.type.isIntegral()) {
                return Long.compare(asLong(), other.asLong());
            }
            return Double.compare(asDouble(), other.asDouble());
        }
        if (type != other.type) {
            return Integer.compare(type.getSortRank(), other.type.getSortRank());
        }
        switch (type) {
            case STRING:
                return asString().compareTo(other.asString());
            case BOOLEAN:
                return Boolean.compare(asBoolean(), other.asBoolean());
            case ID:
                return asId().compareTo(other.asId());
            case ARRAY: {
                final List<Value> left = asArray();
                final List<Value> right = other.asArray();
                final int size = Math.min(left.size(), right.size());
                for (int i = 0; i < size; ++i) {
                    final int cmp = left.get(i).compareTo(right.get(i));
                    if (cmp != 0) {
                        return cmp;
                    }
                }
                return Integer.compare(left.size(), right.size());
            }
            case OBJECT:
                return Integer.compare(asObject().size(), other.asObject().size());
            default:
                return 0;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        final Value that = (Value) o;
        return type == that.type && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return type == ValueType.EMPTY ? "null" : String.valueOf(value);
    }

    private void check(@NotNull final ValueType expected) {
        if (type != expected) {
            throw new DecodeException("Value of type " + type + " is not " + expected);
        }
    }
}
