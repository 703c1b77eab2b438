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
package jetbrains.helixgraph.vectorcore;

import jetbrains.exodus.ArrayByteIterable;
import jetbrains.exodus.ByteIterable;
import jetbrains.exodus.ByteIterator;
import jetbrains.helixgraph.InvalidVectorDataException;
import jetbrains.helixgraph.InvalidVectorLengthException;
import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Vector payload is a sequence of 64-bit floats in the byte order recorded in the storage metadata.
 */
public final class VectorBinding {

    private VectorBinding() {
    }

    @NotNull
    public static ArrayByteIterable dataToEntry(@NotNull final double[] data, @NotNull final ByteOrder order) {
        final ByteBuffer buffer = ByteBuffer.allocate(data.length * Double.BYTES).order(order);
        for (final double component : data) {
            buffer.putDouble(component);
        }
        return new ArrayByteIterable(buffer.array());
    }

    @NotNull
    public static double[] entryToData(@NotNull final ByteIterable entry, @NotNull final ByteOrder order) {
        final int length = entry.getLength();
        if (length == 0 || length % Double.BYTES != 0) {
            throw new InvalidVectorLengthException(length);
        }
        final byte[] bytes = new byte[length];
        final ByteIterator it = entry.iterator();
        for (int i = 0; i < length; ++i) {
            bytes[i] = it.next();
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(order);
        final double[] result = new double[length / Double.BYTES];
        for (int i = 0; i < result.length; ++i) {
            result[i] = buffer.getDouble();
        }
        return result;
    }

    /**
     * Rewrites payload stored in {@code from} byte order into {@code to} byte order.
     */
    @NotNull
    public static ArrayByteIterable convert(@NotNull final ByteIterable entry,
                                            @NotNull final ByteOrder from,
                                            @NotNull final ByteOrder to) {
        return dataToEntry(entryToData(entry, from), to);
    }

    public static void checkData(@NotNull final double[] data) {
        if (data.length == 0) {
            throw new InvalidVectorDataException("Vector is empty");
        }
        for (final double component : data) {
            if (!Double.isFinite(component)) {
                throw new InvalidVectorDataException("Vector has non-finite component: " + component);
            }
        }
    }
}
