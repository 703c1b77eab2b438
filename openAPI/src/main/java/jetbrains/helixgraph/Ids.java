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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Generator and binary form of 128-bit item ids. Ids are time-ordered: 48 bits of unix milliseconds followed
 * by a 12-bit sequence, so ids issued by one process increase monotonically in creation order and their
 * big-endian byte form sorts the same way.
 */
public final class Ids {

    public static final int ID_LENGTH = 16;

    private static final int MAX_SEQUENCE = 0xfff;

    private static final UniformRandomProvider rng = RandomSource.XO_RO_SHI_RO_128_PP.create();

    private static long lastMillis = 0;
    private static int sequence = 0;

    private Ids() {
    }

    @NotNull
    public static synchronized UUID newId() {
        long millis = System.currentTimeMillis();
        if (millis <= lastMillis) {
            millis = lastMillis;
            if (++sequence > MAX_SEQUENCE) {
                ++millis;
                sequence = 0;
            }
        } else {
            sequence = 0;
        }
        lastMillis = millis;
        // version 7 layout: timestamp | version | sequence, variant | random
        final long msb = (millis << 16) | 0x7000L | sequence;
        final long lsb = (rng.nextLong() & 0x3fffffffffffffffL) | 0x8000000000000000L;
        return new UUID(msb, lsb);
    }

    @NotNull
    public static byte[] toBytes(@NotNull final UUID id) {
        final byte[] result = new byte[ID_LENGTH];
        writeBytes(id, result, 0);
        return result;
    }

    public static void writeBytes(@NotNull final UUID id, @NotNull final byte[] target, final int offset) {
        writeLong(id.getMostSignificantBits(), target, offset);
        writeLong(id.getLeastSignificantBits(), target, offset + 8);
    }

    @NotNull
    public static UUID fromBytes(@NotNull final byte[] bytes, final int offset) {
        if (bytes.length - offset < ID_LENGTH) {
            throw new DecodeException("Not enough bytes for an id: " + (bytes.length - offset));
        }
        return new UUID(readLong(bytes, offset), readLong(bytes, offset + 8));
    }

    private static void writeLong(final long value, final byte[] target, final int offset) {
        for (int i = 0; i < 8; ++i) {
            target[offset + i] = (byte) (value >>> (56 - 8 * i));
        }
    }

    private static long readLong(final byte[] bytes, final int offset) {
        long result = 0;
        for (int i = 0; i < 8; ++i) {
            result = (result << 8) | (bytes[offset + i] & 0xff);
        }
        return result;
    }
}
