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
import jetbrains.exodus.bindings.StringBinding;
import jetbrains.exodus.env.Environment;
import jetbrains.exodus.env.Store;
import jetbrains.exodus.env.StoreConfig;
import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.StorageException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Format version record of the store. {@code storage_version} is an u64 little-endian tag, absence of it
 * means the store predates the metadata. {@code vector_endianness} is {@code "big"} or {@code "lil"}.
 */
public final class StorageMetadata {

    public static final String STORE_NAME = "metadata";

    /**
     * Vector payloads are stored in the byte order named by {@linkplain #VECTOR_ENDIANNESS_KEY}.
     */
    public static final long VECTOR_NATIVE_ENDIANNESS = 1;

    static final ByteIterable STORAGE_VERSION_KEY = StringBinding.stringToEntry("storage_version");
    static final ByteIterable VECTOR_ENDIANNESS_KEY = StringBinding.stringToEntry("vector_endianness");

    private static final String BIG_ENDIAN_TAG = "big";
    private static final String LITTLE_ENDIAN_TAG = "lil";

    @NotNull
    private final Store store;

    StorageMetadata(@NotNull final Environment env, @NotNull final Transaction txn) {
        store = env.openStore(STORE_NAME, StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
    }

    @Nullable
    public Long getStorageVersion(@NotNull final Transaction txn) {
        final ByteIterable entry = store.get(txn, STORAGE_VERSION_KEY);
        if (entry == null) {
            return null;
        }
        final byte[] bytes = ByteIterables.toArray(entry);
        if (bytes.length != Long.BYTES) {
            throw new StorageException("Invalid storage version record of " + bytes.length + " bytes");
        }
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getLong();
    }

    public void setStorageVersion(@NotNull final Transaction txn, final long version) {
        store.put(txn, STORAGE_VERSION_KEY,
            new ArrayByteIterable(ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(version).array()));
    }

    @Nullable
    public ByteOrder getVectorEndianness(@NotNull final Transaction txn) {
        final ByteIterable entry = store.get(txn, VECTOR_ENDIANNESS_KEY);
        return entry == null ? null : parseEndianness(new String(ByteIterables.toArray(entry), StandardCharsets.UTF_8));
    }

    public void setVectorEndianness(@NotNull final Transaction txn, @NotNull final ByteOrder order) {
        store.put(txn, VECTOR_ENDIANNESS_KEY, new ArrayByteIterable(endiannessTag(order).getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Removes the version record, so that the store looks like one created before the metadata existed.
     */
    void clear(@NotNull final Transaction txn) {
        store.delete(txn, STORAGE_VERSION_KEY);
        store.delete(txn, VECTOR_ENDIANNESS_KEY);
    }

    @NotNull
    static String endiannessTag(@NotNull final ByteOrder order) {
        return order == ByteOrder.BIG_ENDIAN ? BIG_ENDIAN_TAG : LITTLE_ENDIAN_TAG;
    }

    @NotNull
    static ByteOrder parseEndianness(@NotNull final String tag) {
        switch (tag) {
            case BIG_ENDIAN_TAG:
                return ByteOrder.BIG_ENDIAN;
            case LITTLE_ENDIAN_TAG:
                return ByteOrder.LITTLE_ENDIAN;
            default:
                throw new StorageException("Unknown vector endianness: " + tag);
        }
    }
}
