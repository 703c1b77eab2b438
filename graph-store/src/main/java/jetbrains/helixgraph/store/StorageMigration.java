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
import jetbrains.exodus.env.Cursor;
import jetbrains.exodus.env.Store;
import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.StorageException;
import jetbrains.helixgraph.vectorcore.VectorBinding;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Brings the on-disk format up to date when a store is opened. Each step is one-directional and runs
 * in the same transaction as the metadata update recording it, so it is applied at most once.
 */
final class StorageMigration {

    private static final Logger logger = LoggerFactory.getLogger(StorageMigration.class);

    static final int BATCH_SIZE = 1024;

    @NotNull
    private final GraphStorage storage;
    @NotNull
    private final ByteOrder nativeOrder;

    StorageMigration(@NotNull final GraphStorage storage) {
        this(storage, ByteOrder.nativeOrder());
    }

    StorageMigration(@NotNull final GraphStorage storage, @NotNull final ByteOrder nativeOrder) {
        this.storage = storage;
        this.nativeOrder = nativeOrder;
    }

    void migrate() {
        storage.getEnvironment().executeInExclusiveTransaction(this::migrate);
    }

    private void migrate(@NotNull final Transaction txn) {
        final StorageMetadata metadata = storage.getMetadata();
        final Long version = metadata.getStorageVersion(txn);
        final ByteOrder storedOrder;
        if (version == null) {
            // stores created before the metadata record hold big-endian vectors
            storedOrder = ByteOrder.BIG_ENDIAN;
            if (logger.isInfoEnabled()) {
                logger.info("Migrating store at " + storage.getLocation() + " from pre-metadata format");
            }
        } else if (version == StorageMetadata.VECTOR_NATIVE_ENDIANNESS) {
            storedOrder = metadata.getVectorEndianness(txn);
            if (storedOrder == null) {
                throw new StorageException("Storage version " + version + " has no vector endianness record");
            }
        } else {
            throw new StorageException("Unknown storage version: " + version);
        }
        if (version != null && storedOrder == nativeOrder) {
            return;
        }
        if (storedOrder != nativeOrder) {
            convertVectors(txn, storedOrder);
        }
        metadata.setStorageVersion(txn, StorageMetadata.VECTOR_NATIVE_ENDIANNESS);
        metadata.setVectorEndianness(txn, nativeOrder);
        removeOrphanedAdjacency(txn);
        if (logger.isInfoEnabled()) {
            logger.info("Store at " + storage.getLocation() + " is at storage version " +
                StorageMetadata.VECTOR_NATIVE_ENDIANNESS + ", vector endianness " + StorageMetadata.endiannessTag(nativeOrder));
        }
    }

    private void convertVectors(@NotNull final Transaction txn, @NotNull final ByteOrder from) {
        final Store store = storage.getVectorCore().getVectorDataStore();
        ArrayByteIterable lastKey = null;
        long converted = 0;
        while (true) {
            final List<ArrayByteIterable[]> batch = readBatch(txn, store, lastKey);
            for (final ArrayByteIterable[] entry : batch) {
                store.put(txn, entry[0], VectorBinding.convert(entry[1], from, nativeOrder));
            }
            converted += batch.size();
            if (!batch.isEmpty() && logger.isInfoEnabled()) {
                logger.info("Converted " + converted + " vectors from " + StorageMetadata.endiannessTag(from) +
                    " to " + StorageMetadata.endiannessTag(nativeOrder) + " endianness");
            }
            if (batch.size() < BATCH_SIZE) {
                break;
            }
            lastKey = batch.get(batch.size() - 1)[0];
        }
    }

    /**
     * Reads up to {@linkplain #BATCH_SIZE} key/value pairs following {@code lastKey}.
     */
    private static List<ArrayByteIterable[]> readBatch(@NotNull final Transaction txn,
                                                       @NotNull final Store store,
                                                       @Nullable final ArrayByteIterable lastKey) {
        final List<ArrayByteIterable[]> result = new ArrayList<>(BATCH_SIZE);
        try (Cursor cursor = store.openCursor(txn)) {
            boolean found;
            if (lastKey == null) {
                found = cursor.getNext();
            } else {
                found = cursor.getSearchKeyRange(lastKey) != null;
                if (found && Arrays.equals(ByteIterables.toArray(cursor.getKey()), ByteIterables.toArray(lastKey))) {
                    found = cursor.getNext();
                }
            }
            while (found && result.size() < BATCH_SIZE) {
                final ByteIterable key = cursor.getKey();
                final ByteIterable value = cursor.getValue();
                result.add(new ArrayByteIterable[]{
                    new ArrayByteIterable(ByteIterables.toArray(key)),
                    new ArrayByteIterable(ByteIterables.toArray(value))
                });
                found = cursor.getNext();
            }
        }
        return result;
    }

    private void removeOrphanedAdjacency(@NotNull final Transaction txn) {
        int removed = removeOrphanedAdjacency(txn, storage.getOutEdges());
        removed += removeOrphanedAdjacency(txn, storage.getInEdges());
        if (removed > 0 && logger.isWarnEnabled()) {
            logger.warn("Removed " + removed + " adjacency entries referring to missing edges");
        }
    }

    private int removeOrphanedAdjacency(@NotNull final Transaction txn, @NotNull final AdjacencyTable table) {
        int result = 0;
        for (final AdjacencyTable.AdjacencyRecord record : table.collectAll(txn)) {
            if (!storage.edgeExists(txn, record.entry().edgeId())) {
                table.delete(txn, record.nodeId(), record.labelHash(), record.entry());
                ++result;
            }
        }
        return result;
    }
}
