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
import jetbrains.exodus.env.Environment;
import jetbrains.exodus.env.Store;
import jetbrains.exodus.env.StoreConfig;
import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.Ids;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One direction of graph adjacency: {@code (node id, label hash) -> (edge id, other node id)} with duplicates,
 * so neighbors of a node by a label are found without scanning other labels.
 */
public final class AdjacencyTable {

    @NotNull
    private final Store store;

    public AdjacencyTable(@NotNull final Environment env, @NotNull final String name, @NotNull final Transaction txn) {
        store = env.openStore(name, StoreConfig.WITH_DUPLICATES_WITH_PREFIXING, txn);
    }

    @NotNull
    public Store getStore() {
        return store;
    }

    public boolean put(@NotNull final Transaction txn,
                       @NotNull final UUID nodeId,
                       final int labelHash,
                       @NotNull final AdjacencyEntry entry) {
        return store.put(txn, AdjacencyKey.keyToEntry(nodeId, labelHash), entry.toEntry());
    }

    public boolean delete(@NotNull final Transaction txn,
                          @NotNull final UUID nodeId,
                          final int labelHash,
                          @NotNull final AdjacencyEntry entry) {
        try (Cursor cursor = store.openCursor(txn)) {
            return cursor.getSearchBoth(AdjacencyKey.keyToEntry(nodeId, labelHash), entry.toEntry()) &&
                cursor.deleteCurrent();
        }
    }

    public boolean hasAny(@NotNull final Transaction txn, @NotNull final UUID nodeId, final int labelHash) {
        try (Cursor cursor = store.openCursor(txn)) {
            return cursor.getSearchKey(AdjacencyKey.keyToEntry(nodeId, labelHash)) != null;
        }
    }

    /**
     * Lazily iterates entries of the node by the label.
     */
    @NotNull
    public CursorIterator<AdjacencyEntry> iterate(@NotNull final Transaction txn,
                                                  @NotNull final UUID nodeId,
                                                  @NotNull final String label) {
        final ArrayByteIterable key = AdjacencyKey.keyToEntry(nodeId, label);
        return new CursorIterator<>(store.openCursor(txn)) {
            @Nullable
            @Override
            protected AdjacencyEntry fetchNext(@NotNull final Cursor cursor, final boolean first) {
                if (first) {
                    final ByteIterable value = cursor.getSearchKey(key);
                    return value == null ? null : AdjacencyEntry.fromEntry(value);
                }
                return cursor.getNextDup() ? AdjacencyEntry.fromEntry(cursor.getValue()) : null;
            }
        };
    }

    /**
     * Collects entries of the node by all labels.
     */
    @NotNull
    public List<AdjacencyRecord> collectAll(@NotNull final Transaction txn, @NotNull final UUID nodeId) {
        final byte[] prefix = Ids.toBytes(nodeId);
        final List<AdjacencyRecord> result = new ArrayList<>();
        try (Cursor cursor = store.openCursor(txn)) {
            if (cursor.getSearchKeyRange(new ArrayByteIterable(prefix)) == null) {
                return result;
            }
            do {
                final byte[] key = ByteIterables.toArray(cursor.getKey());
                if (!ByteIterables.startsWith(key, prefix)) {
                    break;
                }
                result.add(new AdjacencyRecord(nodeId, AdjacencyKey.entryToLabelHash(key),
                    AdjacencyEntry.fromEntry(cursor.getValue())));
            } while (cursor.getNext());
        }
        return result;
    }

    /**
     * Collects all entries of the table.
     */
    @NotNull
    public List<AdjacencyRecord> collectAll(@NotNull final Transaction txn) {
        final List<AdjacencyRecord> result = new ArrayList<>();
        try (Cursor cursor = store.openCursor(txn)) {
            while (cursor.getNext()) {
                final byte[] key = ByteIterables.toArray(cursor.getKey());
                result.add(new AdjacencyRecord(Ids.fromBytes(key, 0), AdjacencyKey.entryToLabelHash(key),
                    AdjacencyEntry.fromEntry(cursor.getValue())));
            }
        }
        return result;
    }

    public long count(@NotNull final Transaction txn) {
        return store.count(txn);
    }

    public record AdjacencyRecord(@NotNull UUID nodeId, int labelHash, @NotNull AdjacencyEntry entry) {
    }
}
