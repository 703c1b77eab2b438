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
import jetbrains.helixgraph.DuplicateKeyException;
import jetbrains.helixgraph.Value;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.UUID;

/**
 * Maps serialized values of a node property to ids of nodes having the value. A non-unique index keeps
 * duplicates, a unique one rejects a second node with the same value.
 */
public final class SecondaryIndex {

    static final String STORE_PREFIX = "secondary_index:";

    @NotNull
    private final String name;
    private final boolean unique;
    @NotNull
    private final Store store;

    SecondaryIndex(@NotNull final Environment env,
                   @NotNull final String name,
                   final boolean unique,
                   @NotNull final Transaction txn) {
        this.name = name;
        this.unique = unique;
        store = env.openStore(storeName(name), unique ?
            StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING : StoreConfig.WITH_DUPLICATES_WITH_PREFIXING, txn);
    }

    static String storeName(@NotNull final String indexName) {
        return STORE_PREFIX + indexName;
    }

    @NotNull
    public String getName() {
        return name;
    }

    public boolean isUnique() {
        return unique;
    }

    /**
     * Checks the value could be put for the node without modifying anything.
     *
     * @throws DuplicateKeyException if the index is unique and another node has the value
     */
    public void checkUnique(@NotNull final Transaction txn, @NotNull final Value value, @NotNull final UUID nodeId) {
        if (unique) {
            checkUnique(txn, ValueBinding.valueToEntry(value), value, nodeId);
        }
    }

    public void put(@NotNull final Transaction txn, @NotNull final Value value, @NotNull final UUID nodeId) {
        final ArrayByteIterable key = ValueBinding.valueToEntry(value);
        if (unique) {
            checkUnique(txn, key, value, nodeId);
        }
        store.put(txn, key, IdBinding.idToEntry(nodeId));
    }

    public boolean delete(@NotNull final Transaction txn, @NotNull final Value value, @NotNull final UUID nodeId) {
        try (Cursor cursor = store.openCursor(txn)) {
            return cursor.getSearchBoth(ValueBinding.valueToEntry(value), IdBinding.idToEntry(nodeId)) &&
                cursor.deleteCurrent();
        }
    }

    /**
     * Lazily iterates ids of nodes having the value.
     */
    @NotNull
    public CursorIterator<UUID> iterate(@NotNull final Transaction txn, @NotNull final Value value) {
        final ArrayByteIterable key = ValueBinding.valueToEntry(value);
        return new CursorIterator<>(store.openCursor(txn)) {
            @Nullable
            @Override
            protected UUID fetchNext(@NotNull final Cursor cursor, final boolean first) {
                if (first) {
                    final ByteIterable id = cursor.getSearchKey(key);
                    return id == null ? null : IdBinding.entryToId(id);
                }
                return cursor.getNextDup() ? IdBinding.entryToId(cursor.getValue()) : null;
            }
        };
    }

    public long count(@NotNull final Transaction txn) {
        return store.count(txn);
    }

    private void checkUnique(@NotNull final Transaction txn,
                             @NotNull final ByteIterable key,
                             @NotNull final Value value,
                             @NotNull final UUID nodeId) {
        final ByteIterable existing = store.get(txn, key);
        if (existing != null && !IdBinding.entryToId(existing).equals(nodeId)) {
            throw new DuplicateKeyException(name, value);
        }
    }

    @Override
    public String toString() {
        return "SecondaryIndex{" + name + (unique ? ", unique" : "") + '}';
    }
}
