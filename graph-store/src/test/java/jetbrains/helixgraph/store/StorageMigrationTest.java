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
import jetbrains.exodus.env.Cursor;
import jetbrains.exodus.env.Store;
import jetbrains.exodus.env.StoreConfig;
import jetbrains.helixgraph.Ids;
import jetbrains.helixgraph.StorageException;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.vectorcore.VectorBinding;
import org.junit.Assert;
import org.junit.Test;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class StorageMigrationTest extends GraphStoreTestBase {

    @Test
    public void newStoreIsTagged() {
        storage.executeInReadonlyTransaction(txn -> {
            Assert.assertEquals(Long.valueOf(StorageMetadata.VECTOR_NATIVE_ENDIANNESS), storage.getMetadata().getStorageVersion(txn));
            Assert.assertEquals(ByteOrder.nativeOrder(), storage.getMetadata().getVectorEndianness(txn));
        });
    }

    @Test
    public void preMetadataVectorsAreConverted() {
        final List<Vector> vectors = new ArrayList<>();
        storage.executeInWriteTransaction(txn -> {
            for (int i = 0; i < 10; ++i) {
                vectors.add(storage.getVectorCore().insert(txn, "doc", new double[]{i + 1, 0.25 * i, -i}, null));
            }
        });
        // rewrite the store the way it looked before the metadata record existed
        storage.executeInWriteTransaction(txn -> {
            final Store data = storage.getVectorCore().getVectorDataStore();
            for (final Vector vector : vectors) {
                data.put(txn, IdBinding.idToEntry(vector.getId()), VectorBinding.dataToEntry(vector.getData(), ByteOrder.BIG_ENDIAN));
            }
            storage.getMetadata().clear(txn);
        });
        reopen();
        storage.executeInReadonlyTransaction(txn -> {
            for (final Vector vector : vectors) {
                Assert.assertArrayEquals(vector.getData(), storage.getVectorCore().getData(txn, vector.getId()), 0.0);
            }
            Assert.assertEquals(Long.valueOf(StorageMetadata.VECTOR_NATIVE_ENDIANNESS), storage.getMetadata().getStorageVersion(txn));
        });
        // a second open finds nothing to do
        reopen();
        storage.executeInReadonlyTransaction(txn -> {
            for (final Vector vector : vectors) {
                Assert.assertArrayEquals(vector.getData(), storage.getVectorCore().getData(txn, vector.getId()), 0.0);
            }
        });
    }

    @Test
    public void conversionRunsInBatches() {
        final int count = StorageMigration.BATCH_SIZE * 2 + 3;
        final Store[] data = new Store[1];
        storage.executeInWriteTransaction(txn -> {
            data[0] = storage.getVectorCore().getVectorDataStore();
            for (int i = 0; i < count; ++i) {
                data[0].put(txn, IdBinding.idToEntry(Ids.newId()), VectorBinding.dataToEntry(new double[]{i, 1}, ByteOrder.BIG_ENDIAN));
            }
            storage.getMetadata().clear(txn);
        });
        reopen();
        storage.executeInReadonlyTransaction(txn -> {
            final List<Double> firsts = new ArrayList<>();
            try (Cursor cursor = storage.getVectorCore().getVectorDataStore().openCursor(txn)) {
                while (cursor.getNext()) {
                    firsts.add(VectorBinding.entryToData(cursor.getValue(), ByteOrder.nativeOrder())[0]);
                }
            }
            Assert.assertEquals(count, firsts.size());
            for (int i = 0; i < count; ++i) {
                Assert.assertEquals(i, firsts.get(i), 0.0);
            }
        });
    }

    @Test
    public void orphanedAdjacencyIsRemoved() {
        storage.executeInWriteTransaction(txn -> {
            final Node a = storage.addNode(txn, "person", null);
            final Node b = storage.addNode(txn, "person", null);
            storage.addEdge(txn, "knows", null, a.getId(), b.getId(), false);
            storage.getOutEdges().put(txn, a.getId(), AdjacencyKey.labelHash("knows"), new AdjacencyEntry(Ids.newId(), b.getId()));
            storage.getMetadata().clear(txn);
        });
        reopen();
        storage.executeInReadonlyTransaction(txn -> {
            Assert.assertEquals(1, storage.getOutEdges().count(txn));
            Assert.assertEquals(1, storage.getInEdges().count(txn));
        });
    }

    @Test(expected = StorageException.class)
    public void unknownEndiannessTag() {
        storage.executeInWriteTransaction(txn -> {
            final Store metadata = storage.getEnvironment().openStore(StorageMetadata.STORE_NAME,
                StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
            metadata.put(txn, StorageMetadata.VECTOR_ENDIANNESS_KEY, new ArrayByteIterable("mid".getBytes(StandardCharsets.UTF_8)));
        });
        reopen();
    }

    @Test(expected = StorageException.class)
    public void unknownStorageVersion() {
        storage.executeInWriteTransaction(txn -> storage.getMetadata().setStorageVersion(txn, 42));
        reopen();
    }
}
