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

import jetbrains.helixgraph.EntryPointNotFoundException;
import jetbrains.helixgraph.GraphStoreConfig;
import jetbrains.helixgraph.InvalidResultLimitException;
import jetbrains.helixgraph.InvalidVectorDataException;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.VectorAlreadyDeletedException;
import jetbrains.helixgraph.VectorNotFoundException;
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.items.VectorWithoutData;
import jetbrains.helixgraph.store.CursorIterator;
import jetbrains.helixgraph.store.GraphStoreTestBase;
import org.jetbrains.annotations.NotNull;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

public class VectorCoreTest extends GraphStoreTestBase {

    private static final int DIMENSION = 8;

    @NotNull
    @Override
    protected GraphStoreConfig createConfig() {
        return super.createConfig().setVectorM(8).setVectorEfConstruction(64).setVectorEfSearch(128);
    }

    @Test
    public void searchIsSortedByDistance() {
        final List<Vector> vectors = insertRandom(300, "doc", 17);
        final double[] query = vectors.get(42).getData();
        final List<Vector> result = storage.computeInReadonlyTransaction(txn ->
            storage.getVectorCore().search(txn, query, 10, "doc", null));
        Assert.assertEquals(10, result.size());
        Assert.assertEquals(vectors.get(42).getId(), result.get(0).getId());
        Assert.assertEquals(0.0, result.get(0).getDistanceOrMax(), 1e-9);
        for (int i = 1; i < result.size(); ++i) {
            Assert.assertTrue(result.get(i - 1).getDistanceOrMax() <= result.get(i).getDistanceOrMax());
        }
    }

    @Test
    public void recall() {
        final List<Vector> vectors = insertRandom(300, "doc", 5);
        final Random random = new Random(11);
        int found = 0;
        for (int q = 0; q < 20; ++q) {
            final double[] query = randomVector(random);
            final Set<UUID> exact = new HashSet<>();
            vectors.stream()
                .sorted(Comparator.comparingDouble(vector -> CosineDistance.distance(query, vector.getData())))
                .limit(10)
                .forEach(vector -> exact.add(vector.getId()));
            for (final Vector vector : storage.computeInReadonlyTransaction(txn ->
                storage.getVectorCore().search(txn, query, 10, "doc", null))) {
                if (exact.contains(vector.getId())) {
                    ++found;
                }
            }
        }
        Assert.assertTrue("recall " + found / 200.0, found >= 180);
    }

    @Test
    public void searchFiltersLabelAndPredicate() {
        insertRandom(50, "doc", 1);
        final List<Vector> images = insertRandom(50, "image", 2);
        final List<Vector> result = storage.computeInReadonlyTransaction(txn ->
            storage.getVectorCore().search(txn, images.get(0).getData(), 5, "image", vector -> vector.getProperty("n") != null));
        Assert.assertFalse(result.isEmpty());
        for (final Vector vector : result) {
            Assert.assertEquals("image", vector.getLabel());
        }
        Assert.assertTrue(storage.computeInReadonlyTransaction(txn ->
            storage.getVectorCore().search(txn, images.get(0).getData(), 5, "image", vector -> false)).isEmpty());
    }

    @Test
    public void deletedVectorsAreExcluded() {
        final List<Vector> vectors = insertRandom(100, "doc", 3);
        final Vector deleted = vectors.get(7);
        storage.executeInWriteTransaction(txn -> storage.dropVector(txn, deleted.getId()));
        storage.executeInReadonlyTransaction(txn -> {
            final VectorCore core = storage.getVectorCore();
            for (final Vector vector : core.search(txn, deleted.getData(), 20, "doc", null)) {
                Assert.assertNotEquals(deleted.getId(), vector.getId());
            }
            // the record and its payload stay
            Assert.assertTrue(core.getVectorWithoutData(txn, deleted.getId()).isDeleted());
            Assert.assertArrayEquals(deleted.getData(), core.getFullVector(txn, deleted.getId()).getData(), 0.0);
            int count = 0;
            try (CursorIterator<VectorWithoutData> it = core.iterate(txn, "doc")) {
                while (it.hasNext()) {
                    Assert.assertNotEquals(deleted.getId(), it.next().getId());
                    ++count;
                }
            }
            Assert.assertEquals(99, count);
        });
    }

    @Test(expected = VectorAlreadyDeletedException.class)
    public void deleteTwice() {
        final Vector vector = insertRandom(1, "doc", 4).get(0);
        storage.executeInWriteTransaction(txn -> storage.dropVector(txn, vector.getId()));
        storage.executeInWriteTransaction(txn -> storage.dropVector(txn, vector.getId()));
    }

    @Test(expected = VectorNotFoundException.class)
    public void deleteMissing() {
        storage.executeInWriteTransaction(txn -> storage.dropVector(txn, UUID.randomUUID()));
    }

    @Test(expected = EntryPointNotFoundException.class)
    public void searchEmptyIndex() {
        storage.computeInReadonlyTransaction(txn -> storage.getVectorCore().search(txn, new double[]{1, 2}, 3, "doc", null));
    }

    @Test(expected = InvalidResultLimitException.class)
    public void negativeResultLimit() {
        insertRandom(5, "doc", 3);
        storage.computeInReadonlyTransaction(txn -> storage.getVectorCore().search(txn, new double[DIMENSION], -1, "doc", null));
    }

    @Test
    public void zeroResultLimit() {
        final List<Vector> vectors = insertRandom(5, "doc", 3);
        Assert.assertTrue(storage.computeInReadonlyTransaction(txn ->
            storage.getVectorCore().search(txn, vectors.get(0).getData(), 0, "doc", null)).isEmpty());
    }

    @Test(expected = InvalidVectorDataException.class)
    public void insertEmptyVector() {
        storage.executeInWriteTransaction(txn -> storage.getVectorCore().insert(txn, "doc", new double[0], null));
    }

    @Test
    public void linksAreBounded() {
        final List<Vector> vectors = insertRandom(200, "doc", 9);
        final HnswConfig config = storage.getVectorCore().getConfig();
        storage.executeInReadonlyTransaction(txn -> {
            for (final Vector vector : vectors) {
                for (int level = 0; level <= vector.getLevel(); ++level) {
                    Assert.assertTrue(storage.getVectorCore().getLinks(txn, vector.getId(), level).size() <= config.maxLinks(level));
                }
            }
        });
    }

    @Test
    public void updateProperties() {
        final Vector vector = insertRandom(1, "doc", 6).get(0);
        storage.executeInWriteTransaction(txn -> storage.getVectorCore().updateProperties(txn, vector.getId(), props("title", "x")));
        final VectorWithoutData loaded = storage.computeInReadonlyTransaction(txn ->
            storage.getVectorCore().getVectorWithoutData(txn, vector.getId()));
        Assert.assertEquals(Value.of("x"), loaded.getProperty("title"));
        Assert.assertEquals(vector.getLevel(), loaded.getLevel());
    }

    @NotNull
    private List<Vector> insertRandom(final int count, @NotNull final String label, final long seed) {
        final Random random = new Random(seed);
        final List<Vector> result = new ArrayList<>(count);
        storage.executeInWriteTransaction(txn -> {
            for (int i = 0; i < count; ++i) {
                result.add(storage.getVectorCore().insert(txn, label, randomVector(random), props("n", i)));
            }
        });
        return result;
    }

    @NotNull
    private static double[] randomVector(@NotNull final Random random) {
        final double[] result = new double[DIMENSION];
        for (int i = 0; i < DIMENSION; ++i) {
            result[i] = random.nextGaussian();
        }
        return result;
    }
}
