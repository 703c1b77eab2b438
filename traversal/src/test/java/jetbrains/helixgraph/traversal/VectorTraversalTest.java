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
package jetbrains.helixgraph.traversal;

import jetbrains.helixgraph.EntryPointNotFoundException;
import jetbrains.helixgraph.GraphStoreConfig;
import jetbrains.helixgraph.InvalidResultLimitException;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.items.VectorWithoutData;
import org.jetbrains.annotations.NotNull;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

public class VectorTraversalTest extends TraversalTestBase {

    @NotNull
    @Override
    protected GraphStoreConfig createConfig() {
        return super.createConfig().setVectorM(8).setVectorEfConstruction(64).setVectorEfSearch(64);
    }

    @Test
    public void bruteForce() {
        final Vector v1 = insert("doc", 1, 2, 3);
        insert("doc", -1, 0, 2);
        insert("doc", 0, 0, -5);
        final List<TraversalValue> result = read(g -> g.vFromType("doc", false).bruteForceSearchV(new double[]{4, 5, 6}, 2).collect());
        Assert.assertEquals(2, result.size());
        Assert.assertEquals(v1.getId(), result.get(0).getId());
        Assert.assertEquals(0.025368153802923787, ((Vector) result.get(0)).getDistanceOrMax(), 1e-12);
        Assert.assertEquals(Value.of(0.025368153802923787), result.get(0).getProperty("distance"));
    }

    @Test
    public void searchIsAscending() {
        for (int i = 0; i < 50; ++i) {
            insert("doc", Math.cos(i * 0.1), Math.sin(i * 0.1), 0.5);
        }
        final List<TraversalValue> result = read(g -> g.searchV(new double[]{1, 0, 0.5}, 5, "doc").collect());
        Assert.assertEquals(5, result.size());
        for (int i = 1; i < result.size(); ++i) {
            Assert.assertTrue(((Vector) result.get(i - 1)).getDistanceOrMax() <= ((Vector) result.get(i)).getDistanceOrMax());
        }
    }

    @Test
    public void searchEmptyIndex() {
        final List<TraversalResult> results = read(g -> g.searchV(new double[]{1, 0}, 3, "doc").collectResults());
        Assert.assertEquals(1, results.size());
        Assert.assertTrue(results.get(0).getError() instanceof EntryPointNotFoundException);
    }

    @Test
    public void negativeResultLimitIsFailedItem() {
        insert("doc", 1, 0);
        final List<TraversalResult> searched = read(g -> g.searchV(new double[]{1, 0}, -1, "doc").collectResults());
        Assert.assertEquals(1, searched.size());
        Assert.assertTrue(searched.get(0).getError() instanceof InvalidResultLimitException);
        final List<TraversalResult> scanned = read(g -> g.vFromType("doc", false).bruteForceSearchV(new double[]{1, 0}, -1).collectResults());
        Assert.assertEquals(1, scanned.size());
        Assert.assertTrue(scanned.get(0).getError() instanceof InvalidResultLimitException);
    }

    @Test
    public void deletedVectorsAreExcluded() {
        final List<Vector> vectors = new ArrayList<>();
        for (int i = 0; i < 20; ++i) {
            vectors.add(insert("doc", i + 1, 20 - i, 1));
        }
        final UUID deleted = vectors.get(3).getId();
        Assert.assertEquals(1L, (long) write(g -> g.vFromId(deleted, false).drop()));
        final double[] query = vectors.get(3).getData();
        Assert.assertFalse(ids(read(g -> g.searchV(query, 20, "doc").collect())).contains(deleted));
        Assert.assertFalse(ids(read(g -> g.vFromType("doc", true).bruteForceSearchV(query, 20).collect())).contains(deleted));
        Assert.assertTrue(read(g -> g.vFromId(deleted, true).collect()).isEmpty());
        Assert.assertEquals(19L, (long) read(g -> g.vFromType("doc", false).count()));
        // dropping again is a no-op
        Assert.assertEquals(0L, (long) write(g -> G.writeFrom(g.getContext(), items(List.of(vectors.get(3)))).drop()));
    }

    @Test
    public void insertAndUpsert() {
        final Vector inserted = (Vector) write(g -> g.insertV("doc", new double[]{1, 2}, props("title", "a")).first());
        Assert.assertArrayEquals(new double[]{1, 2}, inserted.getData(), 0.0);
        final TraversalValue updated = write(g -> g.vFromId(inserted.getId(), false)
            .upsertV("doc", new double[]{1, 2}, props("title", "b")).first());
        Assert.assertEquals(inserted.getId(), updated.getId());
        Assert.assertEquals(Value.of("b"), read(g -> g.vFromId(inserted.getId(), false).first()).getProperty("title"));
        final TraversalValue created = write(g -> g.upsertV("doc", new double[]{3, 4}, props("title", "c")).first());
        Assert.assertNotEquals(inserted.getId(), created.getId());
        Assert.assertEquals(2L, (long) read(g -> g.vFromType("doc", false).count()));
    }

    @Test
    public void graphToVectors() {
        final Vector vector = insert("doc", 1, 1, 1);
        final Node owner = (Node) write(g -> g.addN("user", null).first());
        write(g -> g.addE("owns", null, owner.getId(), vector.getId()).collect());
        final List<TraversalValue> withoutData = read(g -> g.nFromId(owner.getId()).outVectors("owns", false).collect());
        Assert.assertTrue(withoutData.get(0) instanceof VectorWithoutData);
        final List<TraversalValue> withData = read(g -> g.nFromId(owner.getId()).outEdges("owns").toVector(true).collect());
        Assert.assertArrayEquals(new double[]{1, 1, 1}, ((Vector) withData.get(0)).getData(), 0.0);
        Assert.assertEquals(Collections.singletonList(owner.getId()),
            read(g -> ids(g.vFromId(vector.getId(), false).inNodes("owns").collect())));
    }

    @Test
    public void updateVectorProperties() {
        final Vector vector = insert("doc", 1, 0);
        write(g -> g.vFromId(vector.getId(), true).update(props("tag", "x")).collect());
        final TraversalValue loaded = read(g -> g.vFromId(vector.getId(), true).first());
        Assert.assertEquals(Value.of("x"), loaded.getProperty("tag"));
        Assert.assertArrayEquals(new double[]{1, 0}, ((Vector) loaded).getData(), 0.0);
    }

    @NotNull
    private Vector insert(@NotNull final String label, final double... data) {
        return (Vector) write(g -> g.insertV(label, data, null).first());
    }
}
