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

import jetbrains.helixgraph.InvalidResultLimitException;
import jetbrains.helixgraph.TraversalException;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.EmptyValue;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.items.NodeWithScore;
import jetbrains.helixgraph.items.TraversalValue;
import jetbrains.helixgraph.store.FullTextIndex;
import org.jetbrains.annotations.NotNull;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class FullTextTraversalTest extends TraversalTestBase {

    private Node graphDatabases;
    private Node graphDrawing;
    private Node theorist;

    @Before
    public void addDocuments() {
        graphDatabases = article("graph databases explained");
        graphDrawing = article("graph drawing");
        article("vector search at scale");
        article("cooking pasta");
        article("travel tips");
        article("gardening");
        article("history");
        theorist = (Node) write(g -> g.addN("person", props("bio", "graph graph graph")).first());
    }

    @Test
    public void nodesWithScores() {
        final List<TraversalValue> result = read(g -> g.searchBm25("article", "graph", 10).collect());
        Assert.assertEquals(Arrays.asList(graphDrawing.getId(), graphDatabases.getId()), ids(result));
        final NodeWithScore first = (NodeWithScore) result.get(0);
        final NodeWithScore second = (NodeWithScore) result.get(1);
        Assert.assertTrue(first.getScore() > second.getScore());
        Assert.assertEquals(Value.of(first.getScore()), first.getProperty("score"));
        Assert.assertEquals(Value.of("graph drawing"), first.getProperty("title"));
        Assert.assertEquals(graphDrawing.getId(), first.getNode().getId());
    }

    @Test
    public void labelIsFilteredAfterLimit() {
        Assert.assertTrue(read(g -> g.searchBm25("article", "graph", 1).collect()).isEmpty());
        Assert.assertEquals(Collections.singletonList(theorist.getId()),
            read(g -> ids(g.searchBm25("person", "graph", 1).collect())));
    }

    @Test
    public void noMatches() {
        Assert.assertTrue(read(g -> g.searchBm25("article", "nonexistent", 10).collect()).isEmpty());
        Assert.assertTrue(read(g -> g.searchBm25("article", "graph", 0).collect()).isEmpty());
    }

    @Test
    public void negativeLimitIsFailedItem() {
        final List<TraversalResult> results = read(g -> g.searchBm25("article", "graph", -1).collectResults());
        Assert.assertEquals(1, results.size());
        Assert.assertTrue(results.get(0).getError() instanceof InvalidResultLimitException);
    }

    @Test
    public void disabledSearchIsFailedItem() {
        storage.setFullTextIndex(FullTextIndex.NONE);
        final List<TraversalResult> results = read(g -> g.searchBm25("article", "graph", 10).collectResults());
        Assert.assertEquals(1, results.size());
        Assert.assertTrue(results.get(0).getError() instanceof TraversalException);
    }

    @Test
    public void updatedNodesAreFoundByNewText() {
        write(g -> g.searchBm25("article", "pasta", 10).update(props("title", "baking bread")).collect());
        Assert.assertTrue(read(g -> g.searchBm25("article", "pasta", 10).collect()).isEmpty());
        Assert.assertEquals(1, read(g -> g.searchBm25("article", "bread", 10).collect()).size());
    }

    @Test
    public void dropFoundNodes() {
        Assert.assertEquals(1L, (long) write(g -> g.searchBm25("article", "pasta", 10).drop()));
        Assert.assertTrue(read(g -> g.searchBm25("article", "pasta", 10).collect()).isEmpty());
        Assert.assertEquals(6L, (long) read(g -> g.nFromType("article").count()));
    }

    @Test
    public void firstOrEmpty() {
        Assert.assertSame(EmptyValue.INSTANCE, read(g -> g.searchBm25("article", "nonexistent", 10).firstOrEmpty()));
        Assert.assertEquals(graphDrawing.getId(), read(g -> g.searchBm25("article", "graph", 10).firstOrEmpty()).getId());
    }

    @Test
    public void dropSkipsEmpty() {
        final long dropped = write(g -> G.writeFrom(g.getContext(), items(Arrays.asList(EmptyValue.INSTANCE, graphDatabases))).drop());
        Assert.assertEquals(1, dropped);
        Assert.assertEquals(6L, (long) read(g -> g.nFromType("article").count()));
    }

    @NotNull
    private Node article(@NotNull final String title) {
        return (Node) write(g -> g.addN("article", props("title", title)).first());
    }
}
