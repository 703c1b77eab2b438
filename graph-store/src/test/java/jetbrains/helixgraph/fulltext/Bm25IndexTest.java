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
package jetbrains.helixgraph.fulltext;

import jetbrains.exodus.ConfigurationStrategy;
import jetbrains.exodus.env.Transaction;
import jetbrains.exodus.util.IOUtil;
import jetbrains.helixgraph.GraphStoreConfig;
import jetbrains.helixgraph.Ids;
import jetbrains.helixgraph.InvalidResultLimitException;
import jetbrains.helixgraph.TraversalException;
import jetbrains.helixgraph.VersionInfo;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.store.DocumentScore;
import jetbrains.helixgraph.store.GraphStorage;
import jetbrains.helixgraph.store.GraphStoreTestBase;
import org.jetbrains.annotations.NotNull;
import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

public class Bm25IndexTest extends GraphStoreTestBase {

    @Test
    public void insertDocument() {
        final UUID id = Ids.newId();
        storage.executeInWriteTransaction(txn -> index().insertDocument(txn, id, "The quick brown fox jumps over the lazy dog"));
        storage.executeInReadonlyTransaction(txn -> {
            Assert.assertEquals(9, index().getDocumentLength(txn, id));
            final Bm25Metadata metadata = index().getMetadata(txn);
            Assert.assertEquals(1, metadata.getTotalDocs());
            Assert.assertEquals(9.0, metadata.getAvgdl(), 1e-9);
            Assert.assertEquals(Bm25Metadata.DEFAULT_K1, metadata.getK1(), 0);
            Assert.assertEquals(Bm25Metadata.DEFAULT_B, metadata.getB(), 0);
            Assert.assertEquals(1, index().getDocumentFrequency(txn, "the"));
        });
    }

    @Test
    public void insertMultipleDocuments() {
        storage.executeInWriteTransaction(txn -> {
            index().insertDocument(txn, Ids.newId(), "machine learning algorithms");
            index().insertDocument(txn, Ids.newId(), "deep learning networks and layers");
            index().insertDocument(txn, Ids.newId(), "cooking");
        });
        storage.executeInReadonlyTransaction(txn -> {
            final Bm25Metadata metadata = index().getMetadata(txn);
            Assert.assertEquals(3, metadata.getTotalDocs());
            Assert.assertEquals((3 + 5 + 1) / 3.0, metadata.getAvgdl(), 1e-9);
            Assert.assertEquals(2, index().getDocumentFrequency(txn, "learning"));
        });
    }

    @Test
    public void emptyDocumentIsCounted() {
        final UUID id = Ids.newId();
        storage.executeInWriteTransaction(txn -> index().insertDocument(txn, id, ""));
        storage.executeInReadonlyTransaction(txn -> {
            Assert.assertEquals(0, index().getDocumentLength(txn, id));
            Assert.assertEquals(1, index().getMetadata(txn).getTotalDocs());
            Assert.assertEquals(0.0, index().getMetadata(txn).getAvgdl(), 0);
        });
    }

    @Test
    public void singleTerm() {
        final UUID[] ids = {Ids.newId(), Ids.newId(), Ids.newId()};
        storage.executeInWriteTransaction(txn -> {
            index().insertDocument(txn, ids[0], "the quick brown fox");
            index().insertDocument(txn, ids[1], "a lazy dog sleeps");
            index().insertDocument(txn, ids[2], "the fox and the hound");
            index().insertDocument(txn, Ids.newId(), "nothing relevant here");
            index().insertDocument(txn, Ids.newId(), "still nothing relevant");
        });
        final List<DocumentScore> results = search("fox", 10);
        Assert.assertEquals(new HashSet<>(Arrays.asList(ids[0], ids[2])), ids(results));
        for (final DocumentScore result : results) {
            Assert.assertTrue(result.score() > 0);
        }
    }

    @Test
    public void termFrequencyRanksFirst() {
        final UUID often = Ids.newId();
        final UUID once = Ids.newId();
        storage.executeInWriteTransaction(txn -> {
            index().insertDocument(txn, often, "fox fox fox bird");
            index().insertDocument(txn, once, "fox cat dog bird");
            index().insertDocument(txn, Ids.newId(), "cat dog bird");
            index().insertDocument(txn, Ids.newId(), "cow pig hen");
            index().insertDocument(txn, Ids.newId(), "owl bat elk");
        });
        final List<DocumentScore> results = search("fox", 10);
        Assert.assertEquals(2, results.size());
        Assert.assertEquals(often, results.get(0).id());
        Assert.assertEquals(once, results.get(1).id());
        Assert.assertTrue(results.get(0).score() > results.get(1).score());
    }

    @Test
    public void multipleTerms() {
        final UUID[] ids = {Ids.newId(), Ids.newId(), Ids.newId()};
        storage.executeInWriteTransaction(txn -> {
            index().insertDocument(txn, ids[0], "machine learning");
            index().insertDocument(txn, ids[1], "machine tools");
            index().insertDocument(txn, ids[2], "learning to cook");
            index().insertDocument(txn, Ids.newId(), "gardening tips");
            index().insertDocument(txn, Ids.newId(), "gardening tools");
        });
        Assert.assertEquals(new HashSet<>(Arrays.asList(ids)), ids(search("Machine LEARNING", 10)));
    }

    @Test
    public void searchWithLimit() {
        storage.executeInWriteTransaction(txn -> {
            for (int i = 1; i <= 10; ++i) {
                index().insertDocument(txn, Ids.newId(), "document " + i + " contains test content" + (i % 3 == 0 ? " test" : ""));
            }
        });
        final List<DocumentScore> results = search("test", 5);
        Assert.assertEquals(5, results.size());
        for (int i = 1; i < results.size(); ++i) {
            Assert.assertTrue(results.get(i - 1).score() >= results.get(i).score());
        }
    }

    @Test
    public void noResults() {
        storage.executeInWriteTransaction(txn -> index().insertDocument(txn, Ids.newId(), "some document content"));
        Assert.assertTrue(search("nonexistent", 10).isEmpty());
        Assert.assertTrue(search("!!", 10).isEmpty());
        Assert.assertTrue(search("content", 0).isEmpty());
    }

    @Test(expected = InvalidResultLimitException.class)
    public void negativeLimit() {
        search("content", -1);
    }

    @Test
    public void deleteDocument() {
        final UUID two = Ids.newId();
        storage.executeInWriteTransaction(txn -> {
            index().insertDocument(txn, Ids.newId(), "document one content");
            index().insertDocument(txn, two, "document two content");
            index().insertDocument(txn, Ids.newId(), "document three content words");
            Assert.assertTrue(index().removeDocument(txn, two));
            Assert.assertFalse(index().removeDocument(txn, two));
        });
        storage.executeInReadonlyTransaction(txn -> {
            Assert.assertEquals(-1, index().getDocumentLength(txn, two));
            Assert.assertEquals(2, index().getMetadata(txn).getTotalDocs());
            Assert.assertEquals(3.5, index().getMetadata(txn).getAvgdl(), 1e-9);
            Assert.assertEquals(2, index().getDocumentFrequency(txn, "document"));
            Assert.assertEquals(0, index().getDocumentFrequency(txn, "two"));
        });
        Assert.assertTrue(search("two", 10).isEmpty());
        Assert.assertEquals(2, search("document", 10).size());
    }

    @Test
    public void deletingLastDocumentResetsAverage() {
        final UUID id = Ids.newId();
        storage.executeInWriteTransaction(txn -> {
            index().insertDocument(txn, id, "lonely document");
            index().removeDocument(txn, id);
        });
        storage.executeInReadonlyTransaction(txn -> {
            Assert.assertEquals(0, index().getMetadata(txn).getTotalDocs());
            Assert.assertEquals(0.0, index().getMetadata(txn).getAvgdl(), 0);
        });
    }

    @Test
    public void updateDocument() {
        final UUID id = Ids.newId();
        storage.executeInWriteTransaction(txn -> {
            index().insertDocument(txn, id, "original content");
            index().updateDocument(txn, id, "updated content with more words");
            Assert.assertEquals(5, index().getDocumentLength(txn, id));
            Assert.assertEquals(1, index().getMetadata(txn).getTotalDocs());
        });
        final List<DocumentScore> results = search("updated", 10);
        Assert.assertEquals(1, results.size());
        Assert.assertEquals(id, results.get(0).id());
        Assert.assertTrue(search("original", 10).isEmpty());
    }

    @Test
    public void score() {
        final double rare = Bm25Index.score(2, 10, 3, 100, 8.0, Bm25Metadata.DEFAULT_K1, Bm25Metadata.DEFAULT_B);
        final double common = Bm25Index.score(2, 10, 30, 100, 8.0, Bm25Metadata.DEFAULT_K1, Bm25Metadata.DEFAULT_B);
        Assert.assertTrue(Double.isFinite(rare));
        Assert.assertTrue(rare > common);
        Assert.assertTrue(common > 0);
        // a term found in most documents weighs negatively
        Assert.assertTrue(Bm25Index.score(2, 10, 90, 100, 8.0, Bm25Metadata.DEFAULT_K1, Bm25Metadata.DEFAULT_B) < 0);
        // unknown average length falls back to the document length
        Assert.assertTrue(Double.isFinite(Bm25Index.score(1, 4, 1, 10, 0, Bm25Metadata.DEFAULT_K1, Bm25Metadata.DEFAULT_B)));
    }

    @Test
    public void nodesAreIndexed() {
        final Node john = storage.computeInWriteTransaction(txn -> storage.addNode(txn, "person", props("name", "John", "city", "Amsterdam")));
        final Node bare = storage.computeInWriteTransaction(txn -> storage.addNode(txn, "person", null));
        storage.executeInReadonlyTransaction(txn -> {
            // name John city Amsterdam person
            Assert.assertEquals(5, index().getDocumentLength(txn, john.getId()));
            Assert.assertEquals(-1, index().getDocumentLength(txn, bare.getId()));
        });
        Assert.assertEquals(Set.of(john.getId()), ids(search("john", 10)));
        Assert.assertEquals(Set.of(john.getId()), ids(search("person", 10)));

        storage.executeInWriteTransaction(txn -> storage.updateNode(txn, john, props("city", "Berlin")));
        Assert.assertTrue(search("amsterdam", 10).isEmpty());
        Assert.assertEquals(Set.of(john.getId()), ids(search("berlin", 10)));
        storage.executeInReadonlyTransaction(txn -> Assert.assertEquals(1, index().getMetadata(txn).getTotalDocs()));

        storage.executeInWriteTransaction(txn -> storage.dropNode(txn, john.getId()));
        Assert.assertTrue(search("john", 10).isEmpty());
        storage.executeInReadonlyTransaction(txn -> Assert.assertEquals(0, index().getMetadata(txn).getTotalDocs()));
    }

    @Test
    public void abortedTransactionLeavesNoDocuments() {
        final Transaction txn = storage.beginWriteTransaction();
        try {
            storage.addNode(txn, "person", props("name", "Ghost"));
        } finally {
            txn.abort();
        }
        Assert.assertTrue(search("ghost", 10).isEmpty());
        storage.executeInReadonlyTransaction(t -> Assert.assertEquals(0, index().getMetadata(t).getTotalDocs()));
    }

    @Test
    public void documentsSurviveReopen() {
        final Node node = storage.computeInWriteTransaction(txn -> storage.addNode(txn, "person", props("name", "Persistent")));
        reopen();
        Assert.assertEquals(Set.of(node.getId()), ids(search("persistent", 10)));
    }

    @Test
    public void disabled() {
        final File dir = createTempDir();
        try (GraphStorage plain = GraphStorage.open(dir,
            new GraphStoreConfig(ConfigurationStrategy.IGNORE).setFullTextBm25(false), VersionInfo.EMPTY)) {
            Assert.assertFalse(plain.getFullTextIndex() instanceof Bm25Index);
            plain.executeInWriteTransaction(txn -> plain.addNode(txn, "person", props("name", "John")));
            plain.executeInReadonlyTransaction(txn -> {
                try {
                    plain.getFullTextIndex().search(txn, "john", 10);
                    Assert.fail();
                } catch (TraversalException expected) {
                    Assert.assertTrue(expected.getMessage().contains("not enabled"));
                }
            });
        } finally {
            IOUtil.deleteRecursively(dir);
        }
    }

    @NotNull
    private Bm25Index index() {
        return (Bm25Index) storage.getFullTextIndex();
    }

    @NotNull
    private List<DocumentScore> search(@NotNull final String query, final int k) {
        return storage.computeInReadonlyTransaction(txn -> index().search(txn, query, k));
    }

    @NotNull
    private static Set<UUID> ids(@NotNull final List<DocumentScore> scores) {
        return scores.stream().map(DocumentScore::id).collect(Collectors.toSet());
    }
}
