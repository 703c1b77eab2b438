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

import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import jetbrains.exodus.ArrayByteIterable;
import jetbrains.exodus.ByteIterable;
import jetbrains.exodus.bindings.IntegerBinding;
import jetbrains.exodus.bindings.StringBinding;
import jetbrains.exodus.env.Cursor;
import jetbrains.exodus.env.Environment;
import jetbrains.exodus.env.Store;
import jetbrains.exodus.env.StoreConfig;
import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.Ids;
import jetbrains.helixgraph.InvalidResultLimitException;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.store.ByteIterables;
import jetbrains.helixgraph.store.DocumentScore;
import jetbrains.helixgraph.store.FullTextIndex;
import jetbrains.helixgraph.store.IdBinding;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Okapi BM25 index of node documents. The inverted index, document lengths, document frequencies of terms
 * and the corpus statistics are Xodus stores of the graph environment, so documents change in the same
 * transaction as their nodes.
 * <p>
 * A posting is the 16-byte document id followed by the term frequency in the document. Terms of each document
 * are kept in a separate store, so that a document can be deleted without its text.
 */
public final class Bm25Index implements FullTextIndex {

    private static final Logger logger = LoggerFactory.getLogger(Bm25Index.class);

    public static final String INVERTED_INDEX_STORE = "bm25_inverted_index";
    public static final String DOC_LENGTHS_STORE = "bm25_doc_lengths";
    public static final String TERM_FREQUENCIES_STORE = "bm25_term_frequencies";
    public static final String DOC_TERMS_STORE = "bm25_doc_terms";
    public static final String METADATA_STORE = "bm25_metadata";

    private static final ByteIterable METADATA_KEY = StringBinding.stringToEntry("metadata");
    private static final int POSTING_LENGTH = Ids.ID_LENGTH + Integer.BYTES;

    @NotNull
    private final Store invertedIndex;
    @NotNull
    private final Store docLengths;
    @NotNull
    private final Store termFrequencies;
    @NotNull
    private final Store docTerms;
    @NotNull
    private final Store metadata;

    public Bm25Index(@NotNull final Environment env, @NotNull final Transaction txn) {
        invertedIndex = env.openStore(INVERTED_INDEX_STORE, StoreConfig.WITH_DUPLICATES_WITH_PREFIXING, txn);
        docLengths = env.openStore(DOC_LENGTHS_STORE, StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
        termFrequencies = env.openStore(TERM_FREQUENCIES_STORE, StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
        docTerms = env.openStore(DOC_TERMS_STORE, StoreConfig.WITH_DUPLICATES_WITH_PREFIXING, txn);
        metadata = env.openStore(METADATA_STORE, StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
    }

    /**
     * Indexes the node if it has properties. Its document is its properties as {@code "name value"} pairs
     * followed by its label.
     */
    @Override
    public void addDocument(@NotNull final Transaction txn, @NotNull final Node node) {
        if (!node.getProperties().isEmpty()) {
            insertDocument(txn, node.getId(), documentText(node));
        }
    }

    @Override
    public void deleteDocument(@NotNull final Transaction txn, @NotNull final UUID nodeId) {
        removeDocument(txn, nodeId);
    }

    /**
     * Indexes the text under the id, replacing the previous document with the same id.
     */
    public void insertDocument(@NotNull final Transaction txn, @NotNull final UUID id, @NotNull final String text) {
        final ArrayByteIterable idEntry = IdBinding.idToEntry(id);
        if (docLengths.get(txn, idEntry) != null) {
            removeDocument(txn, id);
        }
        final List<String> tokens = Tokenizer.tokenize(text, true);
        final Object2IntLinkedOpenHashMap<String> frequencies = new Object2IntLinkedOpenHashMap<>();
        for (final String token : tokens) {
            frequencies.addTo(token, 1);
        }
        for (final Object2IntMap.Entry<String> entry : frequencies.object2IntEntrySet()) {
            final ArrayByteIterable term = StringBinding.stringToEntry(entry.getKey());
            invertedIndex.put(txn, term, postingToEntry(id, entry.getIntValue()));
            docTerms.put(txn, idEntry, term);
            termFrequencies.put(txn, term, IntegerBinding.intToEntry(getDocumentFrequency(txn, term) + 1));
        }
        docLengths.put(txn, idEntry, IntegerBinding.intToEntry(tokens.size()));
        metadata.put(txn, METADATA_KEY, getMetadata(txn).withDocumentAdded(tokens.size()).toEntry());
        if (logger.isTraceEnabled()) {
            logger.trace("Indexed document " + id + " of " + tokens.size() + " terms");
        }
    }

    public void updateDocument(@NotNull final Transaction txn, @NotNull final UUID id, @NotNull final String text) {
        removeDocument(txn, id);
        insertDocument(txn, id, text);
    }

    /**
     * @return {@code false} if there is no document with the id
     */
    public boolean removeDocument(@NotNull final Transaction txn, @NotNull final UUID id) {
        final ArrayByteIterable idEntry = IdBinding.idToEntry(id);
        final ByteIterable length = docLengths.get(txn, idEntry);
        if (length == null) {
            return false;
        }
        final List<ByteIterable> terms = new ArrayList<>();
        try (Cursor cursor = docTerms.openCursor(txn)) {
            if (cursor.getSearchKey(idEntry) != null) {
                do {
                    terms.add(new ArrayByteIterable(cursor.getValue()));
                } while (cursor.getNextDup());
            }
        }
        try (Cursor cursor = invertedIndex.openCursor(txn)) {
            for (final ByteIterable term : terms) {
                final ByteIterable posting = cursor.getSearchBothRange(term, idEntry);
                if (posting != null && id.equals(IdBinding.entryToId(posting))) {
                    cursor.deleteCurrent();
                }
                final int df = getDocumentFrequency(txn, term);
                if (df > 1) {
                    termFrequencies.put(txn, term, IntegerBinding.intToEntry(df - 1));
                } else {
                    termFrequencies.delete(txn, term);
                }
            }
        }
        docTerms.delete(txn, idEntry);
        docLengths.delete(txn, idEntry);
        metadata.put(txn, METADATA_KEY, getMetadata(txn).withDocumentRemoved(IntegerBinding.entryToInt(length)).toEntry());
        return true;
    }

    /**
     * Scores documents containing any term of the query. Each distinct query term counts once.
     */
    @NotNull
    @Override
    public List<DocumentScore> search(@NotNull final Transaction txn, @NotNull final String query, final int k) {
        if (k < 0) {
            throw new InvalidResultLimitException(k);
        }
        final Set<String> terms = new LinkedHashSet<>(Tokenizer.tokenize(query, true));
        if (k == 0 || terms.isEmpty()) {
            return Collections.emptyList();
        }
        final Bm25Metadata stats = getMetadata(txn);
        final Object2DoubleOpenHashMap<UUID> scores = new Object2DoubleOpenHashMap<>();
        try (Cursor cursor = invertedIndex.openCursor(txn)) {
            for (final String term : terms) {
                final ArrayByteIterable termEntry = StringBinding.stringToEntry(term);
                final int df = getDocumentFrequency(txn, termEntry);
                if (df == 0 || cursor.getSearchKey(termEntry) == null) {
                    continue;
                }
                do {
                    final byte[] posting = ByteIterables.toArray(cursor.getValue());
                    final UUID id = Ids.fromBytes(posting, 0);
                    final int tf = ByteBuffer.wrap(posting, Ids.ID_LENGTH, Integer.BYTES).getInt();
                    scores.addTo(id, score(tf, getDocumentLength(txn, id), df, stats));
                } while (cursor.getNextDup());
            }
        }
        final List<DocumentScore> result = new ArrayList<>(scores.size());
        for (final Object2DoubleMap.Entry<UUID> entry : scores.object2DoubleEntrySet()) {
            result.add(new DocumentScore(entry.getKey(), entry.getDoubleValue()));
        }
        result.sort(Comparator.comparingDouble(DocumentScore::score).reversed().thenComparing(DocumentScore::id));
        return result.size() > k ? new ArrayList<>(result.subList(0, k)) : result;
    }

    @NotNull
    public Bm25Metadata getMetadata(@NotNull final Transaction txn) {
        final ByteIterable entry = metadata.get(txn, METADATA_KEY);
        return entry == null ? Bm25Metadata.EMPTY : Bm25Metadata.fromEntry(entry);
    }

    /**
     * @return number of terms in the document, or {@code -1} if it is not indexed
     */
    public int getDocumentLength(@NotNull final Transaction txn, @NotNull final UUID id) {
        final ByteIterable entry = docLengths.get(txn, IdBinding.idToEntry(id));
        return entry == null ? -1 : IntegerBinding.entryToInt(entry);
    }

    public int getDocumentFrequency(@NotNull final Transaction txn, @NotNull final String term) {
        return getDocumentFrequency(txn, StringBinding.stringToEntry(term));
    }

    /**
     * Okapi BM25 weight of a term in a document. The idf is negative for terms found in more than half
     * of the documents. If the average document length is unknown the document's own length is used.
     */
    public static double score(final int tf, final int docLength, final long df, final long totalDocs,
                               final double avgdl, final double k1, final double b) {
        final double n = Math.max(totalDocs, 1);
        final double docFrequency = Math.max(df, 1);
        final double idf = Math.log((n - docFrequency + 0.5) / (docFrequency + 0.5));
        final double averageLength = avgdl > 0 ? avgdl : Math.max(docLength, 1);
        return idf * (tf * (k1 + 1)) / (tf + k1 * (1 - b + b * docLength / averageLength));
    }

    @NotNull
    static String documentText(@NotNull final Node node) {
        final StringBuilder result = new StringBuilder();
        for (final Map.Entry<String, Value> property : node.getProperties().entrySet()) {
            result.append(property.getKey()).append(' ').append(property.getValue()).append(' ');
        }
        return result.append(node.getLabel()).toString();
    }

    private static double score(final int tf, final int docLength, final int df, @NotNull final Bm25Metadata stats) {
        return score(tf, Math.max(docLength, 0), df, stats.getTotalDocs(), stats.getAvgdl(), stats.getK1(), stats.getB());
    }

    private int getDocumentFrequency(@NotNull final Transaction txn, @NotNull final ByteIterable term) {
        final ByteIterable entry = termFrequencies.get(txn, term);
        return entry == null ? 0 : IntegerBinding.entryToInt(entry);
    }

    @NotNull
    private static ArrayByteIterable postingToEntry(@NotNull final UUID id, final int tf) {
        return new ArrayByteIterable(ByteBuffer.allocate(POSTING_LENGTH).put(Ids.toBytes(id)).putInt(tf).array());
    }
}
