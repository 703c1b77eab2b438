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

import jetbrains.exodus.ByteIterable;
import jetbrains.exodus.env.Cursor;
import jetbrains.exodus.env.Environment;
import jetbrains.exodus.env.EnvironmentConfig;
import jetbrains.exodus.env.Environments;
import jetbrains.exodus.env.Store;
import jetbrains.exodus.env.StoreConfig;
import jetbrains.exodus.env.Transaction;
import jetbrains.exodus.env.TransactionalComputable;
import jetbrains.exodus.env.TransactionalExecutable;
import jetbrains.helixgraph.DuplicateKeyException;
import jetbrains.helixgraph.EdgeNotFoundException;
import jetbrains.helixgraph.GraphStoreConfig;
import jetbrains.helixgraph.Ids;
import jetbrains.helixgraph.NodeNotFoundException;
import jetbrains.helixgraph.TraversalException;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.VersionInfo;
import jetbrains.helixgraph.fulltext.Bm25Index;
import jetbrains.helixgraph.items.Edge;
import jetbrains.helixgraph.items.Node;
import jetbrains.helixgraph.items.PropertyHolder;
import jetbrains.helixgraph.vectorcore.HnswConfig;
import jetbrains.helixgraph.vectorcore.VectorCore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persistent storage core: nodes, edges, both directions of adjacency, secondary indices, the vector index,
 * the BM25 full-text index and the format metadata, all in one Xodus environment. Write operations require
 * the write transaction ({@linkplain #beginWriteTransaction()}), there is at most one at a time. Any number
 * of read transactions see their own snapshots.
 */
public final class GraphStorage implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GraphStorage.class);

    public static final String NODES_STORE = "nodes";
    public static final String EDGES_STORE = "edges";
    public static final String OUT_EDGES_STORE = "out_edges";
    public static final String IN_EDGES_STORE = "in_edges";

    private static final String UNIQUE_EDGE_INDEX_PREFIX = "edge:";

    @NotNull
    private final Environment env;
    @NotNull
    private final GraphStoreConfig config;
    @NotNull
    private final VersionInfo versionInfo;
    @NotNull
    private final Store nodes;
    @NotNull
    private final Store edges;
    @NotNull
    private final AdjacencyTable outEdges;
    @NotNull
    private final AdjacencyTable inEdges;
    @NotNull
    private final StorageMetadata metadata;
    @NotNull
    private final VectorCore vectorCore;
    @NotNull
    private final Map<String, SecondaryIndex> secondaryIndices = new ConcurrentHashMap<>();
    // indices created or dropped (null) in the write transaction, applied to the above on its commit
    @NotNull
    private final Map<String, SecondaryIndex> stagedIndices = new LinkedHashMap<>();
    @Nullable
    private volatile Transaction stagingTxn;
    @NotNull
    private volatile FullTextIndex fullTextIndex = FullTextIndex.NONE;

    private GraphStorage(@NotNull final Environment env,
                         @NotNull final GraphStoreConfig config,
                         @NotNull final VersionInfo versionInfo) {
        this.env = env;
        this.config = config;
        this.versionInfo = versionInfo;
        final Transaction txn = env.beginExclusiveTransaction();
        try {
            nodes = env.openStore(NODES_STORE, StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
            edges = env.openStore(EDGES_STORE, StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
            outEdges = new AdjacencyTable(env, OUT_EDGES_STORE, txn);
            inEdges = new AdjacencyTable(env, IN_EDGES_STORE, txn);
            metadata = new StorageMetadata(env, txn);
            vectorCore = new VectorCore(env, HnswConfig.fromConfig(config), versionInfo, txn);
            final Set<String> unique = config.getUniqueIndices();
            for (final String name : config.getSecondaryIndices()) {
                secondaryIndices.put(name, new SecondaryIndex(env, name, unique.contains(name), txn));
            }
            if (config.isFullTextBm25()) {
                fullTextIndex = new Bm25Index(env, txn);
            }
            txn.commit();
        } finally {
            if (!txn.isFinished()) {
                txn.abort();
            }
        }
    }

    /**
     * Opens a store in the directory, creating it if necessary, and migrates its format if it is outdated.
     */
    @NotNull
    public static GraphStorage open(@NotNull final File dir,
                                    @NotNull final GraphStoreConfig config,
                                    @NotNull final VersionInfo versionInfo) {
        final EnvironmentConfig envConfig = new EnvironmentConfig()
            .setLogDurableWrite(config.isDurableWrite())
            .setEnvCloseForcedly(true);
        final Environment env = Environments.newInstance(dir, envConfig);
        try {
            final GraphStorage result = new GraphStorage(env, config, versionInfo);
            new StorageMigration(result).migrate();
            if (logger.isInfoEnabled()) {
                logger.info("Opened graph store at " + dir + ", maximum size " + config.getMaxSizeGb() + " GB, " +
                    "secondary indices " + result.secondaryIndices.keySet() + ", BM25 " + (config.isFullTextBm25() ? "on" : "off"));
            }
            return result;
        } catch (RuntimeException e) {
            env.close();
            throw e;
        }
    }

    @NotNull
    public static GraphStorage open(@NotNull final File dir) {
        return open(dir, new GraphStoreConfig(), VersionInfo.EMPTY);
    }

    @NotNull
    public Environment getEnvironment() {
        return env;
    }

    @NotNull
    public String getLocation() {
        return env.getLocation();
    }

    @NotNull
    public GraphStoreConfig getConfig() {
        return config;
    }

    @NotNull
    public VersionInfo getVersionInfo() {
        return versionInfo;
    }

    @NotNull
    public VectorCore getVectorCore() {
        return vectorCore;
    }

    @NotNull
    public AdjacencyTable getOutEdges() {
        return outEdges;
    }

    @NotNull
    public AdjacencyTable getInEdges() {
        return inEdges;
    }

    @NotNull
    StorageMetadata getMetadata() {
        return metadata;
    }

    @NotNull
    public FullTextIndex getFullTextIndex() {
        return fullTextIndex;
    }

    public void setFullTextIndex(@NotNull final FullTextIndex fullTextIndex) {
        this.fullTextIndex = fullTextIndex;
    }

    @NotNull
    public Transaction beginReadonlyTransaction() {
        return env.beginReadonlyTransaction();
    }

    /**
     * Begins the exclusive write transaction, blocking while another one is in progress.
     */
    @NotNull
    public Transaction beginWriteTransaction() {
        return env.beginExclusiveTransaction();
    }

    public <T> T computeInReadonlyTransaction(@NotNull final TransactionalComputable<T> computable) {
        return env.computeInReadonlyTransaction(computable);
    }

    public void executeInReadonlyTransaction(@NotNull final TransactionalExecutable executable) {
        env.executeInReadonlyTransaction(executable);
    }

    public <T> T computeInWriteTransaction(@NotNull final TransactionalComputable<T> computable) {
        return env.computeInExclusiveTransaction(computable);
    }

    public void executeInWriteTransaction(@NotNull final TransactionalExecutable executable) {
        env.executeInExclusiveTransaction(executable);
    }

    // nodes

    @Nullable
    public Node findNode(@NotNull final Transaction txn, @NotNull final UUID id) {
        final ByteIterable entry = nodes.get(txn, IdBinding.idToEntry(id));
        return entry == null ? null : upgrade(ItemBinding.entryToNode(id, entry));
    }

    @NotNull
    public Node getNode(@NotNull final Transaction txn, @NotNull final UUID id) {
        final Node result = findNode(txn, id);
        if (result == null) {
            throw new NodeNotFoundException(id);
        }
        return result;
    }

    public boolean nodeExists(@NotNull final Transaction txn, @NotNull final UUID id) {
        return nodes.get(txn, IdBinding.idToEntry(id)) != null;
    }

    /**
     * Creates a node and puts it to secondary indices declared for its properties.
     *
     * @throws DuplicateKeyException if a unique index already has the value
     */
    @NotNull
    public Node addNode(@NotNull final Transaction txn,
                        @NotNull final String label,
                        @Nullable final Map<String, Value> properties) {
        final Node node = new Node(Ids.newId(), label, versionInfo.getLatestVersion(label), properties);
        final Collection<SecondaryIndex> indices = indicesOf(txn).values();
        for (final SecondaryIndex index : indices) {
            final Value value = node.getProperty(index.getName());
            if (value != null && !value.isEmpty()) {
                index.checkUnique(txn, value, node.getId());
            }
        }
        for (final SecondaryIndex index : indices) {
            final Value value = node.getProperty(index.getName());
            if (value != null && !value.isEmpty()) {
                index.put(txn, value, node.getId());
            }
        }
        putNode(txn, node);
        fullTextIndex.addDocument(txn, node);
        return node;
    }

    /**
     * Merges {@code changes} into properties of the node, moving its entries in secondary indices
     * of changed properties.
     */
    @NotNull
    public Node updateNode(@NotNull final Transaction txn,
                           @NotNull final Node node,
                           @NotNull final Map<String, Value> changes) {
        final Map<String, SecondaryIndex> indices = indicesOf(txn);
        for (final Map.Entry<String, Value> change : changes.entrySet()) {
            final SecondaryIndex index = indices.get(change.getKey());
            if (index != null && !change.getValue().isEmpty()) {
                index.checkUnique(txn, change.getValue(), node.getId());
            }
        }
        final Map<String, Value> properties = new LinkedHashMap<>(node.getProperties());
        for (final Map.Entry<String, Value> change : changes.entrySet()) {
            final String name = change.getKey();
            final Value newValue = change.getValue();
            final SecondaryIndex index = indices.get(name);
            if (index != null) {
                final Value oldValue = properties.get(name);
                if (oldValue != null && !oldValue.isEmpty()) {
                    index.delete(txn, oldValue, node.getId());
                }
                if (!newValue.isEmpty()) {
                    index.put(txn, newValue, node.getId());
                }
            }
            properties.put(name, newValue);
        }
        final Node result = new Node(node.getId(), node.getLabel(), versionInfo.getLatestVersion(node.getLabel()), properties);
        putNode(txn, result);
        fullTextIndex.deleteDocument(txn, node.getId());
        fullTextIndex.addDocument(txn, result);
        return result;
    }

    /**
     * Removes the node, all edges adjacent to it in both directions, its secondary index entries and its
     * full-text document.
     */
    public void dropNode(@NotNull final Transaction txn, @NotNull final UUID id) {
        final Node node = getNode(txn, id);
        for (final AdjacencyTable.AdjacencyRecord out : outEdges.collectAll(txn, id)) {
            final AdjacencyEntry entry = out.entry();
            edges.delete(txn, IdBinding.idToEntry(entry.edgeId()));
            inEdges.delete(txn, entry.otherId(), out.labelHash(), new AdjacencyEntry(entry.edgeId(), id));
            outEdges.delete(txn, id, out.labelHash(), entry);
        }
        // collected after outgoing ones, so self-loops are already gone
        for (final AdjacencyTable.AdjacencyRecord in : inEdges.collectAll(txn, id)) {
            final AdjacencyEntry entry = in.entry();
            edges.delete(txn, IdBinding.idToEntry(entry.edgeId()));
            outEdges.delete(txn, entry.otherId(), in.labelHash(), new AdjacencyEntry(entry.edgeId(), id));
            inEdges.delete(txn, id, in.labelHash(), entry);
        }
        for (final SecondaryIndex index : indicesOf(txn).values()) {
            final Value value = node.getProperty(index.getName());
            if (value != null && !value.isEmpty()) {
                index.delete(txn, value, id);
            }
        }
        fullTextIndex.deleteDocument(txn, id);
        nodes.delete(txn, IdBinding.idToEntry(id));
    }

    /**
     * Lazily iterates nodes in creation order, only of the label if it is not {@code null}.
     */
    @NotNull
    public CursorIterator<Node> iterateNodes(@NotNull final Transaction txn, @Nullable final String label) {
        return new CursorIterator<>(nodes.openCursor(txn)) {
            @Nullable
            @Override
            protected Node fetchNext(@NotNull final Cursor cursor, final boolean first) {
                while (cursor.getNext()) {
                    final ByteIterable value = cursor.getValue();
                    if (label == null || label.equals(ItemBinding.entryToLabel(value))) {
                        return upgrade(ItemBinding.entryToNode(IdBinding.entryToId(cursor.getKey()), value));
                    }
                }
                return null;
            }
        };
    }

    // edges

    @Nullable
    public Edge findEdge(@NotNull final Transaction txn, @NotNull final UUID id) {
        final ByteIterable entry = edges.get(txn, IdBinding.idToEntry(id));
        return entry == null ? null : upgrade(ItemBinding.entryToEdge(id, entry));
    }

    @NotNull
    public Edge getEdge(@NotNull final Transaction txn, @NotNull final UUID id) {
        final Edge result = findEdge(txn, id);
        if (result == null) {
            throw new EdgeNotFoundException(id);
        }
        return result;
    }

    public boolean edgeExists(@NotNull final Transaction txn, @NotNull final UUID id) {
        return edges.get(txn, IdBinding.idToEntry(id)) != null;
    }

    /**
     * Creates an edge and its adjacency entries. Endpoints are not checked, they may be nodes or vectors.
     *
     * @param unique if {@code true} then the source may have only one outgoing edge of the label
     * @throws DuplicateKeyException if {@code unique} and the source already has an edge of the label
     */
    @NotNull
    public Edge addEdge(@NotNull final Transaction txn,
                        @NotNull final String label,
                        @Nullable final Map<String, Value> properties,
                        @NotNull final UUID from,
                        @NotNull final UUID to,
                        final boolean unique) {
        final int labelHash = AdjacencyKey.labelHash(label);
        if (unique && outEdges.hasAny(txn, from, labelHash)) {
            throw new DuplicateKeyException(UNIQUE_EDGE_INDEX_PREFIX + label, from);
        }
        final Edge edge = new Edge(Ids.newId(), label, versionInfo.getLatestVersion(label), from, to, properties);
        putEdge(txn, edge);
        outEdges.put(txn, from, labelHash, new AdjacencyEntry(edge.getId(), to));
        inEdges.put(txn, to, labelHash, new AdjacencyEntry(edge.getId(), from));
        return edge;
    }

    @NotNull
    public Edge updateEdge(@NotNull final Transaction txn,
                           @NotNull final Edge edge,
                           @NotNull final Map<String, Value> changes) {
        final Map<String, Value> properties = new LinkedHashMap<>(edge.getProperties());
        properties.putAll(changes);
        final Edge result = new Edge(edge.getId(), edge.getLabel(), versionInfo.getLatestVersion(edge.getLabel()),
            edge.getFromNode(), edge.getToNode(), properties);
        putEdge(txn, result);
        return result;
    }

    /**
     * Removes the edge and its two adjacency entries.
     */
    public void dropEdge(@NotNull final Transaction txn, @NotNull final UUID id) {
        final Edge edge = getEdge(txn, id);
        final int labelHash = AdjacencyKey.labelHash(edge.getLabel());
        edges.delete(txn, IdBinding.idToEntry(id));
        outEdges.delete(txn, edge.getFromNode(), labelHash, new AdjacencyEntry(id, edge.getToNode()));
        inEdges.delete(txn, edge.getToNode(), labelHash, new AdjacencyEntry(id, edge.getFromNode()));
    }

    @NotNull
    public CursorIterator<Edge> iterateEdges(@NotNull final Transaction txn, @Nullable final String label) {
        return new CursorIterator<>(edges.openCursor(txn)) {
            @Nullable
            @Override
            protected Edge fetchNext(@NotNull final Cursor cursor, final boolean first) {
                while (cursor.getNext()) {
                    final ByteIterable value = cursor.getValue();
                    if (label == null || label.equals(ItemBinding.entryToLabel(value))) {
                        return upgrade(ItemBinding.entryToEdge(IdBinding.entryToId(cursor.getKey()), value));
                    }
                }
                return null;
            }
        };
    }

    // vectors

    /**
     * Loads the vector, deleted ones included. The payload is read only if {@code withData}.
     *
     * @throws jetbrains.helixgraph.VectorNotFoundException if there is no such vector
     */
    @NotNull
    public PropertyHolder getVector(@NotNull final Transaction txn, @NotNull final UUID id, final boolean withData) {
        return withData ? vectorCore.getFullVector(txn, id) : vectorCore.getVectorWithoutData(txn, id);
    }

    /**
     * Soft-deletes the vector. Its record, payload and links in the vector index are kept.
     */
    public void dropVector(@NotNull final Transaction txn, @NotNull final UUID id) {
        vectorCore.delete(txn, id);
    }

    // secondary indices

    @Nullable
    public SecondaryIndex getSecondaryIndex(@NotNull final String name) {
        return secondaryIndices.get(name);
    }

    /**
     * Also sees indices created or dropped earlier in the transaction.
     */
    @Nullable
    public SecondaryIndex getSecondaryIndex(@NotNull final Transaction txn, @NotNull final String name) {
        return indicesOf(txn).get(name);
    }

    @NotNull
    public SecondaryIndex getSecondaryIndexOrThrow(@NotNull final String name) {
        final SecondaryIndex result = secondaryIndices.get(name);
        if (result == null) {
            throw new TraversalException("Secondary index is not declared: " + name);
        }
        return result;
    }

    @NotNull
    public Set<String> getSecondaryIndexNames() {
        return Collections.unmodifiableSet(secondaryIndices.keySet());
    }

    /**
     * Creates the index in the write transaction and fills it from existing nodes. Other transactions see
     * the index once the transaction is committed.
     *
     * @throws DuplicateKeyException if the index is unique and existing nodes violate it
     */
    @NotNull
    public SecondaryIndex createSecondaryIndex(@NotNull final Transaction txn,
                                               @NotNull final String name,
                                               final boolean unique) {
        final SecondaryIndex existing = indicesOf(txn).get(name);
        if (existing != null) {
            return existing;
        }
        final SecondaryIndex result = new SecondaryIndex(env, name, unique, txn);
        try (CursorIterator<Node> it = iterateNodes(txn, null)) {
            while (it.hasNext()) {
                final Node node = it.next();
                final Value value = node.getProperty(name);
                if (value != null && !value.isEmpty()) {
                    result.put(txn, value, node.getId());
                }
            }
        }
        stageIndex(txn, name, result);
        if (logger.isInfoEnabled()) {
            logger.info("Created " + result);
        }
        return result;
    }

    @NotNull
    public SecondaryIndex createSecondaryIndex(@NotNull final String name, final boolean unique) {
        return computeInWriteTransaction(txn -> createSecondaryIndex(txn, name, unique));
    }

    /**
     * Removes the index store in the write transaction. Other transactions stop seeing the index once the
     * transaction is committed.
     */
    public void dropSecondaryIndex(@NotNull final Transaction txn, @NotNull final String name) {
        final SecondaryIndex index = indicesOf(txn).get(name);
        if (index == null) {
            throw new TraversalException("Secondary index is not declared: " + name);
        }
        env.removeStore(SecondaryIndex.storeName(name), txn);
        stageIndex(txn, name, null);
        if (logger.isInfoEnabled()) {
            logger.info("Dropped " + index);
        }
    }

    public void dropSecondaryIndex(@NotNull final String name) {
        executeInWriteTransaction(txn -> dropSecondaryIndex(txn, name));
    }

    @Override
    public void close() {
        env.close();
        if (logger.isInfoEnabled()) {
            logger.info("Closed graph store at " + env.getLocation());
        }
    }

    @NotNull
    private Map<String, SecondaryIndex> indicesOf(@NotNull final Transaction txn) {
        if (txn != stagingTxn || stagedIndices.isEmpty()) {
            return secondaryIndices;
        }
        final Map<String, SecondaryIndex> result = new LinkedHashMap<>(secondaryIndices);
        applyStaged(result);
        return result;
    }

    private void stageIndex(@NotNull final Transaction txn, @NotNull final String name, @Nullable final SecondaryIndex index) {
        if (txn != stagingTxn) {
            // changes staged by an aborted transaction
            stagedIndices.clear();
            stagingTxn = txn;
            txn.setCommitHook(() -> {
                applyStaged(secondaryIndices);
                stagedIndices.clear();
                stagingTxn = null;
            });
        }
        stagedIndices.put(name, index);
    }

    private void applyStaged(@NotNull final Map<String, SecondaryIndex> target) {
        for (final Map.Entry<String, SecondaryIndex> staged : stagedIndices.entrySet()) {
            if (staged.getValue() == null) {
                target.remove(staged.getKey());
            } else {
                target.put(staged.getKey(), staged.getValue());
            }
        }
    }

    private void putNode(@NotNull final Transaction txn, @NotNull final Node node) {
        nodes.put(txn, IdBinding.idToEntry(node.getId()),
            ItemBinding.nodeToEntry(node.getLabel(), node.getVersion(), node.getProperties()));
    }

    private void putEdge(@NotNull final Transaction txn, @NotNull final Edge edge) {
        edges.put(txn, IdBinding.idToEntry(edge.getId()), ItemBinding.edgeToEntry(edge.getLabel(),
            edge.getVersion(), edge.getFromNode(), edge.getToNode(), edge.getProperties()));
    }

    @NotNull
    private Node upgrade(@NotNull final Node node) {
        final Map<String, Value> properties = node.getProperties();
        final Map<String, Value> upgraded = versionInfo.upgradeToLatest(node.getLabel(), node.getVersion(), properties);
        return upgraded == properties ? node : node.withProperties(upgraded);
    }

    @NotNull
    private Edge upgrade(@NotNull final Edge edge) {
        final Map<String, Value> properties = edge.getProperties();
        final Map<String, Value> upgraded = versionInfo.upgradeToLatest(edge.getLabel(), edge.getVersion(), properties);
        return upgraded == properties ? edge : edge.withProperties(upgraded);
    }
}
