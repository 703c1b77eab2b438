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

import jetbrains.exodus.ArrayByteIterable;
import jetbrains.exodus.ByteIterable;
import jetbrains.exodus.bindings.StringBinding;
import jetbrains.exodus.env.Cursor;
import jetbrains.exodus.env.Environment;
import jetbrains.exodus.env.Store;
import jetbrains.exodus.env.StoreConfig;
import jetbrains.exodus.env.Transaction;
import jetbrains.helixgraph.EntryPointNotFoundException;
import jetbrains.helixgraph.Ids;
import jetbrains.helixgraph.InvalidResultLimitException;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.VectorAlreadyDeletedException;
import jetbrains.helixgraph.VectorNotFoundException;
import jetbrains.helixgraph.VersionInfo;
import jetbrains.helixgraph.items.Vector;
import jetbrains.helixgraph.items.VectorWithoutData;
import jetbrains.helixgraph.store.ByteIterables;
import jetbrains.helixgraph.store.CursorIterator;
import jetbrains.helixgraph.store.IdBinding;
import jetbrains.helixgraph.store.ItemBinding;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * HNSW index over vectors kept in the graph environment. Vector payloads, vector records and per-level
 * links are separate stores. Structural changes happen only in the exclusive write transaction, so the
 * index needs no locking of its own.
 */
public final class VectorCore implements HNSW {

    private static final Logger logger = LoggerFactory.getLogger(VectorCore.class);

    public static final String VECTOR_DATA_STORE = "vector_data";
    public static final String VECTOR_PROPERTIES_STORE = "vector_properties";
    public static final String LINKS_STORE = "hnsw_links";
    public static final String META_STORE = "hnsw_meta";

    private static final ByteIterable ENTRY_POINT_KEY = StringBinding.stringToEntry("entry_point");

    @NotNull
    private final HnswConfig config;
    @NotNull
    private final VersionInfo versionInfo;
    @NotNull
    private final Store vectorData;
    @NotNull
    private final Store vectorProperties;
    @NotNull
    private final Store links;
    @NotNull
    private final Store meta;
    @NotNull
    private final ByteOrder byteOrder = ByteOrder.nativeOrder();
    @NotNull
    private final UniformRandomProvider rng = RandomSource.XO_RO_SHI_RO_128_PP.create();

    public VectorCore(@NotNull final Environment env,
                      @NotNull final HnswConfig config,
                      @NotNull final VersionInfo versionInfo,
                      @NotNull final Transaction txn) {
        this.config = config;
        this.versionInfo = versionInfo;
        vectorData = env.openStore(VECTOR_DATA_STORE, StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
        vectorProperties = env.openStore(VECTOR_PROPERTIES_STORE, StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
        links = env.openStore(LINKS_STORE, StoreConfig.WITH_DUPLICATES_WITH_PREFIXING, txn);
        meta = env.openStore(META_STORE, StoreConfig.WITHOUT_DUPLICATES_WITH_PREFIXING, txn);
    }

    @NotNull
    public HnswConfig getConfig() {
        return config;
    }

    @NotNull
    public Store getVectorDataStore() {
        return vectorData;
    }

    @NotNull
    public Store getVectorPropertiesStore() {
        return vectorProperties;
    }

    @NotNull
    @Override
    public List<Vector> search(@NotNull final Transaction txn,
                               @NotNull final double[] query,
                               final int k,
                               @NotNull final String label,
                               @Nullable final Predicate<Vector> filter) {
        if (k < 0) {
            throw new InvalidResultLimitException(k);
        }
        final EntryPoint entryPoint = getEntryPoint(txn);
        if (entryPoint == null) {
            throw new EntryPointNotFoundException();
        }
        final Map<UUID, double[]> cache = new HashMap<>();
        Candidate current = new Candidate(entryPoint.id, CosineDistance.distance(query, getData(txn, entryPoint.id, cache)));
        for (int level = entryPoint.level; level > 0; --level) {
            current = searchLayer(txn, query, List.of(current), 1, level, cache).get(0);
        }
        final List<Candidate> candidates = searchLayer(txn, query, List.of(current), Math.max(config.efSearch(), k), 0, cache);
        final List<Vector> result = new ArrayList<>(k);
        for (final Candidate candidate : candidates) {
            if (result.size() >= k) {
                break;
            }
            final VectorWithoutData record = findVectorWithoutData(txn, candidate.id());
            if (record == null) {
                if (logger.isWarnEnabled()) {
                    logger.warn("Skipping vector without record: " + candidate.id());
                }
                continue;
            }
            if (record.isDeleted() || !label.equals(record.getLabel())) {
                continue;
            }
            final Vector vector = record.withData(getData(txn, candidate.id(), cache)).withDistance(candidate.distance());
            if (filter == null || filter.test(vector)) {
                result.add(vector);
            }
        }
        return result;
    }

    @NotNull
    @Override
    public Vector insert(@NotNull final Transaction txn,
                         @NotNull final String label,
                         @NotNull final double[] data,
                         @Nullable final Map<String, Value> properties) {
        VectorBinding.checkData(data);
        final UUID id = Ids.newId();
        final int level = randomLevel();
        final double[] copy = data.clone();
        final VectorWithoutData record = new VectorWithoutData(id, label, versionInfo.getLatestVersion(label),
            level, false, properties);
        vectorData.put(txn, IdBinding.idToEntry(id), VectorBinding.dataToEntry(copy, byteOrder));
        vectorProperties.put(txn, IdBinding.idToEntry(id), ItemBinding.vectorToEntry(record));

        final EntryPoint entryPoint = getEntryPoint(txn);
        if (entryPoint == null) {
            setEntryPoint(txn, new EntryPoint(id, level));
            return record.withData(copy);
        }
        final Map<UUID, double[]> cache = new HashMap<>();
        cache.put(id, copy);
        List<Candidate> current = List.of(new Candidate(entryPoint.id,
            CosineDistance.distance(copy, getData(txn, entryPoint.id, cache))));
        for (int l = entryPoint.level; l > level; --l) {
            current = searchLayer(txn, copy, current, 1, l, cache).subList(0, 1);
        }
        for (int l = Math.min(level, entryPoint.level); l >= 0; --l) {
            final List<Candidate> found = searchLayer(txn, copy, current, config.efConstruction(), l, cache);
            final int maxLinks = config.maxLinks(l);
            final List<Candidate> neighbors = selectNeighbors(txn, found, maxLinks, cache);
            setLinks(txn, id, l, neighbors);
            for (final Candidate neighbor : neighbors) {
                connect(txn, neighbor.id(), id, l, maxLinks, cache);
            }
            current = found;
        }
        if (level > entryPoint.level) {
            setEntryPoint(txn, new EntryPoint(id, level));
        }
        return record.withData(copy);
    }

    @Override
    public void delete(@NotNull final Transaction txn, @NotNull final UUID id) {
        final VectorWithoutData record = getVectorWithoutData(txn, id);
        if (record.isDeleted()) {
            throw new VectorAlreadyDeletedException(id);
        }
        vectorProperties.put(txn, IdBinding.idToEntry(id), ItemBinding.vectorToEntry(record.markDeleted()));
    }

    @NotNull
    @Override
    public Vector getFullVector(@NotNull final Transaction txn, @NotNull final UUID id) {
        final VectorWithoutData record = getVectorWithoutData(txn, id);
        final ByteIterable data = vectorData.get(txn, IdBinding.idToEntry(id));
        if (data == null) {
            throw new VectorNotFoundException(id);
        }
        return record.withData(VectorBinding.entryToData(data, byteOrder));
    }

    @NotNull
    @Override
    public VectorWithoutData getVectorWithoutData(@NotNull final Transaction txn, @NotNull final UUID id) {
        final VectorWithoutData result = findVectorWithoutData(txn, id);
        if (result == null) {
            throw new VectorNotFoundException(id);
        }
        return result;
    }

    @Nullable
    public VectorWithoutData findVectorWithoutData(@NotNull final Transaction txn, @NotNull final UUID id) {
        final ByteIterable entry = vectorProperties.get(txn, IdBinding.idToEntry(id));
        if (entry == null) {
            return null;
        }
        final VectorWithoutData vector = ItemBinding.entryToVector(id, entry);
        final Map<String, Value> properties = vector.getProperties();
        final Map<String, Value> upgraded = versionInfo.upgradeToLatest(vector.getLabel(), vector.getVersion(), properties);
        return upgraded == properties ? vector : vector.withProperties(upgraded);
    }

    public boolean exists(@NotNull final Transaction txn, @NotNull final UUID id) {
        return vectorProperties.get(txn, IdBinding.idToEntry(id)) != null;
    }

    /**
     * Replaces properties of the vector keeping its payload and position in the graph.
     */
    @NotNull
    public VectorWithoutData updateProperties(@NotNull final Transaction txn,
                                              @NotNull final UUID id,
                                              @Nullable final Map<String, Value> properties) {
        final VectorWithoutData updated = getVectorWithoutData(txn, id).withProperties(properties);
        vectorProperties.put(txn, IdBinding.idToEntry(id), ItemBinding.vectorToEntry(updated));
        return updated;
    }

    /**
     * Lazily iterates vectors of the label which are not deleted.
     */
    @NotNull
    public CursorIterator<VectorWithoutData> iterate(@NotNull final Transaction txn, @NotNull final String label) {
        return new CursorIterator<>(vectorProperties.openCursor(txn)) {
            @Nullable
            @Override
            protected VectorWithoutData fetchNext(@NotNull final Cursor cursor, final boolean first) {
                while (cursor.getNext()) {
                    if (!label.equals(ItemBinding.entryToLabel(cursor.getValue()))) {
                        continue;
                    }
                    final VectorWithoutData vector = findVectorWithoutData(txn, IdBinding.entryToId(cursor.getKey()));
                    if (vector != null && !vector.isDeleted()) {
                        return vector;
                    }
                }
                return null;
            }
        };
    }

    @NotNull
    public double[] getData(@NotNull final Transaction txn, @NotNull final UUID id) {
        final ByteIterable data = vectorData.get(txn, IdBinding.idToEntry(id));
        if (data == null) {
            throw new VectorNotFoundException(id);
        }
        return VectorBinding.entryToData(data, byteOrder);
    }

    @NotNull
    List<UUID> getLinks(@NotNull final Transaction txn, @NotNull final UUID id, final int level) {
        final List<UUID> result = new ArrayList<>();
        try (Cursor cursor = links.openCursor(txn)) {
            final ByteIterable first = cursor.getSearchKey(linksKey(id, level));
            if (first != null) {
                result.add(IdBinding.entryToId(first));
                while (cursor.getNextDup()) {
                    result.add(IdBinding.entryToId(cursor.getValue()));
                }
            }
        }
        return result;
    }

    @Nullable
    EntryPoint getEntryPoint(@NotNull final Transaction txn) {
        final ByteIterable entry = meta.get(txn, ENTRY_POINT_KEY);
        if (entry == null) {
            return null;
        }
        final ByteBuffer buffer = ByteBuffer.wrap(ByteIterables.toArray(entry));
        final byte[] id = new byte[Ids.ID_LENGTH];
        buffer.get(id);
        return new EntryPoint(Ids.fromBytes(id, 0), buffer.getInt());
    }

    private void setEntryPoint(@NotNull final Transaction txn, @NotNull final EntryPoint entryPoint) {
        final ByteBuffer buffer = ByteBuffer.allocate(Ids.ID_LENGTH + Integer.BYTES);
        buffer.put(Ids.toBytes(entryPoint.id)).putInt(entryPoint.level);
        meta.put(txn, ENTRY_POINT_KEY, new ArrayByteIterable(buffer.array()));
        if (logger.isDebugEnabled()) {
            logger.debug("HNSW entry point set to " + entryPoint.id + " at level " + entryPoint.level);
        }
    }

    private int randomLevel() {
        // nextDouble() is in [0, 1), 1 - u is in (0, 1]
        final double u = 1.0 - rng.nextDouble();
        return (int) Math.floor(-Math.log(u) * config.levelFactor());
    }

    /**
     * Bounded best-first search at one layer.
     *
     * @return up to {@code ef} closest found candidates in ascending order of distance
     */
    @NotNull
    private List<Candidate> searchLayer(@NotNull final Transaction txn,
                                        @NotNull final double[] query,
                                        @NotNull final Collection<Candidate> entryPoints,
                                        final int ef,
                                        final int level,
                                        @NotNull final Map<UUID, double[]> cache) {
        final Set<UUID> visited = new HashSet<>();
        final PriorityQueue<Candidate> candidates = new PriorityQueue<>(Candidate.NEAREST_FIRST);
        final PriorityQueue<Candidate> found = new PriorityQueue<>(Candidate.FURTHEST_FIRST);
        for (final Candidate entryPoint : entryPoints) {
            if (visited.add(entryPoint.id())) {
                candidates.add(entryPoint);
                found.add(entryPoint);
                if (found.size() > ef) {
                    found.poll();
                }
            }
        }
        while (!candidates.isEmpty()) {
            final Candidate nearest = candidates.poll();
            if (found.size() >= ef && nearest.distance() > found.peek().distance()) {
                break;
            }
            for (final UUID neighbor : getLinks(txn, nearest.id(), level)) {
                if (!visited.add(neighbor)) {
                    continue;
                }
                final double distance = CosineDistance.distance(query, getData(txn, neighbor, cache));
                if (found.size() < ef || distance < found.peek().distance()) {
                    final Candidate candidate = new Candidate(neighbor, distance);
                    candidates.add(candidate);
                    found.add(candidate);
                    if (found.size() > ef) {
                        found.poll();
                    }
                }
            }
        }
        final List<Candidate> result = new ArrayList<>(found);
        result.sort(Candidate.NEAREST_FIRST);
        return result;
    }

    /**
     * Diversity heuristic: a candidate is taken only if it is closer to the base than to any already
     * selected neighbor. Remaining slots are filled with the closest rejected candidates.
     */
    @NotNull
    private List<Candidate> selectNeighbors(@NotNull final Transaction txn,
                                            @NotNull final List<Candidate> candidates,
                                            final int maxLinks,
                                            @NotNull final Map<UUID, double[]> cache) {
        final List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Candidate.NEAREST_FIRST);
        final List<Candidate> selected = new ArrayList<>(maxLinks);
        final List<Candidate> rejected = new ArrayList<>();
        for (final Candidate candidate : sorted) {
            if (selected.size() >= maxLinks) {
                break;
            }
            final double[] data = getData(txn, candidate.id(), cache);
            boolean diverse = true;
            for (final Candidate other : selected) {
                if (CosineDistance.distance(data, getData(txn, other.id(), cache)) < candidate.distance()) {
                    diverse = false;
                    break;
                }
            }
            if (diverse) {
                selected.add(candidate);
            } else {
                rejected.add(candidate);
            }
        }
        for (int i = 0; i < rejected.size() && selected.size() < maxLinks; ++i) {
            selected.add(rejected.get(i));
        }
        return selected;
    }

    /**
     * Adds a link from {@code id} to {@code newNeighbor}, pruning the links of {@code id} if they exceed the cap.
     */
    private void connect(@NotNull final Transaction txn,
                         @NotNull final UUID id,
                         @NotNull final UUID newNeighbor,
                         final int level,
                         final int maxLinks,
                         @NotNull final Map<UUID, double[]> cache) {
        final List<UUID> current = getLinks(txn, id, level);
        if (current.contains(newNeighbor)) {
            return;
        }
        if (current.size() < maxLinks) {
            links.put(txn, linksKey(id, level), IdBinding.idToEntry(newNeighbor));
            return;
        }
        final double[] base = getData(txn, id, cache);
        final List<Candidate> candidates = new ArrayList<>(current.size() + 1);
        for (final UUID link : current) {
            candidates.add(new Candidate(link, CosineDistance.distance(base, getData(txn, link, cache))));
        }
        candidates.add(new Candidate(newNeighbor, CosineDistance.distance(base, getData(txn, newNeighbor, cache))));
        setLinks(txn, id, level, selectNeighbors(txn, candidates, maxLinks, cache));
    }

    private void setLinks(@NotNull final Transaction txn,
                          @NotNull final UUID id,
                          final int level,
                          @NotNull final List<Candidate> neighbors) {
        final ArrayByteIterable key = linksKey(id, level);
        links.delete(txn, key);
        for (final Candidate neighbor : neighbors) {
            links.put(txn, key, IdBinding.idToEntry(neighbor.id()));
        }
    }

    @NotNull
    private double[] getData(@NotNull final Transaction txn,
                             @NotNull final UUID id,
                             @NotNull final Map<UUID, double[]> cache) {
        double[] result = cache.get(id);
        if (result == null) {
            result = getData(txn, id);
            cache.put(id, result);
        }
        return result;
    }

    @NotNull
    private static ArrayByteIterable linksKey(@NotNull final UUID id, final int level) {
        final ByteBuffer buffer = ByteBuffer.allocate(Ids.ID_LENGTH + Integer.BYTES);
        buffer.put(Ids.toBytes(id)).putInt(level);
        return new ArrayByteIterable(buffer.array());
    }

    record EntryPoint(@NotNull UUID id, int level) {
    }
}
