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
package jetbrains.helixgraph;

import jetbrains.exodus.AbstractConfig;
import jetbrains.exodus.ConfigurationStrategy;
import jetbrains.exodus.core.dataStructures.Pair;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Specifies settings of a graph store: HNSW parameters, declared secondary indices,
 * full-text indexing and store limits.
 * Default settings are specified by {@linkplain #DEFAULT} which is immutable. Any newly created
 * {@code GraphStoreConfig} has the same settings as {@linkplain #DEFAULT} unless they are overridden by
 * system properties.
 */
public final class GraphStoreConfig extends AbstractConfig {

    public static final GraphStoreConfig DEFAULT = new GraphStoreConfig(ConfigurationStrategy.IGNORE);

    /**
     * Maximum number of HNSW links per vector on upper layers, layer 0 allows twice as many.
     * Default value is {@code 16}.
     */
    public static final String VECTOR_M = "helixgraph.vector.m";

    /**
     * Size of candidate list while inserting vectors. Default value is {@code 128}.
     */
    public static final String VECTOR_EF_CONSTRUCTION = "helixgraph.vector.efConstruction";

    /**
     * Size of candidate list while searching vectors. Default value is {@code 768}.
     */
    public static final String VECTOR_EF_SEARCH = "helixgraph.vector.efSearch";

    /**
     * Comma separated names of node properties having secondary indices. Default value is empty.
     */
    public static final String SECONDARY_INDICES = "helixgraph.graph.secondaryIndices";

    /**
     * Comma separated subset of {@linkplain #SECONDARY_INDICES} whose values must be unique. Default value is empty.
     */
    public static final String UNIQUE_INDICES = "helixgraph.graph.uniqueIndices";

    /**
     * Maximum size of the store in gigabytes. Values {@code >= 9999} are clamped to {@code 9998}.
     * Default value is {@code 100}.
     */
    public static final String MAX_SIZE_GB = "helixgraph.store.maxSizeGb";

    /**
     * If is set to {@code true} then each commit is fsynced. Default value is {@code false}.
     */
    public static final String DURABLE_WRITE = "helixgraph.store.durableWrite";

    /**
     * If is set to {@code true} then nodes having properties are indexed for BM25 full-text search.
     * Default value is {@code true}.
     */
    public static final String FULL_TEXT_BM25 = "helixgraph.fulltext.bm25";

    public static final int MAX_SIZE_GB_LIMIT = 9998;

    public GraphStoreConfig() {
        this(ConfigurationStrategy.SYSTEM_PROPERTY);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public GraphStoreConfig(@NotNull final ConfigurationStrategy strategy) {
        super(new Pair[]{
            new Pair(VECTOR_M, 16),
            new Pair(VECTOR_EF_CONSTRUCTION, 128),
            new Pair(VECTOR_EF_SEARCH, 768),
            new Pair(SECONDARY_INDICES, ""),
            new Pair(UNIQUE_INDICES, ""),
            new Pair(MAX_SIZE_GB, 100),
            new Pair(DURABLE_WRITE, false),
            new Pair(FULL_TEXT_BM25, true)
        }, strategy);
    }

    @Override
    public GraphStoreConfig setSetting(@NotNull String key, @NotNull Object value) {
        return (GraphStoreConfig) super.setSetting(key, value);
    }

    public int getVectorM() {
        return (Integer) getSetting(VECTOR_M);
    }

    public GraphStoreConfig setVectorM(final int m) {
        if (m < 2) {
            throw new IllegalArgumentException("M should be at least 2: " + m);
        }
        return setSetting(VECTOR_M, m);
    }

    public int getVectorEfConstruction() {
        return (Integer) getSetting(VECTOR_EF_CONSTRUCTION);
    }

    public GraphStoreConfig setVectorEfConstruction(final int efConstruction) {
        if (efConstruction < 1) {
            throw new IllegalArgumentException("ef_construction should be positive: " + efConstruction);
        }
        return setSetting(VECTOR_EF_CONSTRUCTION, efConstruction);
    }

    public int getVectorEfSearch() {
        return (Integer) getSetting(VECTOR_EF_SEARCH);
    }

    public GraphStoreConfig setVectorEfSearch(final int efSearch) {
        if (efSearch < 1) {
            throw new IllegalArgumentException("ef_search should be positive: " + efSearch);
        }
        return setSetting(VECTOR_EF_SEARCH, efSearch);
    }

    @NotNull
    public Set<String> getSecondaryIndices() {
        return splitNames((String) getSetting(SECONDARY_INDICES));
    }

    public GraphStoreConfig setSecondaryIndices(@NotNull final String... names) {
        return setSetting(SECONDARY_INDICES, String.join(",", names));
    }

    @NotNull
    public Set<String> getUniqueIndices() {
        return splitNames((String) getSetting(UNIQUE_INDICES));
    }

    public GraphStoreConfig setUniqueIndices(@NotNull final String... names) {
        return setSetting(UNIQUE_INDICES, String.join(",", names));
    }

    public int getMaxSizeGb() {
        return Math.min((Integer) getSetting(MAX_SIZE_GB), MAX_SIZE_GB_LIMIT);
    }

    public GraphStoreConfig setMaxSizeGb(final int maxSizeGb) {
        if (maxSizeGb < 1) {
            throw new IllegalArgumentException("Maximum store size should be positive: " + maxSizeGb);
        }
        return setSetting(MAX_SIZE_GB, Math.min(maxSizeGb, MAX_SIZE_GB_LIMIT));
    }

    public boolean isDurableWrite() {
        return (Boolean) getSetting(DURABLE_WRITE);
    }

    public GraphStoreConfig setDurableWrite(final boolean durableWrite) {
        return setSetting(DURABLE_WRITE, durableWrite);
    }

    public boolean isFullTextBm25() {
        return (Boolean) getSetting(FULL_TEXT_BM25);
    }

    public GraphStoreConfig setFullTextBm25(final boolean enabled) {
        return setSetting(FULL_TEXT_BM25, enabled);
    }

    private static Set<String> splitNames(final String names) {
        if (StringUtils.isBlank(names)) {
            return Collections.emptySet();
        }
        final Set<String> result = new LinkedHashSet<>();
        Arrays.stream(StringUtils.split(names, ','))
            .map(String::trim)
            .filter(StringUtils::isNotEmpty)
            .forEach(result::add);
        return Collections.unmodifiableSet(result);
    }
}
