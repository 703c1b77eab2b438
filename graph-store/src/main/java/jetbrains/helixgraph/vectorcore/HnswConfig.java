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

import jetbrains.helixgraph.GraphStoreConfig;
import org.jetbrains.annotations.NotNull;

/**
 * HNSW parameters: {@code m} links per vector on upper layers, {@code m0 = 2 * m} on layer 0, candidate list
 * sizes for insertion and search, and the level normalization factor {@code 1 / ln(m)}.
 */
public record HnswConfig(int m, int m0, int efConstruction, int efSearch, double levelFactor) {

    public static HnswConfig create(final int m, final int efConstruction, final int efSearch) {
        return new HnswConfig(m, 2 * m, efConstruction, efSearch, 1.0 / Math.log(m));
    }

    public static HnswConfig fromConfig(@NotNull final GraphStoreConfig config) {
        return create(config.getVectorM(), config.getVectorEfConstruction(), config.getVectorEfSearch());
    }

    public int maxLinks(final int level) {
        return level == 0 ? m0 : m;
    }
}
