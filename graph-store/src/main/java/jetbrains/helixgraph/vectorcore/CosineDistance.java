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

import org.jetbrains.annotations.NotNull;

/**
 * Cosine similarity mapped onto an ascending distance scale: {@code 1 - cos}, so equally directed vectors
 * are at {@linkplain #MIN_DISTANCE}, orthogonal ones at {@linkplain #ORTHOGONAL} and opposite ones at
 * {@linkplain #MAX_DISTANCE}.
 */
public final class CosineDistance {

    public static final double MIN_DISTANCE = 0.0;
    public static final double ORTHOGONAL = 1.0;
    public static final double MAX_DISTANCE = 2.0;

    private CosineDistance() {
    }

    /**
     * @throws IllegalArgumentException if dimensions of the vectors differ
     */
    public static double distance(@NotNull final double[] first, @NotNull final double[] second) {
        if (first.length != second.length) {
            throw new IllegalArgumentException("Vectors have different dimensions: " +
                first.length + " and " + second.length);
        }
        double dot = 0;
        double firstNorm = 0;
        double secondNorm = 0;
        for (int i = 0; i < first.length; ++i) {
            dot += first[i] * second[i];
            firstNorm += first[i] * first[i];
            secondNorm += second[i] * second[i];
        }
        if (firstNorm == 0 || secondNorm == 0) {
            return MAX_DISTANCE;
        }
        final double similarity = dot / (Math.sqrt(firstNorm) * Math.sqrt(secondNorm));
        return Math.min(MAX_DISTANCE, Math.max(MIN_DISTANCE, ORTHOGONAL - similarity));
    }
}
