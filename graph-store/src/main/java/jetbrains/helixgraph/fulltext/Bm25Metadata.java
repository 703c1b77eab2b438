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

import jetbrains.exodus.ArrayByteIterable;
import jetbrains.exodus.ByteIterable;
import jetbrains.helixgraph.StorageException;
import jetbrains.helixgraph.store.ByteIterables;
import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;

/**
 * Corpus statistics: number of documents, average document length and the BM25 tuning parameters.
 */
public final class Bm25Metadata {

    public static final double DEFAULT_K1 = 1.2;
    public static final double DEFAULT_B = 0.75;

    public static final Bm25Metadata EMPTY = new Bm25Metadata(0, 0, DEFAULT_K1, DEFAULT_B);

    private static final int ENTRY_LENGTH = Long.BYTES + 3 * Double.BYTES;

    private final long totalDocs;
    private final double avgdl;
    private final double k1;
    private final double b;

    public Bm25Metadata(final long totalDocs, final double avgdl, final double k1, final double b) {
        this.totalDocs = totalDocs;
        this.avgdl = avgdl;
        this.k1 = k1;
        this.b = b;
    }

    public long getTotalDocs() {
        return totalDocs;
    }

    public double getAvgdl() {
        return avgdl;
    }

    public double getK1() {
        return k1;
    }

    public double getB() {
        return b;
    }

    @NotNull
    Bm25Metadata withDocumentAdded(final int docLength) {
        final long total = totalDocs + 1;
        return new Bm25Metadata(total, (avgdl * totalDocs + docLength) / total, k1, b);
    }

    @NotNull
    Bm25Metadata withDocumentRemoved(final int docLength) {
        final long total = Math.max(totalDocs - 1, 0);
        final double newAvgdl = total == 0 ? 0 : Math.max((avgdl * totalDocs - docLength) / total, 0);
        return new Bm25Metadata(total, newAvgdl, k1, b);
    }

    @NotNull
    ArrayByteIterable toEntry() {
        return new ArrayByteIterable(ByteBuffer.allocate(ENTRY_LENGTH)
            .putLong(totalDocs).putDouble(avgdl).putDouble(k1).putDouble(b).array());
    }

    @NotNull
    static Bm25Metadata fromEntry(@NotNull final ByteIterable entry) {
        final byte[] bytes = ByteIterables.toArray(entry);
        if (bytes.length != ENTRY_LENGTH) {
            throw new StorageException("Invalid BM25 metadata record of " + bytes.length + " bytes");
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new Bm25Metadata(buffer.getLong(), buffer.getDouble(), buffer.getDouble(), buffer.getDouble());
    }

    @Override
    public String toString() {
        return "Bm25Metadata{totalDocs=" + totalDocs + ", avgdl=" + avgdl + ", k1=" + k1 + ", b=" + b + '}';
    }
}
