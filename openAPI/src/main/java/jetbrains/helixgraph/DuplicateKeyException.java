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

import org.jetbrains.annotations.NotNull;

/**
 * Violation of a unique secondary index or of a unique edge. Reported apart from {@linkplain StorageException}
 * so that the caller can reject the write.
 */
public class DuplicateKeyException extends GraphException {

    @NotNull
    private final String indexName;

    public DuplicateKeyException(@NotNull final String indexName, @NotNull final Object key) {
        super("Duplicate key in " + indexName + ": " + key);
        this.indexName = indexName;
    }

    @NotNull
    public String getIndexName() {
        return indexName;
    }
}
