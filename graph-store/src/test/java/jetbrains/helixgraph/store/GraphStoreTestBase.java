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

import jetbrains.exodus.ConfigurationStrategy;
import jetbrains.exodus.env.Transaction;
import jetbrains.exodus.util.IOUtil;
import jetbrains.helixgraph.GraphStoreConfig;
import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.VersionInfo;
import org.jetbrains.annotations.NotNull;
import org.junit.After;
import org.junit.Before;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Opens a graph store in a fresh temporary directory before each test and deletes it after.
 */
@SuppressWarnings("ProtectedField")
public class GraphStoreTestBase {

    protected GraphStorage storage;
    protected File storeDirectory;

    @Before
    public void setUp() throws Exception {
        storeDirectory = createTempDir();
        storage = GraphStorage.open(storeDirectory, createConfig(), createVersionInfo());
    }

    @After
    public void tearDown() throws Exception {
        try {
            if (storage != null) {
                storage.close();
                storage = null;
            }
        } finally {
            IOUtil.deleteRecursively(storeDirectory);
        }
    }

    @NotNull
    protected GraphStoreConfig createConfig() {
        return new GraphStoreConfig(ConfigurationStrategy.IGNORE);
    }

    @NotNull
    protected VersionInfo createVersionInfo() {
        return VersionInfo.EMPTY;
    }

    protected void reopen() {
        reopen(createVersionInfo());
    }

    protected void reopen(@NotNull final VersionInfo versionInfo) {
        storage.close();
        storage = null;
        storage = GraphStorage.open(storeDirectory, createConfig(), versionInfo);
    }

    @NotNull
    protected List<UUID> lookup(@NotNull final Transaction txn, @NotNull final String indexName, @NotNull final Object value) {
        final List<UUID> result = new ArrayList<>();
        try (CursorIterator<UUID> ids = storage.getSecondaryIndexOrThrow(indexName).iterate(txn, Value.from(value))) {
            ids.forEachRemaining(result::add);
        }
        return result;
    }

    @NotNull
    protected static Map<String, Value> props(@NotNull final Object... keyValues) {
        final Map<String, Value> result = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            result.put((String) keyValues[i], Value.from(keyValues[i + 1]));
        }
        return result;
    }

    @NotNull
    protected static File createTempDir() {
        try {
            return Files.createTempDirectory("helixgraph-tests").toFile();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create temporary directory", e);
        }
    }
}
