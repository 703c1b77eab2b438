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
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Schema version descriptor: the latest format version of items per label and the chains of property
 * upgrades that bring items written with older versions up to date. Upgrades are applied on read, stored
 * items are rewritten only when they are updated.
 */
public final class VersionInfo {

    public static final byte INITIAL_VERSION = 1;

    public static final VersionInfo EMPTY = new VersionInfo(Collections.emptyMap());

    @NotNull
    private final Map<String, List<UnaryOperator<Map<String, Value>>>> upgrades;

    private VersionInfo(@NotNull final Map<String, List<UnaryOperator<Map<String, Value>>>> upgrades) {
        this.upgrades = upgrades;
    }

    public static Builder builder() {
        return new Builder();
    }

    public byte getLatestVersion(@NotNull final String label) {
        final List<UnaryOperator<Map<String, Value>>> chain = upgrades.get(label);
        return chain == null ? INITIAL_VERSION : (byte) (INITIAL_VERSION + chain.size());
    }

    /**
     * Applies upgrades of the label starting from {@code version}.
     *
     * @return upgraded properties or the same instance if the item is already of the latest version
     */
    @Nullable
    public Map<String, Value> upgradeToLatest(@NotNull final String label,
                                              final byte version,
                                              @Nullable final Map<String, Value> properties) {
        final List<UnaryOperator<Map<String, Value>>> chain = upgrades.get(label);
        if (chain == null) {
            return properties;
        }
        if (version > INITIAL_VERSION + chain.size()) {
            throw new DecodeException("Item of label " + label + " has unknown version " + version);
        }
        Map<String, Value> result = properties;
        for (int i = Math.max(version - INITIAL_VERSION, 0); i < chain.size(); ++i) {
            result = chain.get(i).apply(result == null ? new HashMap<>() : new HashMap<>(result));
        }
        return result;
    }

    public static final class Builder {

        private final Map<String, List<UnaryOperator<Map<String, Value>>>> upgrades = new HashMap<>();

        private Builder() {
        }

        /**
         * Adds an upgrade from the current latest version of the label to the next one.
         */
        public Builder addUpgrade(@NotNull final String label,
                                  @NotNull final UnaryOperator<Map<String, Value>> upgrade) {
            upgrades.computeIfAbsent(label, l -> new ArrayList<>()).add(upgrade);
            return this;
        }

        public VersionInfo build() {
            final Map<String, List<UnaryOperator<Map<String, Value>>>> result = new HashMap<>();
            upgrades.forEach((label, chain) -> result.put(label, Collections.unmodifiableList(new ArrayList<>(chain))));
            return new VersionInfo(result);
        }
    }
}
