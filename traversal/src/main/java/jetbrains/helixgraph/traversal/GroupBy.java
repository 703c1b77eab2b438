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
package jetbrains.helixgraph.traversal;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.Map;

/**
 * Result of {@code group_by}: groups keyed by the grouping values joined with {@code _}, a missing value
 * is spelled {@code null}. {@linkplain Kind#COUNT} results are meant to be reported as counts only,
 * {@linkplain Kind#GROUP} ones as grouping values with counts.
 */
public final class GroupBy {

    public enum Kind {
        GROUP,
        COUNT
    }

    @NotNull
    private final Kind kind;
    @NotNull
    private final Map<String, GroupByItem> groups;

    public GroupBy(@NotNull final Kind kind, @NotNull final Map<String, GroupByItem> groups) {
        this.kind = kind;
        this.groups = Collections.unmodifiableMap(groups);
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    @NotNull
    public Map<String, GroupByItem> getGroups() {
        return groups;
    }

    @Override
    public String toString() {
        return "GroupBy{" + kind + ", " + groups + '}';
    }
}
