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

import jetbrains.helixgraph.Value;
import jetbrains.helixgraph.items.TraversalValue;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

final class Grouping {

    private Grouping() {
    }

    @NotNull
    static Map<String, Value> values(@NotNull final TraversalValue item, @NotNull final List<String> properties) {
        final Map<String, Value> result = new LinkedHashMap<>();
        for (final String property : properties) {
            final Value value = item.getProperty(property);
            result.put(property, value == null ? Value.EMPTY : value);
        }
        return result;
    }

    @NotNull
    static String key(@NotNull final Map<String, Value> values) {
        final StringJoiner result = new StringJoiner("_");
        for (final Value value : values.values()) {
            result.add(value.toString());
        }
        return result.toString();
    }

    @NotNull
    static Map<String, AggregateItem> aggregate(@NotNull final List<TraversalValue> items,
                                                @NotNull final List<String> properties) {
        final Map<String, Map<String, Value>> keys = new LinkedHashMap<>();
        final Map<String, List<TraversalValue>> groups = new LinkedHashMap<>();
        for (final TraversalValue item : items) {
            final Map<String, Value> values = values(item, properties);
            final String key = key(values);
            keys.putIfAbsent(key, values);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
        }
        final Map<String, AggregateItem> result = new LinkedHashMap<>();
        groups.forEach((key, group) -> result.put(key, new AggregateItem(keys.get(key), group.size(), group)));
        return result;
    }
}
