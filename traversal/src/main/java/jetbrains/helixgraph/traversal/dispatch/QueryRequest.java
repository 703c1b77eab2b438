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
package jetbrains.helixgraph.traversal.dispatch;

import jetbrains.helixgraph.Value;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;

/**
 * Already parsed request: name of a registered query and its parameters.
 */
public record QueryRequest(@NotNull String name, @NotNull Map<String, Value> params) {

    public QueryRequest {
        params = Collections.unmodifiableMap(params);
    }

    public QueryRequest(@NotNull final String name) {
        this(name, Collections.emptyMap());
    }

    @Nullable
    public Value getParam(@NotNull final String paramName) {
        return params.get(paramName);
    }
}
