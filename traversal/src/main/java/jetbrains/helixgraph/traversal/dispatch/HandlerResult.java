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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Outcome of one handler run: a final value, or a future to wait for and a continuation to run with its
 * value on the continuation queue.
 */
public final class HandlerResult {

    @Nullable
    private final Object value;
    @Nullable
    private final CompletableFuture<Object> awaited;
    @Nullable
    private final Function<Object, HandlerResult> continuation;

    private HandlerResult(@Nullable final Object value,
                          @Nullable final CompletableFuture<Object> awaited,
                          @Nullable final Function<Object, HandlerResult> continuation) {
        this.value = value;
        this.awaited = awaited;
        this.continuation = continuation;
    }

    @NotNull
    public static HandlerResult done(@Nullable final Object value) {
        return new HandlerResult(value, null, null);
    }

    @SuppressWarnings("unchecked")
    @NotNull
    public static <T> HandlerResult await(@NotNull final CompletableFuture<T> future,
                                          @NotNull final Function<? super T, HandlerResult> continuation) {
        return new HandlerResult(null, (CompletableFuture<Object>) future,
            (Function<Object, HandlerResult>) continuation);
    }

    public boolean isDone() {
        return awaited == null;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @Nullable
    CompletableFuture<Object> getAwaited() {
        return awaited;
    }

    @Nullable
    Function<Object, HandlerResult> getContinuation() {
        return continuation;
    }
}
