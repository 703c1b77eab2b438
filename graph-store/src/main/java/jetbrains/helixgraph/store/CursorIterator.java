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

import jetbrains.exodus.env.Cursor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy iterator over a Xodus cursor. The cursor is closed as soon as the iterator is exhausted, or by
 * {@linkplain #close()} if iteration is abandoned.
 */
public abstract class CursorIterator<T> implements Iterator<T>, AutoCloseable {

    @NotNull
    private final Cursor cursor;
    @Nullable
    private T next;
    private boolean started;
    private boolean finished;

    protected CursorIterator(@NotNull final Cursor cursor) {
        this.cursor = cursor;
    }

    /**
     * Moves the cursor to the next matching record and decodes it.
     *
     * @param cursor the cursor
     * @param first  {@code true} if the cursor is not positioned yet
     * @return decoded record or {@code null} if there are no more records
     */
    @Nullable
    protected abstract T fetchNext(@NotNull Cursor cursor, boolean first);

    @Override
    public boolean hasNext() {
        if (next == null && !finished) {
            try {
                next = fetchNext(cursor, !started);
            } catch (RuntimeException e) {
                close();
                throw e;
            }
            started = true;
            if (next == null) {
                close();
            }
        }
        return next != null;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final T result = next;
        next = null;
        return result;
    }

    @Override
    public void close() {
        if (!finished) {
            finished = true;
            cursor.close();
        }
    }
}
