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

import jetbrains.exodus.ByteIterable;
import jetbrains.exodus.ByteIterator;
import org.jetbrains.annotations.NotNull;

public final class ByteIterables {

    private ByteIterables() {
    }

    /**
     * Copies contents of the iterable into a new array of exactly {@code getLength()} bytes.
     */
    @NotNull
    public static byte[] toArray(@NotNull final ByteIterable iterable) {
        final int length = iterable.getLength();
        final byte[] result = new byte[length];
        final ByteIterator it = iterable.iterator();
        for (int i = 0; i < length; ++i) {
            result[i] = it.next();
        }
        return result;
    }

    public static boolean startsWith(@NotNull final byte[] bytes, @NotNull final byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; ++i) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
