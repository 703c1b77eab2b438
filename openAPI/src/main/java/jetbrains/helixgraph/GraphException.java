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

import jetbrains.exodus.ExodusException;
import org.jetbrains.annotations.NotNull;

/**
 * Any graph engine exception is {@code GraphException}. Exceptions raised by the underlying Xodus environment
 * are wrapped into {@linkplain StorageException} as they cross into the graph engine.
 */
public class GraphException extends ExodusException {

    public GraphException() {
    }

    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable cause) {
        super(message, cause);
    }

    public GraphException(Throwable cause) {
        super(cause);
    }

    @NotNull
    public static GraphException wrap(@NotNull final Throwable t) {
        if (t instanceof GraphException) {
            return (GraphException) t;
        }
        if (t instanceof ExodusException) {
            return new StorageException(t);
        }
        return new GraphException(t);
    }
}
