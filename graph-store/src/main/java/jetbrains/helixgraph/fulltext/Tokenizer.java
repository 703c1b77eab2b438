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
package jetbrains.helixgraph.fulltext;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits text into lower-case terms on any character that is neither a letter nor a digit.
 */
public final class Tokenizer {

    /**
     * Terms of this length or shorter are dropped by the filtering tokenizer.
     */
    public static final int MAX_FILTERED_LENGTH = 2;

    private Tokenizer() {
    }

    @NotNull
    public static List<String> tokenize(@NotNull final String text, final boolean filter) {
        final List<String> result = new ArrayList<>();
        final StringBuilder term = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            final int c = text.codePointAt(i);
            if (Character.isLetterOrDigit(c)) {
                term.appendCodePoint(c);
            } else {
                flush(term, filter, result);
            }
            i += Character.charCount(c);
        }
        flush(term, filter, result);
        return result;
    }

    private static void flush(@NotNull final StringBuilder term, final boolean filter, @NotNull final List<String> result) {
        if (term.length() > 0) {
            final String lower = term.toString().toLowerCase(Locale.ROOT);
            if (!filter || lower.codePointCount(0, lower.length()) > MAX_FILTERED_LENGTH) {
                result.add(lower);
            }
            term.setLength(0);
        }
    }
}
