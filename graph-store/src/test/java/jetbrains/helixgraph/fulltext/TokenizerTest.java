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

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class TokenizerTest {

    @Test
    public void shortTermsAreFiltered() {
        Assert.assertEquals(
            Arrays.asList("the", "quick", "brown", "fox", "jumps", "over", "the", "lazy", "dog", "was", "amazing"),
            Tokenizer.tokenize("The quick brown fox jumps over the lazy dog! It was amazing.", true));
    }

    @Test
    public void withoutFilter() {
        Assert.assertEquals(Arrays.asList("a", "b", "cd", "efg"), Tokenizer.tokenize("A B CD efg!", false));
    }

    @Test
    public void punctuationOnly() {
        Assert.assertEquals(Collections.emptyList(), Tokenizer.tokenize("!@#$%^&*()", true));
        Assert.assertEquals(Collections.emptyList(), Tokenizer.tokenize("", false));
    }

    @Test
    public void unicodeLettersAndDigits() {
        Assert.assertEquals(Arrays.asList("2024", "café", "straße", "x86", "64"),
            Tokenizer.tokenize("2024 Café, straße x86_64", false));
        Assert.assertEquals(Arrays.asList("2024", "café", "straße", "x86"),
            Tokenizer.tokenize("2024 Café, straße x86_64", true));
    }
}
