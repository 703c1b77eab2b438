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

import org.junit.Assert;
import org.junit.Test;

import java.util.UUID;

public class IdsTest {

    @Test
    public void monotonic() {
        UUID previous = Ids.newId();
        for (int i = 0; i < 10000; ++i) {
            final UUID next = Ids.newId();
            Assert.assertTrue(Long.compareUnsigned(previous.getMostSignificantBits(), next.getMostSignificantBits()) < 0);
            Assert.assertEquals(7, next.version());
            previous = next;
        }
    }

    @Test
    public void bytes() {
        final UUID id = Ids.newId();
        final byte[] bytes = new byte[Ids.ID_LENGTH + 3];
        Ids.writeBytes(id, bytes, 3);
        Assert.assertEquals(id, Ids.fromBytes(bytes, 3));
        Assert.assertEquals(id, Ids.fromBytes(Ids.toBytes(id), 0));
    }

    @Test(expected = DecodeException.class)
    public void tooShort() {
        Ids.fromBytes(new byte[10], 0);
    }
}
