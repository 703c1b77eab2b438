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
package jetbrains.helixgraph.vectorcore;

import jetbrains.exodus.ArrayByteIterable;
import jetbrains.helixgraph.InvalidVectorDataException;
import jetbrains.helixgraph.InvalidVectorLengthException;
import org.junit.Assert;
import org.junit.Test;

import java.nio.ByteOrder;

public class VectorBindingTest {

    @Test
    public void convertByteOrder() {
        final double[] data = {1.5, -2.25, 1e-9};
        final ArrayByteIterable big = VectorBinding.dataToEntry(data, ByteOrder.BIG_ENDIAN);
        final ArrayByteIterable little = VectorBinding.convert(big, ByteOrder.BIG_ENDIAN, ByteOrder.LITTLE_ENDIAN);
        Assert.assertArrayEquals(data, VectorBinding.entryToData(little, ByteOrder.LITTLE_ENDIAN), 0.0);
        Assert.assertEquals(big.getLength(), little.getLength());
    }

    @Test(expected = InvalidVectorLengthException.class)
    public void truncatedPayload() {
        VectorBinding.entryToData(new ArrayByteIterable(new byte[12]), ByteOrder.LITTLE_ENDIAN);
    }

    @Test(expected = InvalidVectorLengthException.class)
    public void emptyPayload() {
        VectorBinding.entryToData(new ArrayByteIterable(new byte[0]), ByteOrder.LITTLE_ENDIAN);
    }

    @Test(expected = InvalidVectorDataException.class)
    public void nonFiniteData() {
        VectorBinding.checkData(new double[]{1, Double.NaN});
    }
}
