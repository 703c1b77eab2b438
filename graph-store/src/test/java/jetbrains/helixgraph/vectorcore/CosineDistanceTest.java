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

import org.junit.Assert;
import org.junit.Test;

public class CosineDistanceTest {

    @Test
    public void distance() {
        Assert.assertEquals(0.025368153802923787, CosineDistance.distance(new double[]{1, 2, 3}, new double[]{4, 5, 6}), 1e-12);
    }

    @Test
    public void bounds() {
        Assert.assertEquals(CosineDistance.MIN_DISTANCE, CosineDistance.distance(new double[]{1, 2}, new double[]{2, 4}), 1e-12);
        Assert.assertEquals(CosineDistance.ORTHOGONAL, CosineDistance.distance(new double[]{1, 0}, new double[]{0, 3}), 1e-12);
        Assert.assertEquals(CosineDistance.MAX_DISTANCE, CosineDistance.distance(new double[]{1, 1}, new double[]{-1, -1}), 1e-12);
    }

    @Test
    public void zeroVector() {
        Assert.assertEquals(CosineDistance.MAX_DISTANCE, CosineDistance.distance(new double[]{0, 0}, new double[]{1, 1}), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void dimensionMismatch() {
        CosineDistance.distance(new double[]{1, 2, 3}, new double[]{1, 2});
    }
}
