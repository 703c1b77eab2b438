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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class ValueTest {

    @Test
    public void fromJavaObjects() {
        Assert.assertEquals(ValueType.STRING, Value.from("a").getType());
        Assert.assertEquals(ValueType.I32, Value.from(1).getType());
        Assert.assertEquals(ValueType.I64, Value.from(1L).getType());
        Assert.assertEquals(ValueType.F64, Value.from(1.0).getType());
        Assert.assertEquals(ValueType.BOOLEAN, Value.from(true).getType());
        Assert.assertEquals(ValueType.ID, Value.from(UUID.randomUUID()).getType());
        Assert.assertSame(Value.EMPTY, Value.from(null));
        Assert.assertTrue(Value.EMPTY.isEmpty());
        Assert.assertEquals("null", Value.EMPTY.toString());
    }

    @Test
    public void numbersCompareAcrossTypes() {
        Assert.assertEquals(0, Value.of(2).compareTo(Value.of(2L)));
        Assert.assertTrue(Value.of(1).compareTo(Value.of(1.5)) < 0);
        Assert.assertTrue(Value.of(2.5f).compareTo(Value.of(2L)) > 0);
        // equality is typed
        Assert.assertNotEquals(Value.of(2), Value.of(2L));
    }

    @Test
    public void sortMixedValues() {
        final List<Value> values = new ArrayList<>(Arrays.asList(Value.of("b"), Value.of(3), Value.of("a"), Value.of(1.5)));
        Collections.sort(values);
        Assert.assertEquals(Arrays.asList(Value.of(1.5), Value.of(3), Value.of("a"), Value.of("b")), values);
    }

    @Test
    public void emptyFirstThenNumbersThenOtherTypes() {
        final List<Value> values = new ArrayList<>(Arrays.asList(
            Value.of(true), Value.of("a"), Value.of(7L), Value.EMPTY, Value.of(2.5f), Value.of(1)));
        Collections.sort(values);
        Assert.assertEquals(Arrays.asList(
            Value.EMPTY, Value.of(1), Value.of(2.5f), Value.of(7L), Value.of("a"), Value.of(true)), values);
    }

    @Test
    public void nested() {
        final Value object = Value.ofObject(Map.of("tags", Value.ofArray(List.of(Value.of("x"), Value.of("y")))));
        Assert.assertEquals(Value.of("y"), object.asObject().get("tags").asArray().get(1));
    }

    @Test(expected = DecodeException.class)
    public void wrongAccessor() {
        Value.of("text").asLong();
    }

    @Test(expected = IllegalArgumentException.class)
    public void unsupportedObject() {
        Value.from(new Object());
    }
}
