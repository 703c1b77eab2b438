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

import java.util.HashMap;
import java.util.Map;

public class VersionInfoTest {

    private final VersionInfo versionInfo = VersionInfo.builder()
        .addUpgrade("person", properties -> {
            properties.put("age", Value.of(0));
            return properties;
        })
        .addUpgrade("person", properties -> {
            properties.put("name", Value.of(properties.get("name").asString().toUpperCase()));
            return properties;
        })
        .build();

    @Test
    public void latestVersion() {
        Assert.assertEquals(3, versionInfo.getLatestVersion("person"));
        Assert.assertEquals(VersionInfo.INITIAL_VERSION, versionInfo.getLatestVersion("other"));
    }

    @Test
    public void upgradeChain() {
        final Map<String, Value> properties = new HashMap<>();
        properties.put("name", Value.of("john"));
        final Map<String, Value> upgraded = versionInfo.upgradeToLatest("person", (byte) 1, properties);
        Assert.assertEquals(Value.of("JOHN"), upgraded.get("name"));
        Assert.assertEquals(Value.of(0), upgraded.get("age"));
        // input is not modified
        Assert.assertFalse(properties.containsKey("age"));
        Assert.assertSame(properties, versionInfo.upgradeToLatest("person", (byte) 3, properties));
    }

    @Test(expected = DecodeException.class)
    public void unknownVersion() {
        versionInfo.upgradeToLatest("person", (byte) 4, new HashMap<>());
    }
}
