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

/**
 * Type tags of property values. The tag byte is a part of the serialized form, so the order of constants
 * must never change.
 */
public enum ValueType {
    EMPTY,
    STRING,
    I32,
    I64,
    F32,
    F64,
    BOOLEAN,
    ID,
    ARRAY,
    OBJECT;

    public boolean isNumber() {
        return this == I32 || this == I64 || this == F32 || this == F64;
    }

    public boolean isIntegral() {
        return this == I32 || this == I64;
    }

    /**
     * Position among values of other types in sort order: empty values first, then numbers of any type,
     * then the rest in declaration order.
     */
    public int getSortRank() {
        if (this == EMPTY) {
            return 0;
        }
        return isNumber() ? 1 : ordinal() + 2;
    }
}
