/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.objectstore.schema;

import java.util.Objects;

/**
 * A named, typed field of an entity.
 *
 * @param name         the field name
 * @param type         the value type
 * @param required     whether a committed record must carry a non-null value
 * @param defaultValue value used by migrations and repairs (may be null)
 */
public record FieldDefinition(String name, FieldType type, boolean required, Object defaultValue) {

    public FieldDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        defaultValue = FieldType.normalize(defaultValue);
        if (!type.accepts(defaultValue)) {
            throw new IllegalArgumentException("Default for field '" + name + "' is not a valid " + type);
        }
    }

    public static FieldDefinition required(String name, FieldType type) {
        return new FieldDefinition(name, type, true, null);
    }

    public static FieldDefinition required(String name, FieldType type, Object defaultValue) {
        return new FieldDefinition(name, type, true, defaultValue);
    }

    public static FieldDefinition optional(String name, FieldType type) {
        return new FieldDefinition(name, type, false, null);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
