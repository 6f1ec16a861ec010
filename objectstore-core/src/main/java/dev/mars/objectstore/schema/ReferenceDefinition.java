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
 * A non-owning foreign-key reference from one entity to another.
 * Ownership is expressed separately through a record's project id.
 *
 * @param name       the reference name
 * @param targetType the entity type the reference must point to
 */
public record ReferenceDefinition(String name, String targetType) {

    public ReferenceDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(targetType, "targetType");
    }
}
