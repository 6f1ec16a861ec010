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
/**
 * Schema versions and the migrations between them.
 * <p>
 * A {@link dev.mars.objectstore.migration.SchemaRegistry} holds every known
 * model and the mappings between them;
 * {@link dev.mars.objectstore.migration.MigrationEngine} runs the shortest
 * chain of mappings against a closed store.
 */
package dev.mars.objectstore.migration;
