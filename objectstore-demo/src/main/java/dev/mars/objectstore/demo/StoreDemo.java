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
package dev.mars.objectstore.demo;

import dev.mars.objectstore.ObjectStore;
import dev.mars.objectstore.ObjectStoreConfig;
import dev.mars.objectstore.integrity.CheckResult;
import dev.mars.objectstore.integrity.IntegrityIssue;
import dev.mars.objectstore.integrity.IntegrityReport;
import dev.mars.objectstore.storage.ManagedRecord;
import dev.mars.objectstore.storage.WorkingContext;
import dev.mars.objectstore.version.SnapshotType;
import dev.mars.objectstore.version.VersionSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Walks through the store's main features against a small room-planning model.
 * <p>
 * Usage: {@code StoreDemo [dataDir]}. Without an argument the configuration
 * is resolved from system properties, environment and
 * {@code objectstore.properties}.
 */
public class StoreDemo {

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|          Object Store Demo            |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        // Build configuration with CLI override if provided
        ObjectStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? ObjectStoreConfig.builder().dataDir(args[0]).build()
                : ObjectStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (ObjectStore store = ObjectStore.open(config, DemoSchema.registry())) {
            System.out.println("[OK] Store opened at: " + config.dataDir().toAbsolutePath());
            System.out.println("[OK] Records by type: " + store.engine().stats().recordsByType());

            WorkingContext ctx = store.engine().defaultContext();

            // Shared catalog entries are created once
            ManagedRecord sofaItem = catalogItem(ctx, "sofa-3", "Three-seat sofa", "seating");
            ManagedRecord tableItem = catalogItem(ctx, "table-round", "Round table", "tables");

            // A new project with one room and some furniture
            ManagedRecord project = ctx.insert(DemoSchema.PROJECT, null, Map.of(
                    "name", "Living room " + Instant.now(),
                    "createdAt", Instant.now()));
            ManagedRecord room = ctx.insert(DemoSchema.ROOM, project.id(), Map.of(
                    "name", "Living room", "width", 5.2, "depth", 4.0));
            ManagedRecord sofa = ctx.insert(DemoSchema.FURNITURE, project.id(), Map.of(
                    "label", "Sofa", "x", 0.5, "y", 3.2));
            ctx.setReference(sofa, "room", room.id());
            ctx.setReference(sofa, "item", sofaItem.id());
            ManagedRecord table = ctx.insert(DemoSchema.FURNITURE, project.id(), Map.of(
                    "label", "Table", "x", 2.5, "y", 1.5));
            ctx.setReference(table, "room", room.id());
            ctx.setReference(table, "item", tableItem.id());

            store.engine().commit(ctx).join();
            System.out.println("\n[OK] Project " + project.id() + " created with "
                    + ctx.children(project.id()).size() + " child records");

            VersionSnapshot first = store.versions()
                    .createVersion(project.id(), SnapshotType.MANUAL, "Initial layout").join();
            System.out.println("[OK] Snapshot v" + first.versionNumber() + " (" + first.dataSize() + " bytes)");

            // Rearrange: move the sofa, rotate it, drop the table
            ctx.set(sofa, "x", 3.0);
            ctx.set(sofa, "rotation", 90.0);
            ctx.delete(table);
            store.engine().commit(ctx).join();
            System.out.println("[OK] Moved sofa to x=" + sofa.doubleValue("x") + ", removed table");

            VersionSnapshot second = store.versions()
                    .createVersion(project.id(), SnapshotType.MANUAL, "Sofa by the window").join();
            System.out.println("[OK] Snapshot v" + second.versionNumber());

            // Restore the first layout; a safety snapshot is taken first
            VersionSnapshot safety = store.versions().restoreVersion(first, project.id()).join();
            System.out.println("[OK] Restored v" + first.versionNumber()
                    + ", safety snapshot v" + safety.versionNumber() + " (" + safety.type() + ")");

            System.out.println("\n  Version history:");
            List<VersionSnapshot> history = store.versions().history(project.id());
            for (VersionSnapshot v : history) {
                System.out.printf("    v%d %-15s %s%n", v.versionNumber(), v.type(), v.comment());
            }

            System.out.println("\n  Furniture after restore:");
            for (ManagedRecord f : ctx.fetch(DemoSchema.FURNITURE, r -> project.id().equals(r.projectId()))) {
                System.out.printf("    %-6s x=%.1f y=%.1f rotation=%.0f%n",
                        f.string("label"), f.doubleValue("x"), f.doubleValue("y"), f.doubleValue("rotation"));
            }

            // Integrity
            CheckResult result = store.integrity().fullCheck().join();
            System.out.printf("%n[OK] Integrity score %.2f (%s), %d records scanned%n",
                    result.score(), result.valid() ? "valid" : "INVALID", result.scannedRecords());
            for (IntegrityIssue issue : result.issues()) {
                System.out.println("    " + issue.severity() + " " + issue.type() + ": " + issue.description());
            }

            IntegrityReport report = store.integrity().report();
            System.out.println("\n  Recommendations:");
            for (String recommendation : report.recommendations()) {
                System.out.println("    - " + recommendation);
            }
        }

        System.out.println("\n[OK] Store closed cleanly.");
        System.out.println("\nRun again to see the data persist across restarts!");
    }

    private static ManagedRecord catalogItem(WorkingContext ctx, String id, String name, String category) {
        return ctx.get(id).orElseGet(() -> ctx.insert(id, DemoSchema.CATALOG_ITEM, null, Map.of(
                "name", name, "category", category, "dimensions", "{\"w\":1.0,\"d\":0.9}")));
    }
}
