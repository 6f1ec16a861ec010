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
package dev.mars.objectstore;

import dev.mars.objectstore.storage.MergePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for the object store and its services.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dobjectstore.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code OBJECTSTORE_DATA_DIR})</li>
 *   <li>Properties file ({@code objectstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 * A value that cannot be parsed is ignored and the next source is consulted.
 * Environment variable names are derived from the property name:
 * {@code objectstore.maxVersionHistory} becomes {@code OBJECTSTORE_MAX_VERSION_HISTORY}.
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>Default</th><th>Meaning</th></tr>
 *   <tr><td>dataDir</td><td>~/.objectstore/data</td><td>store directory</td></tr>
 *   <tr><td>storeName</td><td>objectstore</td><td>base name of the store files</td></tr>
 *   <tr><td>syncEnabled</td><td>true</td><td>fsync journal, main and meta writes</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>64</td><td>refuse writes below this free space</td></tr>
 *   <tr><td>maxRecordSizeKb</td><td>4096</td><td>largest serialized record accepted by commit</td></tr>
 *   <tr><td>checkpointThresholdKb</td><td>1024</td><td>journal size that triggers a checkpoint</td></tr>
 *   <tr><td>mergePolicy</td><td>LOCAL_WINS</td><td>concurrent-write conflict policy</td></tr>
 *   <tr><td>maxVersionHistory</td><td>50</td><td>snapshots kept per project</td></tr>
 *   <tr><td>minVersionIntervalSeconds</td><td>60</td><td>automatic snapshot rate limit</td></tr>
 *   <tr><td>significantChangeThreshold</td><td>5</td><td>changes that justify an automatic snapshot</td></tr>
 *   <tr><td>autoSaveIntervalSeconds</td><td>30</td><td>auto-save period (minimum 10)</td></tr>
 *   <tr><td>backupRetentionDays</td><td>30</td><td>backup expiry</td></tr>
 *   <tr><td>maxBackups</td><td>10</td><td>backup sets kept</td></tr>
 *   <tr><td>backupCopyRetries</td><td>3</td><td>attempts per backup file copy</td></tr>
 *   <tr><td>operationTimeoutSeconds</td><td>300</td><td>migration and integrity timeout</td></tr>
 *   <tr><td>integrityValidThreshold</td><td>0.8</td><td>score at which a store is valid</td></tr>
 *   <tr><td>autoRepairEnabled</td><td>true</td><td>repair non-critical issues after a full check</td></tr>
 *   <tr><td>quickCheckSampleSize</td><td>200</td><td>records sampled by a quick check</td></tr>
 *   <tr><td>quickCheckIntervalSeconds</td><td>3600</td><td>background quick-check period</td></tr>
 *   <tr><td>largeEntityCountThreshold</td><td>10000</td><td>entity count flagged as a performance issue</td></tr>
 *   <tr><td>largePayloadThresholdKb</td><td>1024</td><td>record size flagged as a performance issue</td></tr>
 *   <tr><td>healthMinFreeSpaceMb</td><td>100</td><td>free space below which health is critical</td></tr>
 *   <tr><td>maxIssuesPerCheck</td><td>100</td><td>issues kept per check</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # objectstore.properties
 * objectstore.dataDir=/var/lib/objectstore
 * objectstore.maxVersionHistory=100
 * objectstore.mergePolicy=FAIL_ON_CONFLICT
 * </pre>
 */
public final class ObjectStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectStoreConfig.class);

    private static final String PROPERTIES_FILE = "objectstore.properties";
    private static final String PREFIX = "objectstore.";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".objectstore", "data");
    private static final String DEFAULT_STORE_NAME = "objectstore";
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 64;
    private static final int DEFAULT_MAX_RECORD_SIZE_KB = 4096;
    private static final int DEFAULT_CHECKPOINT_THRESHOLD_KB = 1024;
    private static final MergePolicy DEFAULT_MERGE_POLICY = MergePolicy.LOCAL_WINS;
    private static final int DEFAULT_MAX_VERSION_HISTORY = 50;
    private static final int DEFAULT_MIN_VERSION_INTERVAL_SECONDS = 60;
    private static final int DEFAULT_SIGNIFICANT_CHANGE_THRESHOLD = 5;
    private static final int DEFAULT_AUTO_SAVE_INTERVAL_SECONDS = 30;
    private static final int DEFAULT_BACKUP_RETENTION_DAYS = 30;
    private static final int DEFAULT_MAX_BACKUPS = 10;
    private static final int DEFAULT_BACKUP_COPY_RETRIES = 3;
    private static final int DEFAULT_OPERATION_TIMEOUT_SECONDS = 300;
    private static final double DEFAULT_INTEGRITY_VALID_THRESHOLD = 0.8;
    private static final boolean DEFAULT_AUTO_REPAIR_ENABLED = true;
    private static final int DEFAULT_QUICK_CHECK_SAMPLE_SIZE = 200;
    private static final int DEFAULT_QUICK_CHECK_INTERVAL_SECONDS = 3600;
    private static final int DEFAULT_LARGE_ENTITY_COUNT_THRESHOLD = 10_000;
    private static final int DEFAULT_LARGE_PAYLOAD_THRESHOLD_KB = 1024;
    private static final int DEFAULT_HEALTH_MIN_FREE_SPACE_MB = 100;
    private static final int DEFAULT_MAX_ISSUES_PER_CHECK = 100;

    /** The auto-save timer never runs more often than this. */
    public static final int MIN_AUTO_SAVE_INTERVAL_SECONDS = 10;

    private final Path dataDir;
    private final String storeName;
    private final boolean syncEnabled;
    private final int minFreeSpaceMb;
    private final int maxRecordSizeKb;
    private final int checkpointThresholdKb;
    private final MergePolicy mergePolicy;
    private final int maxVersionHistory;
    private final int minVersionIntervalSeconds;
    private final int significantChangeThreshold;
    private final int autoSaveIntervalSeconds;
    private final int backupRetentionDays;
    private final int maxBackups;
    private final int backupCopyRetries;
    private final int operationTimeoutSeconds;
    private final double integrityValidThreshold;
    private final boolean autoRepairEnabled;
    private final int quickCheckSampleSize;
    private final int quickCheckIntervalSeconds;
    private final int largeEntityCountThreshold;
    private final int largePayloadThresholdKb;
    private final int healthMinFreeSpaceMb;
    private final int maxIssuesPerCheck;

    private ObjectStoreConfig(Builder b) {
        this.dataDir = b.dataDir;
        this.storeName = b.storeName;
        this.syncEnabled = b.syncEnabled;
        this.minFreeSpaceMb = b.minFreeSpaceMb;
        this.maxRecordSizeKb = b.maxRecordSizeKb;
        this.checkpointThresholdKb = b.checkpointThresholdKb;
        this.mergePolicy = b.mergePolicy;
        this.maxVersionHistory = b.maxVersionHistory;
        this.minVersionIntervalSeconds = b.minVersionIntervalSeconds;
        this.significantChangeThreshold = b.significantChangeThreshold;
        this.autoSaveIntervalSeconds = b.autoSaveIntervalSeconds;
        this.backupRetentionDays = b.backupRetentionDays;
        this.maxBackups = b.maxBackups;
        this.backupCopyRetries = b.backupCopyRetries;
        this.operationTimeoutSeconds = b.operationTimeoutSeconds;
        this.integrityValidThreshold = b.integrityValidThreshold;
        this.autoRepairEnabled = b.autoRepairEnabled;
        this.quickCheckSampleSize = b.quickCheckSampleSize;
        this.quickCheckIntervalSeconds = b.quickCheckIntervalSeconds;
        this.largeEntityCountThreshold = b.largeEntityCountThreshold;
        this.largePayloadThresholdKb = b.largePayloadThresholdKb;
        this.healthMinFreeSpaceMb = b.healthMinFreeSpaceMb;
        this.maxIssuesPerCheck = b.maxIssuesPerCheck;
    }

    /** Directory holding the store files, backups and audit history. */
    public Path dataDir() {
        return dataDir;
    }

    /** Base name of the store file triplet. */
    public String storeName() {
        return storeName;
    }

    /** Directory holding backup sets and the backup index. */
    public Path backupDir() {
        return dataDir.resolve("backups");
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    public int maxRecordSizeKb() {
        return maxRecordSizeKb;
    }

    public int maxRecordSizeBytes() {
        return maxRecordSizeKb * 1024;
    }

    public int checkpointThresholdKb() {
        return checkpointThresholdKb;
    }

    public long checkpointThresholdBytes() {
        return (long) checkpointThresholdKb * 1024;
    }

    public MergePolicy mergePolicy() {
        return mergePolicy;
    }

    public int maxVersionHistory() {
        return maxVersionHistory;
    }

    public Duration minVersionInterval() {
        return Duration.ofSeconds(minVersionIntervalSeconds);
    }

    public int significantChangeThreshold() {
        return significantChangeThreshold;
    }

    /** Auto-save period, never shorter than {@value #MIN_AUTO_SAVE_INTERVAL_SECONDS} seconds. */
    public Duration autoSaveInterval() {
        return Duration.ofSeconds(Math.max(MIN_AUTO_SAVE_INTERVAL_SECONDS, autoSaveIntervalSeconds));
    }

    public Duration backupRetention() {
        return Duration.ofDays(backupRetentionDays);
    }

    public int maxBackups() {
        return maxBackups;
    }

    public int backupCopyRetries() {
        return backupCopyRetries;
    }

    public Duration operationTimeout() {
        return Duration.ofSeconds(operationTimeoutSeconds);
    }

    public double integrityValidThreshold() {
        return integrityValidThreshold;
    }

    public boolean autoRepairEnabled() {
        return autoRepairEnabled;
    }

    public int quickCheckSampleSize() {
        return quickCheckSampleSize;
    }

    public Duration quickCheckInterval() {
        return Duration.ofSeconds(quickCheckIntervalSeconds);
    }

    public int largeEntityCountThreshold() {
        return largeEntityCountThreshold;
    }

    public int largePayloadThresholdBytes() {
        return largePayloadThresholdKb * 1024;
    }

    public long healthMinFreeSpaceBytes() {
        return (long) healthMinFreeSpaceMb * 1024 * 1024;
    }

    public int maxIssuesPerCheck() {
        return maxIssuesPerCheck;
    }

    @Override
    public String toString() {
        return "ObjectStoreConfig{" +
                "dataDir=" + dataDir +
                ", storeName=" + storeName +
                ", syncEnabled=" + syncEnabled +
                ", mergePolicy=" + mergePolicy +
                ", maxVersionHistory=" + maxVersionHistory +
                ", minVersionIntervalSeconds=" + minVersionIntervalSeconds +
                ", autoSaveIntervalSeconds=" + autoSaveIntervalSeconds +
                ", maxBackups=" + maxBackups +
                ", operationTimeoutSeconds=" + operationTimeoutSeconds +
                ", autoRepairEnabled=" + autoRepairEnabled +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     */
    public static ObjectStoreConfig load() {
        return builder().build();
    }

    /**
     * Maps a property key such as {@code maxVersionHistory} to its
     * environment variable name {@code OBJECTSTORE_MAX_VERSION_HISTORY}.
     */
    static String envName(String key) {
        StringBuilder sb = new StringBuilder("OBJECTSTORE_");
        for (char c : key.toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append('_');
            }
            sb.append(Character.toUpperCase(c));
        }
        return sb.toString();
    }

    /**
     * Builder for {@link ObjectStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private String storeName;
        private Boolean syncEnabled;
        private Integer minFreeSpaceMb;
        private Integer maxRecordSizeKb;
        private Integer checkpointThresholdKb;
        private MergePolicy mergePolicy;
        private Integer maxVersionHistory;
        private Integer minVersionIntervalSeconds;
        private Integer significantChangeThreshold;
        private Integer autoSaveIntervalSeconds;
        private Integer backupRetentionDays;
        private Integer maxBackups;
        private Integer backupCopyRetries;
        private Integer operationTimeoutSeconds;
        private Double integrityValidThreshold;
        private Boolean autoRepairEnabled;
        private Integer quickCheckSampleSize;
        private Integer quickCheckIntervalSeconds;
        private Integer largeEntityCountThreshold;
        private Integer largePayloadThresholdKb;
        private Integer healthMinFreeSpaceMb;
        private Integer maxIssuesPerCheck;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        public Builder storeName(String storeName) {
            this.storeName = storeName;
            return this;
        }

        /** Enables or disables fsync (default: true). Disable ONLY for tests. */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        public Builder maxRecordSizeKb(int maxRecordSizeKb) {
            this.maxRecordSizeKb = maxRecordSizeKb;
            return this;
        }

        public Builder checkpointThresholdKb(int checkpointThresholdKb) {
            this.checkpointThresholdKb = checkpointThresholdKb;
            return this;
        }

        public Builder mergePolicy(MergePolicy mergePolicy) {
            this.mergePolicy = mergePolicy;
            return this;
        }

        public Builder maxVersionHistory(int maxVersionHistory) {
            this.maxVersionHistory = maxVersionHistory;
            return this;
        }

        public Builder minVersionIntervalSeconds(int seconds) {
            this.minVersionIntervalSeconds = seconds;
            return this;
        }

        public Builder significantChangeThreshold(int threshold) {
            this.significantChangeThreshold = threshold;
            return this;
        }

        public Builder autoSaveIntervalSeconds(int seconds) {
            this.autoSaveIntervalSeconds = seconds;
            return this;
        }

        public Builder backupRetentionDays(int days) {
            this.backupRetentionDays = days;
            return this;
        }

        public Builder maxBackups(int maxBackups) {
            this.maxBackups = maxBackups;
            return this;
        }

        public Builder backupCopyRetries(int retries) {
            this.backupCopyRetries = retries;
            return this;
        }

        public Builder operationTimeoutSeconds(int seconds) {
            this.operationTimeoutSeconds = seconds;
            return this;
        }

        public Builder integrityValidThreshold(double threshold) {
            this.integrityValidThreshold = threshold;
            return this;
        }

        public Builder autoRepairEnabled(boolean enabled) {
            this.autoRepairEnabled = enabled;
            return this;
        }

        public Builder quickCheckSampleSize(int sampleSize) {
            this.quickCheckSampleSize = sampleSize;
            return this;
        }

        public Builder quickCheckIntervalSeconds(int seconds) {
            this.quickCheckIntervalSeconds = seconds;
            return this;
        }

        public Builder largeEntityCountThreshold(int threshold) {
            this.largeEntityCountThreshold = threshold;
            return this;
        }

        public Builder largePayloadThresholdKb(int thresholdKb) {
            this.largePayloadThresholdKb = thresholdKb;
            return this;
        }

        public Builder healthMinFreeSpaceMb(int mb) {
            this.healthMinFreeSpaceMb = mb;
            return this;
        }

        public Builder maxIssuesPerCheck(int maxIssues) {
            this.maxIssuesPerCheck = maxIssues;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is out of range
         */
        public ObjectStoreConfig build() {
            if (dataDir == null) {
                dataDir = resolve("dataDir", Path::of, DEFAULT_DATA_DIR);
            }
            if (storeName == null) {
                storeName = resolve("storeName", Function.identity(), DEFAULT_STORE_NAME);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve("syncEnabled", Builder::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolve("minFreeSpaceMb", Integer::parseInt, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxRecordSizeKb == null) {
                maxRecordSizeKb = resolve("maxRecordSizeKb", Integer::parseInt, DEFAULT_MAX_RECORD_SIZE_KB);
            }
            if (checkpointThresholdKb == null) {
                checkpointThresholdKb = resolve("checkpointThresholdKb", Integer::parseInt, DEFAULT_CHECKPOINT_THRESHOLD_KB);
            }
            if (mergePolicy == null) {
                mergePolicy = resolve("mergePolicy",
                        v -> MergePolicy.valueOf(v.trim().toUpperCase(Locale.ROOT)), DEFAULT_MERGE_POLICY);
            }
            if (maxVersionHistory == null) {
                maxVersionHistory = resolve("maxVersionHistory", Integer::parseInt, DEFAULT_MAX_VERSION_HISTORY);
            }
            if (minVersionIntervalSeconds == null) {
                minVersionIntervalSeconds = resolve("minVersionIntervalSeconds", Integer::parseInt,
                        DEFAULT_MIN_VERSION_INTERVAL_SECONDS);
            }
            if (significantChangeThreshold == null) {
                significantChangeThreshold = resolve("significantChangeThreshold", Integer::parseInt,
                        DEFAULT_SIGNIFICANT_CHANGE_THRESHOLD);
            }
            if (autoSaveIntervalSeconds == null) {
                autoSaveIntervalSeconds = resolve("autoSaveIntervalSeconds", Integer::parseInt,
                        DEFAULT_AUTO_SAVE_INTERVAL_SECONDS);
            }
            if (backupRetentionDays == null) {
                backupRetentionDays = resolve("backupRetentionDays", Integer::parseInt, DEFAULT_BACKUP_RETENTION_DAYS);
            }
            if (maxBackups == null) {
                maxBackups = resolve("maxBackups", Integer::parseInt, DEFAULT_MAX_BACKUPS);
            }
            if (backupCopyRetries == null) {
                backupCopyRetries = resolve("backupCopyRetries", Integer::parseInt, DEFAULT_BACKUP_COPY_RETRIES);
            }
            if (operationTimeoutSeconds == null) {
                operationTimeoutSeconds = resolve("operationTimeoutSeconds", Integer::parseInt,
                        DEFAULT_OPERATION_TIMEOUT_SECONDS);
            }
            if (integrityValidThreshold == null) {
                integrityValidThreshold = resolve("integrityValidThreshold", Double::parseDouble,
                        DEFAULT_INTEGRITY_VALID_THRESHOLD);
            }
            if (autoRepairEnabled == null) {
                autoRepairEnabled = resolve("autoRepairEnabled", Builder::parseBoolean, DEFAULT_AUTO_REPAIR_ENABLED);
            }
            if (quickCheckSampleSize == null) {
                quickCheckSampleSize = resolve("quickCheckSampleSize", Integer::parseInt, DEFAULT_QUICK_CHECK_SAMPLE_SIZE);
            }
            if (quickCheckIntervalSeconds == null) {
                quickCheckIntervalSeconds = resolve("quickCheckIntervalSeconds", Integer::parseInt,
                        DEFAULT_QUICK_CHECK_INTERVAL_SECONDS);
            }
            if (largeEntityCountThreshold == null) {
                largeEntityCountThreshold = resolve("largeEntityCountThreshold", Integer::parseInt,
                        DEFAULT_LARGE_ENTITY_COUNT_THRESHOLD);
            }
            if (largePayloadThresholdKb == null) {
                largePayloadThresholdKb = resolve("largePayloadThresholdKb", Integer::parseInt,
                        DEFAULT_LARGE_PAYLOAD_THRESHOLD_KB);
            }
            if (healthMinFreeSpaceMb == null) {
                healthMinFreeSpaceMb = resolve("healthMinFreeSpaceMb", Integer::parseInt,
                        DEFAULT_HEALTH_MIN_FREE_SPACE_MB);
            }
            if (maxIssuesPerCheck == null) {
                maxIssuesPerCheck = resolve("maxIssuesPerCheck", Integer::parseInt, DEFAULT_MAX_ISSUES_PER_CHECK);
            }

            requirePositive("maxVersionHistory", maxVersionHistory);
            requirePositive("maxBackups", maxBackups);
            requirePositive("backupCopyRetries", backupCopyRetries);
            requirePositive("operationTimeoutSeconds", operationTimeoutSeconds);
            requirePositive("quickCheckSampleSize", quickCheckSampleSize);
            requirePositive("maxIssuesPerCheck", maxIssuesPerCheck);
            if (integrityValidThreshold < 0.0 || integrityValidThreshold > 1.0) {
                throw new IllegalArgumentException("integrityValidThreshold must be within [0, 1]: "
                        + integrityValidThreshold);
            }
            if (storeName.isBlank()) {
                throw new IllegalArgumentException("storeName must not be blank");
            }

            return new ObjectStoreConfig(this);
        }

        /**
         * Resolves one key: system property, environment variable, properties
         * file, default. Unparseable values fall through to the next source.
         */
        private <T> T resolve(String key, Function<String, T> parser, T defaultValue) {
            String property = PREFIX + key;
            String[] candidates = {
                    System.getProperty(property),
                    System.getenv(envName(key)),
                    fileProperties.getProperty(property)
            };
            for (String value : candidates) {
                if (value == null || value.isBlank()) {
                    continue;
                }
                try {
                    return parser.apply(value);
                } catch (RuntimeException e) {
                    LOG.warn("Ignoring invalid value for {}: '{}' ({})", property, value, e.getMessage());
                }
            }
            return defaultValue;
        }

        private static Boolean parseBoolean(String value) {
            String v = value.trim();
            if ("true".equalsIgnoreCase(v)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(v)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("not a boolean");
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Classpath first
            try (InputStream is = ObjectStoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Then the working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
