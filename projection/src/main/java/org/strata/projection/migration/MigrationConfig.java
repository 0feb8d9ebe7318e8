/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.strata.projection.migration;

import org.strata.projection.ProjectionTable;
import org.strata.projection.persistor.ReplayOptimizedPersistor;

/**
 * Configuration of the {@link ViewSchemaMigrator}. Instances are immutable, use the {@code with} methods to derive a
 * changed configuration from {@link #defaultConfig()}.
 */
public final class MigrationConfig {
    public static final String DEFAULT_VIEW_SCHEMA = "projections";
    public static final String DEFAULT_SHADOW_SCHEMA = "projections_replay";
    public static final int DEFAULT_KEPT_VERSIONS = 10;
    public static final int DEFAULT_MAX_RECORDS_IN_MEMORY = 100_000;

    public final String viewSchema;
    public final String shadowSchema;
    public final int replayBatchSize;
    public final int keptVersions;
    public final int maxRecordsInMemory;

    private MigrationConfig(String viewSchema, String shadowSchema, int replayBatchSize, int keptVersions, int maxRecordsInMemory) {
        ProjectionTable.requireIdentifier(viewSchema, "View schema");
        ProjectionTable.requireIdentifier(shadowSchema, "Shadow schema");
        if (viewSchema.equalsIgnoreCase(shadowSchema)) {
            throw new IllegalArgumentException("View schema and shadow schema must differ");
        }
        if (replayBatchSize < 1) {
            throw new IllegalArgumentException("Replay batch size must be greater than 0");
        }
        if (keptVersions < 0) {
            throw new IllegalArgumentException("Kept versions cannot be negative");
        }
        if (maxRecordsInMemory < 1) {
            throw new IllegalArgumentException("Max records in memory must be greater than 0");
        }
        this.viewSchema = viewSchema;
        this.shadowSchema = shadowSchema;
        this.replayBatchSize = replayBatchSize;
        this.keptVersions = keptVersions;
        this.maxRecordsInMemory = maxRecordsInMemory;
    }

    public static MigrationConfig defaultConfig() {
        return new MigrationConfig(DEFAULT_VIEW_SCHEMA, DEFAULT_SHADOW_SCHEMA, ReplayOptimizedPersistor.DEFAULT_BATCH_SIZE, DEFAULT_KEPT_VERSIONS, DEFAULT_MAX_RECORDS_IN_MEMORY);
    }

    public MigrationConfig viewSchema(String viewSchema) {
        return new MigrationConfig(viewSchema, shadowSchema, replayBatchSize, keptVersions, maxRecordsInMemory);
    }

    public MigrationConfig shadowSchema(String shadowSchema) {
        return new MigrationConfig(viewSchema, shadowSchema, replayBatchSize, keptVersions, maxRecordsInMemory);
    }

    public MigrationConfig replayBatchSize(int replayBatchSize) {
        return new MigrationConfig(viewSchema, shadowSchema, replayBatchSize, keptVersions, maxRecordsInMemory);
    }

    /**
     * @param keptVersions The number of superseded view schema versions to keep, older versions are dropped after a migration.
     */
    public MigrationConfig keptVersions(int keptVersions) {
        return new MigrationConfig(viewSchema, shadowSchema, replayBatchSize, keptVersions, maxRecordsInMemory);
    }

    /**
     * @param maxRecordsInMemory The number of records a replay keeps in memory before it writes them to the shadow schema
     */
    public MigrationConfig maxRecordsInMemory(int maxRecordsInMemory) {
        return new MigrationConfig(viewSchema, shadowSchema, replayBatchSize, keptVersions, maxRecordsInMemory);
    }

    /**
     * @return The name of the schema that the view schema of {@code version} is renamed to when it is superseded.
     */
    public String archivedSchema(int version) {
        return viewSchema + "_v" + version;
    }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "viewSchema='" + viewSchema + '\'' +
                ", shadowSchema='" + shadowSchema + '\'' +
                ", replayBatchSize=" + replayBatchSize +
                ", keptVersions=" + keptVersions +
                ", maxRecordsInMemory=" + maxRecordsInMemory +
                '}';
    }
}
