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
import org.strata.projection.ProjectorType;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the projector names of {@link MigrationVersions} against the registered {@link ProjectorType}s. The definitions
 * are validated when the planner is created, so that a misconfigured application fails on startup.
 */
public class MigrationPlanner {
    private final MigrationVersions versions;
    private final Map<String, ProjectorType> projectorTypes;

    public MigrationPlanner(MigrationVersions versions, Collection<ProjectorType> projectorTypes) {
        Objects.requireNonNull(versions, MigrationVersions.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(projectorTypes, "Projector types cannot be null");
        this.versions = versions;
        this.projectorTypes = index(projectorTypes);
        versions.versions().forEach((version, names) -> names.forEach(name -> {
            if (!this.projectorTypes.containsKey(name)) {
                throw new InvalidMigrationDefinitionException("Version " + version + " refers to unknown projector " + name);
            }
        }));
    }

    public MigrationVersions versions() {
        return versions;
    }

    public List<ProjectorType> projectorTypes() {
        return List.copyOf(projectorTypes.values());
    }

    public Optional<ProjectorType> projectorType(String name) {
        return Optional.ofNullable(projectorTypes.get(name));
    }

    public MigrationPlan plan(int oldVersion, int newVersion) {
        if (oldVersion < 0) {
            throw new InvalidMigrationDefinitionException("Current version cannot be negative, was " + oldVersion);
        }
        if (newVersion < oldVersion) {
            throw new IllegalArgumentException("New version " + newVersion + " must be greater than or equal to current version " + oldVersion);
        }
        List<ProjectorType> projectors = versions.projectorsBetween(oldVersion, newVersion).stream()
                .map(projectorTypes::get)
                .toList();
        return new MigrationPlan(oldVersion, newVersion, projectors);
    }

    private static Map<String, ProjectorType> index(Collection<ProjectorType> projectorTypes) {
        Map<String, ProjectorType> byName = new LinkedHashMap<>();
        Map<String, String> tableOwners = new HashMap<>();
        for (ProjectorType projectorType : projectorTypes) {
            if (byName.putIfAbsent(projectorType.name(), projectorType) != null) {
                throw new InvalidMigrationDefinitionException("Projector " + projectorType.name() + " is registered more than once");
            }
            for (ProjectionTable table : projectorType.managedTables()) {
                String owner = tableOwners.putIfAbsent(table.name().toLowerCase(Locale.ROOT), projectorType.name());
                if (owner != null) {
                    throw new InvalidMigrationDefinitionException("Table " + table.name() + " is managed by both " + owner + " and " + projectorType.name());
                }
            }
        }
        return byName;
    }
}
