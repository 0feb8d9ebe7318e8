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

import java.util.List;

/**
 * The projectors that are rebuilt when the view schema is migrated from {@code fromVersion} to {@code toVersion}.
 */
public record MigrationPlan(int fromVersion, int toVersion, List<ProjectorType> projectors) {

    public MigrationPlan {
        projectors = List.copyOf(projectors);
    }

    static MigrationPlan upToDate(int version) {
        return new MigrationPlan(version, version, List.of());
    }

    public boolean isEmpty() {
        return projectors.isEmpty();
    }

    public List<String> projectorNames() {
        return projectors.stream().map(ProjectorType::name).toList();
    }

    /**
     * @return The tables managed by the projectors that are rebuilt.
     */
    public List<ProjectionTable> tables() {
        return projectors.stream().flatMap(p -> p.managedTables().stream()).toList();
    }

    public boolean rebuilds(ProjectorType projectorType) {
        return projectors.contains(projectorType);
    }
}
