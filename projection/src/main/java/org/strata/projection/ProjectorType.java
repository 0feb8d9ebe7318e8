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

package org.strata.projection;

import org.strata.projection.persistor.Persistor;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Describes a projector: its name, used in {@link org.strata.projection.migration.MigrationVersions}, the tables it manages and
 * how to create it for a given {@link Persistor}. A replay only reads the events of the {@code aggregateTypes} of the projectors
 * it rebuilds, a projector without aggregate types is fed the events of all aggregates.
 */
public record ProjectorType(String name, List<ProjectionTable> managedTables, Set<String> aggregateTypes,
                            Function<Persistor, ? extends Projector<?>> factory) {

    public ProjectorType {
        ProjectionTable.requireIdentifier(name, "Projector name");
        Objects.requireNonNull(managedTables, "Managed tables cannot be null");
        Objects.requireNonNull(aggregateTypes, "Aggregate types cannot be null");
        Objects.requireNonNull(factory, "Factory cannot be null");
        if (managedTables.isEmpty()) {
            throw new IllegalArgumentException("Projector " + name + " must manage at least one table");
        }
        managedTables = List.copyOf(managedTables);
        aggregateTypes = Set.copyOf(aggregateTypes);
    }

    public static ProjectorType of(String name, Function<Persistor, ? extends Projector<?>> factory, ProjectionTable... managedTables) {
        return new ProjectorType(name, List.of(managedTables), Set.of(), factory);
    }

    /**
     * @return A copy of this projector type that is only fed the events of aggregates of the given types
     */
    public ProjectorType aggregateTypes(String... aggregateTypes) {
        return new ProjectorType(name, managedTables, Set.of(aggregateTypes), factory);
    }

    public Projector<?> create(Persistor persistor) {
        return factory.apply(persistor);
    }
}
