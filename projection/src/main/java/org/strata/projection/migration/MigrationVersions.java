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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Maps view schema versions to the names of the projectors that must be rebuilt when migrating to that version.
 * The highest version is the version that the view schema should have.
 *
 * <pre>
 * MigrationVersions versions = MigrationVersions.builder()
 *         .version(1, "accounts", "owners")
 *         .version(2, "accounts")
 *         .build();
 * </pre>
 */
public final class MigrationVersions {
    private final SortedMap<Integer, List<String>> versions;

    private MigrationVersions(SortedMap<Integer, List<String>> versions) {
        this.versions = Collections.unmodifiableSortedMap(versions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The highest defined version, or 0 if no versions are defined.
     */
    public int currentVersion() {
        return versions.isEmpty() ? 0 : versions.lastKey();
    }

    public SortedMap<Integer, List<String>> versions() {
        return versions;
    }

    /**
     * @return The names of the projectors listed by the versions after {@code oldVersion} up to and including {@code newVersion},
     * each name once, in the order they were first listed.
     */
    public Set<String> projectorsBetween(int oldVersion, int newVersion) {
        Set<String> projectors = new LinkedHashSet<>();
        if (newVersion <= oldVersion) {
            return projectors;
        }
        versions.subMap(oldVersion + 1, newVersion + 1).values().forEach(projectors::addAll);
        return projectors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MigrationVersions that)) return false;
        return versions.equals(that.versions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(versions);
    }

    @Override
    public String toString() {
        return "MigrationVersions" + versions;
    }

    public static final class Builder {
        private final SortedMap<Integer, List<String>> versions = new TreeMap<>();

        private Builder() {
        }

        public Builder version(int version, String... projectorNames) {
            return version(version, List.of(projectorNames));
        }

        public Builder version(int version, List<String> projectorNames) {
            if (version < 1) {
                throw new InvalidMigrationDefinitionException("Version must be greater than 0, was " + version);
            }
            if (versions.containsKey(version)) {
                throw new InvalidMigrationDefinitionException("Version " + version + " is defined more than once");
            }
            if (projectorNames.isEmpty()) {
                throw new InvalidMigrationDefinitionException("Version " + version + " doesn't list any projectors");
            }
            versions.put(version, List.copyOf(new ArrayList<>(projectorNames)));
            return this;
        }

        public MigrationVersions build() {
            return new MigrationVersions(new TreeMap<>(versions));
        }
    }
}
