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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayNameGeneration(ReplaceUnderscores.class)
class MigrationVersionsTest {

    @Test
    void current_version_is_the_highest_version() {
        MigrationVersions versions = MigrationVersions.builder().version(2, "owners").version(1, "accounts").build();

        assertThat(versions.currentVersion()).isEqualTo(2);
        assertThat(versions.versions()).containsOnlyKeys(1, 2);
    }

    @Test
    void current_version_is_zero_without_versions() {
        assertThat(MigrationVersions.builder().build().currentVersion()).isZero();
    }

    @Test
    void projectors_between_versions_are_listed_once_in_order_of_first_appearance() {
        MigrationVersions versions = MigrationVersions.builder()
                .version(1, "owners")
                .version(2, "accounts")
                .version(3, "transfers", "accounts")
                .build();

        assertThat(versions.projectorsBetween(1, 3)).containsExactly("accounts", "transfers");
        assertThat(versions.projectorsBetween(0, 3)).containsExactly("owners", "accounts", "transfers");
        assertThat(versions.projectorsBetween(3, 3)).isEmpty();
    }

    @Test
    void versions_must_be_positive() {
        assertThatThrownBy(() -> MigrationVersions.builder().version(0, "accounts"))
                .isExactlyInstanceOf(InvalidMigrationDefinitionException.class)
                .hasMessage("Version must be greater than 0, was 0");
    }

    @Test
    void versions_cannot_be_defined_twice() {
        assertThatThrownBy(() -> MigrationVersions.builder().version(1, "accounts").version(1, "owners"))
                .isExactlyInstanceOf(InvalidMigrationDefinitionException.class);
    }
}
