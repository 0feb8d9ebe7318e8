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

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * The status of a view schema version. A migration replays the events into the shadow schema online, while commands are
 * accepted, and then replays the events committed since then offline. A version is {@link #DONE} once it has replaced
 * the live view schema.
 */
public enum MigrationStatus {
    ONLINE_RUNNING(1),
    ONLINE_FINISHED(2),
    OFFLINE_RUNNING(3),
    DONE(null);

    private final @Nullable Integer code;

    MigrationStatus(@Nullable Integer code) {
        this.code = code;
    }

    /**
     * @return The value stored in the status column, {@code null} for {@link #DONE}.
     */
    public @Nullable Integer code() {
        return code;
    }

    public static MigrationStatus fromCode(@Nullable Integer code) {
        for (MigrationStatus status : values()) {
            if (Objects.equals(status.code, code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown migration status " + code);
    }
}
