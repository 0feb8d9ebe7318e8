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

package org.strata.projection.persistor;

/**
 * The result of a dry run of a migration.
 *
 * @param records          The number of records the projectors produced
 * @param elapsedSeconds   The time it took to replay the events
 * @param recordsPerSecond The throughput of the replay
 */
public record DryRunReport(long records, double elapsedSeconds, double recordsPerSecond) {

    public static DryRunReport of(long records, double elapsedSeconds) {
        return new DryRunReport(records, elapsedSeconds, elapsedSeconds > 0 ? records / elapsedSeconds : 0);
    }

    public static DryRunReport empty() {
        return new DryRunReport(0, 0, 0);
    }
}
