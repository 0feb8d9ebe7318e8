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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ReplayOptimizedPersistor} that never writes anything. {@link #flush()} keeps the records in memory, there is no view schema
 * to read them back from. {@link #commit()} measures the throughput of the replay and discards the records. Used to find out how long
 * a migration will take.
 */
public class DryRunPersistor extends ReplayOptimizedPersistor {
    private static final Logger log = LoggerFactory.getLogger(DryRunPersistor.class);

    private long startedAt = System.nanoTime();
    private DryRunReport report = DryRunReport.empty();

    @Override
    public void prepare() {
        startedAt = System.nanoTime();
    }

    @Override
    public void flush() {
    }

    @Override
    public void commit() {
        double elapsedSeconds = (System.nanoTime() - startedAt) / 1_000_000_000.0;
        report = DryRunReport.of(recordCount(), elapsedSeconds);
        log.info("Dry run processed {} records in {} s ({} records/s)", report.records(), String.format("%.2f", report.elapsedSeconds()),
                String.format("%.2f", report.recordsPerSecond()));
        clear();
    }

    /**
     * @return The report of the latest {@link #commit()}
     */
    public DryRunReport report() {
        return report;
    }
}
