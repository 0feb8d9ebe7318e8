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

import org.junit.jupiter.api.Test;
import org.strata.projection.AccountProjector;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DryRunPersistorTest {

    @Test
    void commit_reports_the_records_and_discards_them() {
        // Given
        DryRunPersistor persistor = new DryRunPersistor();
        persistor.prepare();
        persistor.createRecord(AccountProjector.ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 0L));
        persistor.createRecord(AccountProjector.ACCOUNTS, Map.of("account_id", "account2", "owner", "Joe", "balance", 0L));

        // When
        persistor.commit();

        // Then
        assertThat(persistor.report().records()).isEqualTo(2);
        assertThat(persistor.report().elapsedSeconds()).isGreaterThanOrEqualTo(0);
        assertThat(persistor.recordCount()).isZero();
    }

    @Test
    void flush_keeps_the_records_in_memory() {
        // Given
        DryRunPersistor persistor = new DryRunPersistor();
        persistor.createRecord(AccountProjector.ACCOUNTS, Map.of("account_id", "account1", "owner", "Jane", "balance", 0L));

        // When
        persistor.flush();

        // Then
        assertThat(persistor.getRecord(AccountProjector.ACCOUNTS, Map.of("account_id", "account1"))).isPresent();
    }

    @Test
    void report_is_empty_before_commit() {
        assertThat(new DryRunPersistor().report()).isEqualTo(DryRunReport.empty());
    }
}
