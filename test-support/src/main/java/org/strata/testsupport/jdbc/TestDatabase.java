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

package org.strata.testsupport.jdbc;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.strata.eventstore.jdbc.JdbcEventStore;
import org.strata.eventstore.jdbc.JdbcEventStoreConfig;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * An H2 in-memory database, unique per instance, with the event store schema created. Call {@link #close()} when done.
 */
public class TestDatabase implements AutoCloseable {
    private final DriverManagerDataSource dataSource;
    private final DataSourceTransactionManager transactionManager;
    private final JdbcEventStore eventStore;

    private TestDatabase() {
        dataSource = new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000", "sa", "");
        transactionManager = new DataSourceTransactionManager(dataSource);
        eventStore = new JdbcEventStore(dataSource, transactionManager, JdbcEventStoreConfig.defaultConfig().initializeSchema(true));
    }

    public static TestDatabase create() {
        return new TestDatabase();
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public DataSourceTransactionManager transactionManager() {
        return transactionManager;
    }

    public JdbcEventStore eventStore() {
        return eventStore;
    }

    public JdbcTemplate jdbcTemplate() {
        return new JdbcTemplate(dataSource);
    }

    public int count(String table) {
        Integer count = jdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public void close() {
        jdbcTemplate().execute("SHUTDOWN");
    }
}
