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

package org.strata.transaction;

import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

import static java.util.Objects.requireNonNull;

/**
 * Issues {@code SET TRANSACTION READ ONLY} on the connection of the current Spring transaction.
 */
public class JdbcReadOnlyDirective implements ReadOnlyDirective {
    public static final String DEFAULT_STATEMENT = "SET TRANSACTION READ ONLY";

    private final JdbcTemplate jdbcTemplate;
    private final String statement;

    public JdbcReadOnlyDirective(DataSource dataSource) {
        this(dataSource, DEFAULT_STATEMENT);
    }

    public JdbcReadOnlyDirective(DataSource dataSource, String statement) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(statement, "Statement cannot be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.statement = statement;
    }

    @Override
    public void apply() {
        jdbcTemplate.execute(statement);
    }
}
