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

import org.strata.aggregate.DomainEvent;
import org.strata.aggregate.EventDispatchTable;
import org.strata.projection.persistor.Persistor;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the records of one or more {@link ProjectionTable}s from events. A projector doesn't know where its records are stored, it
 * reads and writes them through its {@link Persistor}, which is a {@link org.strata.projection.persistor.JdbcPersistor} while the
 * application runs and a replay optimized one while a migration rebuilds the tables.
 *
 * @param <P> The type of the projector itself
 */
public abstract class Projector<P extends Projector<P>> {
    private final Persistor persistor;

    protected Projector(Persistor persistor) {
        this.persistor = Objects.requireNonNull(persistor, Persistor.class.getSimpleName() + " cannot be null");
    }

    protected abstract EventDispatchTable<P> dispatchTable();

    public String name() {
        return getClass().getSimpleName();
    }

    /**
     * @return {@code true} if the event was handled, {@code false} if this projector ignores it
     */
    @SuppressWarnings("unchecked")
    public final boolean handle(DomainEvent event) {
        return dispatchTable().dispatch((P) this, event);
    }

    public final boolean handles(Class<?> payloadType) {
        return dispatchTable().handles(payloadType);
    }

    public final Set<Class<?>> handledEventTypes() {
        return dispatchTable().handledTypes();
    }

    protected final Persistor persistor() {
        return persistor;
    }

    protected final void createRecord(ProjectionTable table, Map<String, ?> values) {
        persistor.createRecord(table, values);
    }

    protected final void updateRecords(ProjectionTable table, Map<String, ?> where, Map<String, ?> values) {
        persistor.updateRecords(table, where, values);
    }

    protected final void createOrUpdateRecord(ProjectionTable table, Map<String, ?> where, Map<String, ?> values) {
        persistor.createOrUpdateRecord(table, where, values);
    }

    protected final Optional<Map<String, Object>> getRecord(ProjectionTable table, Map<String, ?> where) {
        return persistor.getRecord(table, where);
    }

    protected final List<Map<String, Object>> findRecords(ProjectionTable table, Map<String, ?> where) {
        return persistor.findRecords(table, where);
    }

    protected final void deleteRecords(ProjectionTable table, Map<String, ?> where) {
        persistor.deleteRecords(table, where);
    }
}
