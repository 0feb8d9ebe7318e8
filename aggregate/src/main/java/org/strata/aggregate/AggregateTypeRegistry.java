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

package org.strata.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lookup of {@link AggregateType}s by name and by class.
 */
public class AggregateTypeRegistry {
    private final Map<String, AggregateType<?>> byName;
    private final Map<Class<?>, AggregateType<?>> byClass;

    private AggregateTypeRegistry(Map<String, AggregateType<?>> byName, Map<Class<?>, AggregateType<?>> byClass) {
        this.byName = Collections.unmodifiableMap(byName);
        this.byClass = Collections.unmodifiableMap(byClass);
    }

    public static AggregateTypeRegistry of(AggregateType<?>... aggregateTypes) {
        AggregateTypeRegistry registry = new AggregateTypeRegistry(Map.of(), Map.of());
        for (AggregateType<?> aggregateType : aggregateTypes) {
            registry = registry.register(aggregateType);
        }
        return registry;
    }

    /**
     * @return A new registry that also contains {@code aggregateType}
     */
    public AggregateTypeRegistry register(AggregateType<?> aggregateType) {
        Objects.requireNonNull(aggregateType, AggregateType.class.getSimpleName() + " cannot be null");
        if (byName.containsKey(aggregateType.name())) {
            throw new IllegalArgumentException("Aggregate type " + aggregateType.name() + " is already registered");
        }
        if (byClass.containsKey(aggregateType.type())) {
            throw new IllegalArgumentException(aggregateType.type().getName() + " is already registered");
        }
        Map<String, AggregateType<?>> newByName = new LinkedHashMap<>(byName);
        newByName.put(aggregateType.name(), aggregateType);
        Map<Class<?>, AggregateType<?>> newByClass = new LinkedHashMap<>(byClass);
        newByClass.put(aggregateType.type(), aggregateType);
        return new AggregateTypeRegistry(newByName, newByClass);
    }

    public Optional<AggregateType<?>> byName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    @SuppressWarnings("unchecked")
    public <A extends AggregateRoot<A>> AggregateType<A> byClass(Class<A> type) {
        AggregateType<?> aggregateType = byClass.get(type);
        if (aggregateType == null) {
            throw new IllegalArgumentException("Aggregate type " + type.getName() + " is not registered");
        }
        return (AggregateType<A>) aggregateType;
    }

    AggregateType<?> byInstance(AggregateRoot<?> aggregate) {
        AggregateType<?> aggregateType = byClass.get(aggregate.getClass());
        if (aggregateType == null) {
            throw new IllegalArgumentException("Aggregate type " + aggregate.getClass().getName() + " is not registered");
        }
        return aggregateType;
    }
}
