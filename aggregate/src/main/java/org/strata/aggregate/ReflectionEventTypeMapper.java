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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A reflection-based {@link EventTypeMapper} that uses either the qualified or simple name of a payload class
 * as event type. The simple name requires the payload classes to be known up front, since the class cannot be
 * looked up from its simple name.
 */
public class ReflectionEventTypeMapper implements EventTypeMapper {
    private final ClassName className;
    private final Map<String, Class<?>> knownTypes;

    public enum ClassName {
        SIMPLE, QUALIFIED
    }

    private ReflectionEventTypeMapper(ClassName className, Collection<Class<?>> knownTypes) {
        Objects.requireNonNull(className, ClassName.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(knownTypes, "Known types cannot be null");
        this.className = className;
        this.knownTypes = knownTypes.stream().collect(Collectors.toUnmodifiableMap(this::eventType, Function.identity()));
    }

    /**
     * @return An instance of {@link ReflectionEventTypeMapper} that uses the simple name of a class as event type
     */
    public static ReflectionEventTypeMapper simple(Collection<Class<?>> payloadTypes) {
        return new ReflectionEventTypeMapper(ClassName.SIMPLE, payloadTypes);
    }

    public static ReflectionEventTypeMapper simple(Class<?>... payloadTypes) {
        return simple(List.of(payloadTypes));
    }

    /**
     * @return An instance of {@link ReflectionEventTypeMapper} that uses the fully qualified name of a class as event type
     */
    public static ReflectionEventTypeMapper qualified() {
        return new ReflectionEventTypeMapper(ClassName.QUALIFIED, List.of());
    }

    @Override
    public String eventType(Class<?> payloadType) {
        return switch (className) {
            case SIMPLE -> payloadType.getSimpleName();
            case QUALIFIED -> payloadType.getName();
        };
    }

    @Override
    public Class<?> payloadType(String eventType) {
        Class<?> known = knownTypes.get(eventType);
        if (known != null) {
            return known;
        } else if (className == ClassName.SIMPLE) {
            throw new IllegalArgumentException("Unknown event type " + eventType);
        }
        try {
            return Class.forName(eventType);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unknown event type " + eventType, e);
        }
    }
}
