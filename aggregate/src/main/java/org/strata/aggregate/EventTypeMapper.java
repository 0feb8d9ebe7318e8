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

/**
 * Maps payload classes to the event type that is stored in the event store, and back.
 */
public interface EventTypeMapper {

    String eventType(Class<?> payloadType);

    /**
     * @throws IllegalArgumentException if the event type is unknown
     */
    Class<?> payloadType(String eventType);
}
