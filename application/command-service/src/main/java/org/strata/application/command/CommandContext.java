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

package org.strata.application.command;

import org.strata.aggregate.AggregateRepository;
import org.strata.transaction.UnitOfWork;

import java.util.Objects;

/**
 * The unit of work that a {@link Command} is executed in. Command handlers load and add aggregates through the {@link #repository()}.
 */
public final class CommandContext {
    private final UnitOfWork unitOfWork;
    private final AggregateRepository repository;

    CommandContext(UnitOfWork unitOfWork, AggregateRepository repository) {
        this.unitOfWork = Objects.requireNonNull(unitOfWork, UnitOfWork.class.getSimpleName() + " cannot be null");
        this.repository = Objects.requireNonNull(repository, AggregateRepository.class.getSimpleName() + " cannot be null");
    }

    public UnitOfWork unitOfWork() {
        return unitOfWork;
    }

    public AggregateRepository repository() {
        return repository;
    }
}
