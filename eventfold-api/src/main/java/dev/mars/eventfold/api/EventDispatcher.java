package dev.mars.eventfold.api;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Downstream fan-out of stored events to their handlers.
 *
 * Invoked once per successfully stored batch, with the batch in its original order and
 * its pre-persistence form.
 */
@FunctionalInterface
public interface EventDispatcher {

    /**
     * Delivers a stored batch.
     *
     * @param events The events that were just stored
     * @return A CompletableFuture that completes when delivery has been handed off
     */
    CompletableFuture<Void> dispatch(List<NonPersistedEventEnvelope> events);
}
