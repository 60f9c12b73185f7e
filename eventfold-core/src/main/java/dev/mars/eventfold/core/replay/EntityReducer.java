package dev.mars.eventfold.core.replay;

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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.eventfold.api.EventEnvelope;

/**
 * Folds one event into the state of an entity.
 */
@FunctionalInterface
public interface EntityReducer {

    /**
     * @param currentState The state before the event, or null if the entity has no state yet
     * @param event The next event of the entity
     * @return The state after the event, or null if the event removes the entity
     */
    JsonNode reduce(JsonNode currentState, EventEnvelope event);
}
