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
package dev.mars.eventfold.api.error;

import dev.mars.eventfold.api.NonPersistedEventEnvelope;

import java.util.List;

/**
 * The batch was durably stored but handing it to the dispatcher failed.
 *
 * Callers should redeliver {@link #getUndeliveredEvents()} instead of storing them again;
 * storing them again would duplicate the events.
 */
public class DispatchException extends EventStoreException {

    private final List<NonPersistedEventEnvelope> undeliveredEvents;

    public DispatchException(List<NonPersistedEventEnvelope> undeliveredEvents, Throwable cause) {
        super(EventFoldErrorCodes.DISPATCH_FAILED,
            "Stored " + undeliveredEvents.size() + " event(s) but dispatch failed: "
                + (cause != null ? cause.getMessage() : "unknown cause"),
            cause);
        this.undeliveredEvents = List.copyOf(undeliveredEvents);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DISPATCH;
    }

    /**
     * @return The stored batch that still has to be delivered, in original order
     */
    public List<NonPersistedEventEnvelope> getUndeliveredEvents() {
        return undeliveredEvents;
    }
}
