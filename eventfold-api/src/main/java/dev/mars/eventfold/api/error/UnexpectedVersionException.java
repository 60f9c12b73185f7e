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

import dev.mars.eventfold.api.EnvelopeKind;

/**
 * Optimistic concurrency conflict: another writer already stored a record of the same
 * kind for the entity at or past the version being written.
 *
 * The store layer retries this a bounded number of times. Resolving a persistent conflict
 * means re-deriving the version from fresh state, which only the event producer can do.
 */
public class UnexpectedVersionException extends EventStoreException {

    private final EnvelopeKind envelopeKind;
    private final String entityTypeName;
    private final String entityID;
    private final long attemptedVersion;

    public UnexpectedVersionException(EnvelopeKind envelopeKind, String entityTypeName, String entityID,
                                      long attemptedVersion) {
        this(envelopeKind, entityTypeName, entityID, attemptedVersion, null);
    }

    public UnexpectedVersionException(EnvelopeKind envelopeKind, String entityTypeName, String entityID,
                                      long attemptedVersion, Throwable cause) {
        super(EventFoldErrorCodes.UNEXPECTED_VERSION,
            String.format("Unexpected version %d for %s of %s with ID %s: stream already advanced",
                attemptedVersion, envelopeKind.value(), entityTypeName, entityID),
            cause);
        this.envelopeKind = envelopeKind;
        this.entityTypeName = entityTypeName;
        this.entityID = entityID;
        this.attemptedVersion = attemptedVersion;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }

    public EnvelopeKind getEnvelopeKind() { return envelopeKind; }
    public String getEntityTypeName() { return entityTypeName; }
    public String getEntityID() { return entityID; }
    public long getAttemptedVersion() { return attemptedVersion; }
}
