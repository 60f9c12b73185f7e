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

/**
 * Discriminator stored with every record in the event registry.
 */
public enum EnvelopeKind {

    EVENT("event"),
    SNAPSHOT("snapshot");

    private final String value;

    EnvelopeKind(String value) {
        this.value = value;
    }

    /**
     * Gets the value persisted in the registry for this kind.
     *
     * @return "event" or "snapshot"
     */
    public String value() {
        return value;
    }

    /**
     * Resolves a persisted discriminator value.
     *
     * @param value The stored value
     * @return The matching kind
     * @throws IllegalArgumentException if the value is unknown
     */
    public static EnvelopeKind fromValue(String value) {
        for (EnvelopeKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown envelope kind: " + value);
    }
}
