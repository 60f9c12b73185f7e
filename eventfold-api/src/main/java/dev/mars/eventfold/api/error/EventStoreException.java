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

import java.util.Objects;

/**
 * Base class of the tagged EventFold error hierarchy.
 *
 * Every subclass reports a fixed {@link ErrorKind} and a stable error code from
 * {@link EventFoldErrorCodes}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public abstract class EventStoreException extends RuntimeException {

    private final String errorCode;

    protected EventStoreException(String errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    protected EventStoreException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    /**
     * @return The kind of this failure
     */
    public abstract ErrorKind kind();

    /**
     * @return The stable error code, e.g. EFERR0001
     */
    public String errorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + ", " + kind() + "]: " + getMessage();
    }
}
