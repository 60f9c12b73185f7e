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

/**
 * Storage failure other than a version conflict: I/O, permission, serialization or a
 * malformed record. Never retried by the store layer.
 */
public class RegistryException extends EventStoreException {

    public RegistryException(String message) {
        super(EventFoldErrorCodes.REGISTRY_FAILURE, message);
    }

    public RegistryException(String message, Throwable cause) {
        super(EventFoldErrorCodes.REGISTRY_FAILURE, message, cause);
    }

    public RegistryException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.REGISTRY;
    }
}
