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
 * Standard error codes for EventFold failures.
 *
 * Error codes follow the format EFERRxxxx where xxxx is a 4-digit number.
 * Codes are grouped by category:
 * - 0001-0049: Concurrency errors
 * - 0050-0099: Registry errors
 * - 0100-0149: Dispatch errors
 */
public final class EventFoldErrorCodes {

    private EventFoldErrorCodes() {
        // Constants class
    }

    // ========== Concurrency Errors (0001-0049) ==========

    /** The entity stream was advanced past the expected version */
    public static final String UNEXPECTED_VERSION = "EFERR0001";

    // ========== Registry Errors (0050-0099) ==========

    /** Generic registry failure */
    public static final String REGISTRY_FAILURE = "EFERR0050";

    /** The registry could not be reached */
    public static final String REGISTRY_UNAVAILABLE = "EFERR0051";

    /** A record could not be serialized or deserialized */
    public static final String MALFORMED_RECORD = "EFERR0052";

    /** The registry has been closed */
    public static final String REGISTRY_CLOSED = "EFERR0053";

    // ========== Dispatch Errors (0100-0149) ==========

    /** The batch was stored but dispatch failed */
    public static final String DISPATCH_FAILED = "EFERR0100";
}
