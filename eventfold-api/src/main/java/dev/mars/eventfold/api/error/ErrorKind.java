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
 * Tag carried by every {@link EventStoreException}. Retry decisions are made on the tag.
 */
public enum ErrorKind {

    /** The entity stream was already advanced at store time. Retryable up to a bound. */
    CONFLICT,

    /** Any other storage failure. Never retried. */
    REGISTRY,

    /** The batch was stored but could not be delivered downstream. Never re-persisted. */
    DISPATCH
}
