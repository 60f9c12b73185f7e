package dev.mars.eventfold.pg;

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

import dev.mars.eventfold.api.error.ErrorKind;
import dev.mars.eventfold.api.error.EventFoldErrorCodes;
import dev.mars.eventfold.api.error.EventStoreException;
import dev.mars.eventfold.api.error.RegistryException;
import dev.mars.eventfold.test.categories.TestCategories;
import io.vertx.pgclient.PgException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("PostgreSQL Error Translation Tests")
class PgErrorTranslationTest {

    @Test
    @DisplayName("Should report connection failures as unavailability")
    void testUnavailable() {
        EventStoreException refused = PgEventRegistry.translate(
            new CompletionException(new ConnectException("Connection refused")), "Store failed");
        EventStoreException adminShutdown = PgEventRegistry.translate(
            new PgException("terminating connection", "FATAL", "57P01", null), "Store failed");

        assertEquals(ErrorKind.REGISTRY, refused.kind());
        assertEquals(EventFoldErrorCodes.REGISTRY_UNAVAILABLE, refused.errorCode());
        assertEquals(EventFoldErrorCodes.REGISTRY_UNAVAILABLE, adminShutdown.errorCode());
    }

    @Test
    @DisplayName("Should report other server errors as registry failures with their SQLSTATE")
    void testServerFailure() {
        EventStoreException denied = PgEventRegistry.translate(
            new PgException("permission denied for table", "ERROR", "42501", null), "Store failed");

        assertEquals(EventFoldErrorCodes.REGISTRY_FAILURE, denied.errorCode());
        assertTrue(denied.getMessage().contains("42501"));
        assertInstanceOf(PgException.class, denied.getCause());
    }

    @Test
    @DisplayName("Should pass registry errors through unchanged")
    void testPassThrough() {
        RegistryException malformed = new RegistryException(EventFoldErrorCodes.MALFORMED_RECORD, "bad row", null);

        assertSame(malformed, PgEventRegistry.translate(malformed, "Query failed"));
    }
}
