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

import dev.mars.eventfold.core.config.EventFoldConfiguration;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Connection and table settings of the PostgreSQL event registry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class PgRegistryConfig {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final int poolSize;
    private final String tableName;

    private PgRegistryConfig(Builder builder) {
        this.host = Objects.requireNonNull(builder.host, "Host cannot be null");
        this.port = builder.port;
        this.database = Objects.requireNonNull(builder.database, "Database cannot be null");
        this.username = Objects.requireNonNull(builder.username, "Username cannot be null");
        this.password = builder.password != null ? builder.password : "";
        this.poolSize = builder.poolSize;
        this.tableName = Objects.requireNonNull(builder.tableName, "Table name cannot be null");

        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535, was " + port);
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, was " + poolSize);
        }
        requireValidTableName(tableName);
    }

    /**
     * The table name is spliced into SQL text, so only plain identifiers are accepted.
     */
    static String requireValidTableName(String tableName) {
        Objects.requireNonNull(tableName, "Table name cannot be null");
        if (!TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Table name must be a plain SQL identifier: " + tableName);
        }
        return tableName;
    }

    /**
     * Reads the {@code eventfold.pg.*} settings.
     */
    public static PgRegistryConfig fromConfiguration(EventFoldConfiguration configuration) {
        return builder()
            .host(configuration.getString(EventFoldConfiguration.PG_HOST, "localhost"))
            .port(configuration.getInt(EventFoldConfiguration.PG_PORT, 5432))
            .database(configuration.getString(EventFoldConfiguration.PG_DATABASE, "eventfold"))
            .username(configuration.getString(EventFoldConfiguration.PG_USERNAME, "eventfold"))
            .password(configuration.getString(EventFoldConfiguration.PG_PASSWORD, ""))
            .poolSize(configuration.getInt(EventFoldConfiguration.PG_POOL_SIZE, 8))
            .tableName(configuration.getString(EventFoldConfiguration.PG_TABLE, "eventfold_envelopes"))
            .build();
    }

    // Getters
    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public int getPoolSize() { return poolSize; }
    public String getTableName() { return tableName; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 5432;
        private String database = "eventfold";
        private String username = "eventfold";
        private String password = "";
        private int poolSize = 8;
        private String tableName = "eventfold_envelopes";

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public PgRegistryConfig build() {
            return new PgRegistryConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PgRegistryConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", database='" + database + '\'' +
                ", username='" + username + '\'' +
                ", poolSize=" + poolSize +
                ", tableName='" + tableName + '\'' +
                '}';
    }
}
