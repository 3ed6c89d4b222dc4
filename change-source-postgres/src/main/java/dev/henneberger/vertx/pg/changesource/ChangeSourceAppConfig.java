/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.pg.changesource;

import java.util.Map;
import java.util.Objects;

/**
 * Change source settings read from the libpq style environment.
 *
 * <p>{@code PGLOGICALTEST_USEWALSENDER} set to any non-empty value selects the streaming source.
 */
public final class ChangeSourceAppConfig {

  private final String pgHost;
  private final int pgPort;
  private final String pgDatabase;
  private final String pgUser;
  private final String pgPasswordEnv;
  private final boolean ssl;
  private final boolean useWalSender;
  private final String plugin;
  private final String slotName;

  private ChangeSourceAppConfig(String pgHost,
                                int pgPort,
                                String pgDatabase,
                                String pgUser,
                                String pgPasswordEnv,
                                boolean ssl,
                                boolean useWalSender,
                                String plugin,
                                String slotName) {
    this.pgHost = pgHost;
    this.pgPort = pgPort;
    this.pgDatabase = pgDatabase;
    this.pgUser = pgUser;
    this.pgPasswordEnv = pgPasswordEnv;
    this.ssl = ssl;
    this.useWalSender = useWalSender;
    this.plugin = plugin;
    this.slotName = slotName;
  }

  public static ChangeSourceAppConfig fromEnv(String slotName) {
    return fromMap(System.getenv(), slotName);
  }

  static ChangeSourceAppConfig fromMap(Map<String, String> env, String slotName) {
    Objects.requireNonNull(env, "env");
    Objects.requireNonNull(slotName, "slotName");

    String host = envOrDefault(env, "PGHOST", PostgresChangeSourceOptions.DEFAULT_HOST);
    int port = intEnvOrDefault(env, "PGPORT", PostgresChangeSourceOptions.DEFAULT_PORT);
    String database = envOrDefault(env, "PGDATABASE", "postgres");
    String user = envOrDefault(env, "PGUSER", "postgres");
    String passwordEnv = envOrDefault(env, "PG_PASSWORD_ENV", "PGPASSWORD");
    boolean ssl = boolEnvOrDefault(env, "PGSSL", false);
    String walSender = env.get("PGLOGICALTEST_USEWALSENDER");
    boolean useWalSender = walSender != null && !walSender.isEmpty();
    String plugin = envOrDefault(env, "PG_OUTPUT_PLUGIN", PostgresChangeSourceOptions.DEFAULT_PLUGIN);

    return new ChangeSourceAppConfig(host, port, database, user, passwordEnv, ssl, useWalSender, plugin, slotName);
  }

  public String pgHost() {
    return pgHost;
  }

  public int pgPort() {
    return pgPort;
  }

  public String pgDatabase() {
    return pgDatabase;
  }

  public String pgUser() {
    return pgUser;
  }

  public String pgPasswordEnv() {
    return pgPasswordEnv;
  }

  public boolean ssl() {
    return ssl;
  }

  public boolean useWalSender() {
    return useWalSender;
  }

  public String plugin() {
    return plugin;
  }

  public PostgresChangeSourceOptions toChangeSourceOptions() {
    return new PostgresChangeSourceOptions()
      .setHost(pgHost)
      .setPort(pgPort)
      .setDatabase(pgDatabase)
      .setUser(pgUser)
      .setPasswordEnv(pgPasswordEnv)
      .setSsl(ssl)
      .setPlugin(plugin)
      .setStreaming(useWalSender)
      .setSlotName(slotName);
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }
}
