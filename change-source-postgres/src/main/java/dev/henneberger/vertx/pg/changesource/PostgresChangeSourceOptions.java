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

import dev.henneberger.vertx.changesource.core.ChangeSourceSettings;
import dev.henneberger.vertx.changesource.core.OptionValidation;
import dev.henneberger.vertx.changesource.core.SlotLifecycleManager;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection and slot settings of a PostgreSQL change source.
 */
@DataObject
public class PostgresChangeSourceOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final String DEFAULT_PLUGIN = "pglogical_output";

  private String host;
  private int port;
  private String database;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String slotName;
  private String plugin;
  private boolean streaming;
  private Duration readTimeout;
  private Duration dropTimeout;
  private Duration dropPollInterval;
  private boolean preflightEnabled;

  public PostgresChangeSourceOptions() {
    init();
  }

  public PostgresChangeSourceOptions(JsonObject json) {
    init();
    PostgresChangeSourceOptionsConverter.fromJson(json, this);
  }

  public PostgresChangeSourceOptions(PostgresChangeSourceOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.slotName = other.slotName;
    this.plugin = other.plugin;
    this.streaming = other.streaming;
    this.readTimeout = other.readTimeout;
    this.dropTimeout = other.dropTimeout;
    this.dropPollInterval = other.dropPollInterval;
    this.preflightEnabled = other.preflightEnabled;
  }

  public String getHost() {
    return host;
  }

  public PostgresChangeSourceOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PostgresChangeSourceOptions setPort(Integer port) {
    this.port = port == null ? DEFAULT_PORT : port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PostgresChangeSourceOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PostgresChangeSourceOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PostgresChangeSourceOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  public PostgresChangeSourceOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PostgresChangeSourceOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresChangeSourceOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPlugin() {
    return plugin;
  }

  public PostgresChangeSourceOptions setPlugin(String plugin) {
    this.plugin = plugin;
    return this;
  }

  /**
   * Whether changes are read over the walsender protocol instead of the SQL functions.
   */
  public boolean isStreaming() {
    return streaming;
  }

  public PostgresChangeSourceOptions setStreaming(boolean streaming) {
    this.streaming = streaming;
    return this;
  }

  @GenIgnore
  public Duration getReadTimeout() {
    return readTimeout;
  }

  @GenIgnore
  public PostgresChangeSourceOptions setReadTimeout(Duration readTimeout) {
    this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
    return this;
  }

  @GenIgnore
  public Duration getDropTimeout() {
    return dropTimeout;
  }

  @GenIgnore
  public PostgresChangeSourceOptions setDropTimeout(Duration dropTimeout) {
    this.dropTimeout = Objects.requireNonNull(dropTimeout, "dropTimeout");
    return this;
  }

  @GenIgnore
  public Duration getDropPollInterval() {
    return dropPollInterval;
  }

  @GenIgnore
  public PostgresChangeSourceOptions setDropPollInterval(Duration dropPollInterval) {
    this.dropPollInterval = Objects.requireNonNull(dropPollInterval, "dropPollInterval");
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public PostgresChangeSourceOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresChangeSourceOptionsConverter.toJson(this, json);
    return json;
  }

  public PostgresChangeSourceOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new PostgresChangeSourceOptions(json);
  }

  ChangeSourceSettings toSettings() {
    return new ChangeSourceSettings()
      .setSlotName(slotName)
      .setOutputPlugin(plugin)
      .setReadTimeout(readTimeout)
      .setDropTimeout(dropTimeout);
  }

  void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
    OptionValidation.requireSlotName(slotName);
    OptionValidation.require("plugin", plugin);
    OptionValidation.requirePositive("readTimeout", readTimeout);
    OptionValidation.requirePositive("dropTimeout", dropTimeout);
    OptionValidation.requirePositive("dropPollInterval", dropPollInterval);
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    plugin = DEFAULT_PLUGIN;
    streaming = false;
    readTimeout = ChangeSourceSettings.DEFAULT_READ_TIMEOUT;
    dropTimeout = ChangeSourceSettings.DEFAULT_DROP_TIMEOUT;
    dropPollInterval = SlotLifecycleManager.DEFAULT_POLL_INTERVAL;
    preflightEnabled = false;
  }
}
