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

import io.vertx.core.json.JsonObject;
import java.time.Duration;

final class PostgresChangeSourceOptionsConverter {

  private PostgresChangeSourceOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresChangeSourceOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("database")) {
      options.setDatabase(json.getString("database"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("plugin")) {
      options.setPlugin(json.getString("plugin"));
    }
    if (json.containsKey("streaming")) {
      options.setStreaming(json.getBoolean("streaming", false));
    }
    if (json.getValue("readTimeoutMs") != null) {
      options.setReadTimeout(Duration.ofMillis(json.getLong("readTimeoutMs")));
    }
    if (json.getValue("dropTimeoutMs") != null) {
      options.setDropTimeout(Duration.ofMillis(json.getLong("dropTimeoutMs")));
    }
    if (json.getValue("dropPollIntervalMs") != null) {
      options.setDropPollInterval(Duration.ofMillis(json.getLong("dropPollIntervalMs")));
    }
    if (json.containsKey("preflightEnabled")) {
      options.setPreflightEnabled(json.getBoolean("preflightEnabled", false));
    }
  }

  static void toJson(PostgresChangeSourceOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("database", options.getDatabase());
    json.put("user", options.getUser());
    json.put("password", options.getPassword());
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.getSsl());
    json.put("slotName", options.getSlotName());
    json.put("plugin", options.getPlugin());
    json.put("streaming", options.isStreaming());
    json.put("readTimeoutMs", options.getReadTimeout().toMillis());
    json.put("dropTimeoutMs", options.getDropTimeout().toMillis());
    json.put("dropPollIntervalMs", options.getDropPollInterval().toMillis());
    json.put("preflightEnabled", options.isPreflightEnabled());
  }
}
