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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.changesource.core.ChangeSourceSettings;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PostgresChangeSourceOptionsTest {

  @Test
  void readsFromJsonAndSerializesToJson() {
    JsonObject json = new JsonObject()
      .put("host", "db.internal")
      .put("port", 15432)
      .put("database", "app")
      .put("user", "service")
      .put("passwordEnv", "PG_PASSWORD")
      .put("ssl", true)
      .put("slotName", "app_slot")
      .put("plugin", "test_decoding")
      .put("streaming", true)
      .put("readTimeoutMs", 2500L)
      .put("dropTimeoutMs", 8000L)
      .put("dropPollIntervalMs", 50L)
      .put("preflightEnabled", true);

    PostgresChangeSourceOptions options = new PostgresChangeSourceOptions(json);

    assertEquals("db.internal", options.getHost());
    assertEquals(15432, options.getPort());
    assertEquals("app", options.getDatabase());
    assertEquals("service", options.getUser());
    assertEquals("PG_PASSWORD", options.getPasswordEnv());
    assertTrue(options.getSsl());
    assertEquals("app_slot", options.getSlotName());
    assertEquals("test_decoding", options.getPlugin());
    assertTrue(options.isStreaming());
    assertEquals(Duration.ofMillis(2500), options.getReadTimeout());
    assertEquals(Duration.ofSeconds(8), options.getDropTimeout());
    assertEquals(Duration.ofMillis(50), options.getDropPollInterval());
    assertTrue(options.isPreflightEnabled());

    JsonObject out = options.toJson();
    assertEquals("db.internal", out.getString("host"));
    assertEquals(15432, out.getInteger("port"));
    assertTrue(out.getBoolean("streaming"));
    assertEquals(2500L, out.getLong("readTimeoutMs"));
  }

  @Test
  void defaultsMatchTheHarness() {
    PostgresChangeSourceOptions options = new PostgresChangeSourceOptions();

    assertEquals("localhost", options.getHost());
    assertEquals(5432, options.getPort());
    assertEquals("pglogical_output", options.getPlugin());
    assertFalse(options.isStreaming());
    assertEquals(Duration.ofSeconds(1), options.getReadTimeout());
    assertEquals(Duration.ofSeconds(5), options.getDropTimeout());
    assertEquals(Duration.ofMillis(100), options.getDropPollInterval());
  }

  @Test
  void mergesWithJsonLikeOtherVertxOptions() {
    PostgresChangeSourceOptions base = validOptions();

    PostgresChangeSourceOptions merged = base.merge(new JsonObject()
      .put("host", "replica")
      .put("streaming", true));

    assertEquals("replica", merged.getHost());
    assertTrue(merged.isStreaming());
    assertEquals("slot", merged.getSlotName());
    assertFalse(base.isStreaming());
  }

  @Test
  void carriesSlotAndTimeoutsIntoSettings() {
    ChangeSourceSettings settings = validOptions().setReadTimeout(Duration.ofMillis(300)).toSettings();

    assertEquals("slot", settings.getSlotName());
    assertEquals("pglogical_output", settings.getOutputPlugin());
    assertEquals(Duration.ofMillis(300), settings.getReadTimeout());
  }

  @Test
  void validatesRequiredFields() {
    validOptions().validate();

    assertThrows(IllegalArgumentException.class, () -> validOptions().setDatabase(null).validate());
    assertThrows(IllegalArgumentException.class, () -> validOptions().setPort(0).validate());
    assertThrows(IllegalArgumentException.class, () -> validOptions().setSlotName("Bad-Slot").validate());
    assertThrows(IllegalArgumentException.class, () -> validOptions().setPlugin(" ").validate());
    assertThrows(IllegalArgumentException.class,
      () -> validOptions().setReadTimeout(Duration.ZERO).validate());
  }

  @Test
  void explicitPasswordWinsOverEnvironment() {
    PostgresChangeSourceOptions options = validOptions()
      .setPassword("secret")
      .setPasswordEnv("SOME_UNSET_VARIABLE_FOR_TEST");

    assertEquals("secret", PostgresConnections.resolvePassword(options));
    assertEquals("jdbc:postgresql://localhost:5432/db", PostgresConnections.jdbcUrl(options));
  }

  private static PostgresChangeSourceOptions validOptions() {
    return new PostgresChangeSourceOptions()
      .setHost("localhost")
      .setPort(5432)
      .setDatabase("db")
      .setUser("u")
      .setSlotName("slot");
  }
}
