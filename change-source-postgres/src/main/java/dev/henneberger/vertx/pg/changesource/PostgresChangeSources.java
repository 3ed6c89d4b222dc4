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

import dev.henneberger.vertx.changesource.core.AdapterMode;
import dev.henneberger.vertx.changesource.core.ChangeSource;
import dev.henneberger.vertx.changesource.core.ChangeSourceException;
import dev.henneberger.vertx.changesource.core.ChangeSources;
import dev.henneberger.vertx.changesource.core.PollingChangeSource;
import dev.henneberger.vertx.changesource.core.PreflightFailedException;
import dev.henneberger.vertx.changesource.core.PreflightReport;
import dev.henneberger.vertx.changesource.core.SlotLifecycleManager;
import dev.henneberger.vertx.changesource.core.StreamingChangeSource;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point creating PostgreSQL change sources.
 *
 * <p>The polling source reads through {@code pg_logical_slot_get_binary_changes} on a regular
 * connection. The streaming source holds a walsender connection for the replication stream and a
 * regular one to watch and finally drop the slot.
 */
public final class PostgresChangeSources {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresChangeSources.class);

  private PostgresChangeSources() {
  }

  public static ChangeSource create(PostgresChangeSourceOptions options) {
    return create(Objects.requireNonNull(options, "options").isStreaming(), options);
  }

  public static ChangeSource create(boolean streaming, PostgresChangeSourceOptions options) {
    PostgresChangeSourceOptions resolved = new PostgresChangeSourceOptions(Objects.requireNonNull(options, "options"))
      .setStreaming(streaming);
    resolved.validate();

    if (resolved.isPreflightEnabled()) {
      PreflightReport report = preflight(resolved);
      if (!report.ok()) {
        throw new PreflightFailedException(report, resolved.getSlotName(), modeOf(streaming));
      }
    }

    return ChangeSources.select(streaming,
      () -> openPolling(resolved),
      () -> openStreaming(resolved));
  }

  public static Future<ChangeSource> open(Vertx vertx, PostgresChangeSourceOptions options) {
    Objects.requireNonNull(vertx, "vertx");
    PostgresChangeSourceOptions copy = new PostgresChangeSourceOptions(Objects.requireNonNull(options, "options"));
    return vertx.executeBlocking(() -> create(copy), false);
  }

  public static PreflightReport preflight(PostgresChangeSourceOptions options) {
    return new PostgresPreflight(Objects.requireNonNull(options, "options")).run();
  }

  public static Future<PreflightReport> preflight(Vertx vertx, PostgresChangeSourceOptions options) {
    Objects.requireNonNull(vertx, "vertx");
    PostgresChangeSourceOptions copy = new PostgresChangeSourceOptions(Objects.requireNonNull(options, "options"));
    return vertx.executeBlocking(() -> preflight(copy));
  }

  /**
   * Runs {@link ChangeSource#cleanup()} on a worker thread; completes once the slot is released.
   */
  public static Future<Void> cleanup(Vertx vertx, ChangeSource source) {
    Objects.requireNonNull(vertx, "vertx");
    Objects.requireNonNull(source, "source");
    return vertx.executeBlocking(() -> {
      source.cleanup();
      return null;
    }, false);
  }

  private static ChangeSource openPolling(PostgresChangeSourceOptions options) {
    Connection conn = connect(options, AdapterMode.POLLING);
    SlotLifecycleManager slots = new SlotLifecycleManager(
      new JdbcSlotCommands(conn), AdapterMode.POLLING, options.getDropPollInterval());
    return new PollingChangeSource(options.toSettings(), slots, new SqlChangeBatchFetcher(conn), List.of(conn));
  }

  private static ChangeSource openStreaming(PostgresChangeSourceOptions options) {
    Connection conn = connect(options, AdapterMode.LOG_STREAM);
    Connection replConn;
    try {
      replConn = PostgresConnections.openReplicationConnection(options);
    } catch (SQLException e) {
      closeQuietly(conn);
      throw new ChangeSourceException("Could not open replication connection to "
        + PostgresConnections.jdbcUrl(options), options.getSlotName(), AdapterMode.LOG_STREAM, e);
    }

    SlotLifecycleManager slots = new SlotLifecycleManager(
      new WalSenderSlotCommands(conn, replConn), AdapterMode.LOG_STREAM, options.getDropPollInterval());
    return new StreamingChangeSource(options.toSettings(), slots, new PgReplicationChannel(replConn), List.of(conn));
  }

  private static Connection connect(PostgresChangeSourceOptions options, AdapterMode mode) {
    try {
      return PostgresConnections.openStandardConnection(options);
    } catch (SQLException e) {
      throw new ChangeSourceException("Could not connect to " + PostgresConnections.jdbcUrl(options),
        options.getSlotName(), mode, e);
    }
  }

  private static void closeQuietly(Connection conn) {
    try {
      conn.close();
    } catch (SQLException e) {
      LOG.warn("Could not close connection after failed setup", e);
    }
  }

  private static AdapterMode modeOf(boolean streaming) {
    return streaming ? AdapterMode.LOG_STREAM : AdapterMode.POLLING;
  }
}
