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

import dev.henneberger.vertx.changesource.core.PreflightIssue;
import dev.henneberger.vertx.changesource.core.PreflightReport;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks that the server can serve logical decoding to the configured source before any slot is touched.
 */
final class PostgresPreflight {

  private final PostgresChangeSourceOptions options;

  PostgresPreflight(PostgresChangeSourceOptions options) {
    this.options = options;
  }

  PreflightReport run() {
    List<PreflightIssue> issues = new ArrayList<>();

    try (Connection conn = PostgresConnections.openStandardConnection(options)) {
      checkWalLevel(conn, issues);
      checkRolePrivileges(conn, issues);
      checkPositiveSetting(conn, "max_replication_slots", issues, "MAX_REPLICATION_SLOTS_INVALID");
      if (options.isStreaming()) {
        checkPositiveSetting(conn, "max_wal_senders", issues, "MAX_WAL_SENDERS_INVALID");
      }
      checkExistingSlot(conn, issues);
    } catch (Exception e) {
      issues.add(PreflightIssue.error(
        "CONNECTION_FAILED",
        "Could not connect to PostgreSQL: " + e.getMessage(),
        "Verify host, port, database, user, password, and SSL settings."
      ));
    }

    return new PreflightReport(issues);
  }

  private void checkWalLevel(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW wal_level");
         ResultSet rs = statement.executeQuery()) {
      String walLevel = rs.next() ? rs.getString(1) : null;
      if (!"logical".equalsIgnoreCase(walLevel)) {
        issues.add(PreflightIssue.error(
          "WAL_LEVEL_INVALID",
          "wal_level is '" + walLevel + "'",
          "Set wal_level=logical and restart PostgreSQL."
        ));
      }
    }
  }

  private void checkRolePrivileges(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT (rolreplication OR rolsuper) FROM pg_roles WHERE rolname = current_user");
         ResultSet rs = statement.executeQuery()) {
      if (rs.next() && !rs.getBoolean(1)) {
        issues.add(PreflightIssue.error(
          "ROLE_NOT_REPLICATION",
          "Current user does not have replication privileges",
          "Grant REPLICATION privilege or use a superuser role."
        ));
      }
    }
  }

  private void checkPositiveSetting(Connection conn,
                                    String setting,
                                    List<PreflightIssue> issues,
                                    String code) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement("SHOW " + setting);
         ResultSet rs = statement.executeQuery()) {
      if (rs.next()) {
        long value = rs.getLong(1);
        if (value < 1) {
          issues.add(PreflightIssue.error(
            code,
            setting + " is set to " + value,
            "Set " + setting + " to at least 1 and restart PostgreSQL."
          ));
        }
      }
    }
  }

  // A leftover slot is dropped and recreated on open, which fails while another consumer holds it.
  private void checkExistingSlot(Connection conn, List<PreflightIssue> issues) throws SQLException {
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT plugin, active FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, options.getSlotName());
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return;
        }
        String slotPlugin = rs.getString(1);
        if (rs.getBoolean(2)) {
          issues.add(PreflightIssue.error(
            "SLOT_ACTIVE",
            "Replication slot '" + options.getSlotName() + "' is in use by another consumer",
            "Stop the other consumer or pick a different slot name."
          ));
        } else if (!options.getPlugin().equalsIgnoreCase(slotPlugin)) {
          issues.add(PreflightIssue.warning(
            "SLOT_PLUGIN_MISMATCH",
            "Replication slot uses plugin '" + slotPlugin + "' and will be recreated with '"
              + options.getPlugin() + "'",
            null
          ));
        }
      }
    }
  }
}
