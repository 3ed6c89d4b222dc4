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

import dev.henneberger.vertx.changesource.core.SlotCommands;
import dev.henneberger.vertx.changesource.core.SlotStatus;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Slot commands issued as SQL function calls on a regular connection.
 */
class JdbcSlotCommands implements SlotCommands {

  private final Connection connection;

  JdbcSlotCommands(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public SlotStatus status(String slotName) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT active FROM pg_catalog.pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return SlotStatus.ABSENT;
        }
        return rs.getBoolean(1) ? SlotStatus.ACTIVE : SlotStatus.IDLE;
      }
    }
  }

  @Override
  public void create(String slotName, String outputPlugin) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT * FROM pg_create_logical_replication_slot(?, ?)")) {
      statement.setString(1, slotName);
      statement.setString(2, outputPlugin);
      statement.execute();
    }
  }

  @Override
  public void drop(String slotName) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(
      "SELECT pg_drop_replication_slot(?)")) {
      statement.setString(1, slotName);
      statement.execute();
    }
  }
}
