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

import dev.henneberger.vertx.changesource.core.ChangeBatchFetcher;
import dev.henneberger.vertx.changesource.core.LogPosition;
import dev.henneberger.vertx.changesource.core.RawMessage;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and consumes all pending changes with {@code pg_logical_slot_get_binary_changes}.
 */
final class SqlChangeBatchFetcher implements ChangeBatchFetcher {

  private final Connection connection;

  SqlChangeBatchFetcher(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public List<RawMessage> fetch(String slotName, Map<String, String> parameters) throws SQLException {
    List<RawMessage> messages = new ArrayList<>();
    try (PreparedStatement statement = connection.prepareStatement(buildQuery(parameters.size()))) {
      int index = 1;
      statement.setString(index++, slotName);
      for (Map.Entry<String, String> parameter : parameters.entrySet()) {
        statement.setString(index++, parameter.getKey());
        statement.setString(index++, parameter.getValue());
      }
      try (ResultSet rs = statement.executeQuery()) {
        while (rs.next()) {
          messages.add(new RawMessage(
            LogPosition.parse(rs.getString(1)),
            null,
            parseXid(rs.getString(2)),
            rs.getBytes(3)));
        }
      }
    } finally {
      if (!connection.getAutoCommit()) {
        connection.commit();
      }
    }
    return messages;
  }

  // No upper bound on position or count: everything available right now.
  static String buildQuery(int parameterCount) {
    StringBuilder sql = new StringBuilder("SELECT lsn, xid, data FROM pg_logical_slot_get_binary_changes(?, NULL, NULL");
    for (int i = 0; i < parameterCount; i++) {
      sql.append(", ?, ?");
    }
    return sql.append(')').toString();
  }

  private static Long parseXid(String xid) {
    if (xid == null || xid.isBlank()) {
      return null;
    }
    return Long.parseLong(xid);
  }
}
