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

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import org.postgresql.PGConnection;

/**
 * Slot commands for the streaming source: create and drop go through the replication protocol while
 * the walsender connection is open. Once it is closed (a connection in COPY BOTH mode cannot be used
 * for anything else), drop falls back to SQL on the regular connection.
 */
final class WalSenderSlotCommands extends JdbcSlotCommands {

  private final Connection replicationConnection;

  WalSenderSlotCommands(Connection connection, Connection replicationConnection) {
    super(connection);
    this.replicationConnection = Objects.requireNonNull(replicationConnection, "replicationConnection");
  }

  @Override
  public void create(String slotName, String outputPlugin) throws SQLException {
    replicationConnection.unwrap(PGConnection.class)
      .getReplicationAPI()
      .createReplicationSlot()
      .logical()
      .withSlotName(slotName)
      .withOutputPlugin(outputPlugin)
      .make();
  }

  @Override
  public void drop(String slotName) throws SQLException {
    if (replicationConnection.isClosed()) {
      super.drop(slotName);
      return;
    }
    replicationConnection.unwrap(PGConnection.class)
      .getReplicationAPI()
      .dropReplicationSlot(slotName);
  }
}
