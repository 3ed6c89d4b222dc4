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

import dev.henneberger.vertx.changesource.core.LogPosition;
import dev.henneberger.vertx.changesource.core.RawMessage;
import dev.henneberger.vertx.changesource.core.ReplicationChannel;
import dev.henneberger.vertx.changesource.core.ReplicationTransportException;
import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.postgresql.PGConnection;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.postgresql.replication.fluent.logical.ChainedLogicalStreamBuilder;

/**
 * {@link ReplicationChannel} over a pgjdbc walsender connection.
 *
 * <p>pgjdbc does not expose the socket, so waiting for readability polls {@code readPending()} at a
 * short interval until a message shows up or the timeout elapses. A message found while waiting is
 * kept for the next {@link #readPending()}.
 */
final class PgReplicationChannel implements ReplicationChannel {

  static final long WAIT_POLL_INTERVAL_MS = 10;

  private final Connection replicationConnection;
  private PGReplicationStream stream;
  private RawMessage buffered;

  PgReplicationChannel(Connection replicationConnection) {
    this.replicationConnection = Objects.requireNonNull(replicationConnection, "replicationConnection");
  }

  @Override
  public void startReplication(String slotName, Map<String, String> options) throws ReplicationTransportException {
    if (stream != null) {
      throw new IllegalStateException("replication already started on slot " + slotName);
    }
    try {
      ChainedLogicalStreamBuilder builder = replicationConnection.unwrap(PGConnection.class)
        .getReplicationAPI()
        .replicationStream()
        .logical()
        .withSlotName(slotName);
      for (Map.Entry<String, String> option : options.entrySet()) {
        builder.withSlotOption(option.getKey(), option.getValue());
      }
      stream = builder.start();
    } catch (SQLException e) {
      throw transportFailure("Could not start replication on slot " + slotName, e);
    }
  }

  @Override
  public RawMessage readPending() throws ReplicationTransportException {
    RawMessage message = buffered;
    if (message != null) {
      buffered = null;
      return message;
    }
    return poll();
  }

  @Override
  public boolean awaitReadable(Duration timeout) throws ReplicationTransportException {
    if (buffered != null) {
      return true;
    }
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      buffered = poll();
      if (buffered != null) {
        return true;
      }
      long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
      if (remainingMs <= 0) {
        return false;
      }
      try {
        Thread.sleep(Math.min(WAIT_POLL_INTERVAL_MS, remainingMs));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ReplicationTransportException("Interrupted while waiting for replication data", null, e);
      }
    }
  }

  private RawMessage poll() throws ReplicationTransportException {
    if (stream == null) {
      throw new IllegalStateException("replication not started");
    }
    try {
      ByteBuffer buffer = stream.readPending();
      if (buffer == null) {
        return null;
      }
      LogSequenceNumber lsn = stream.getLastReceiveLSN();
      return RawMessage.streamed(LogPosition.of(lsn == null ? 0L : lsn.asLong()), copyPayload(buffer));
    } catch (SQLException e) {
      throw transportFailure("Reading from replication stream failed", e);
    }
  }

  @Override
  public void close() throws SQLException {
    buffered = null;
    try {
      PGReplicationStream current = stream;
      stream = null;
      if (current != null && !current.isClosed()) {
        current.close();
      }
    } finally {
      if (!replicationConnection.isClosed()) {
        replicationConnection.close();
      }
    }
  }

  private ReplicationTransportException transportFailure(String message, SQLException error) {
    return new ReplicationTransportException(message, error.getSQLState(), isConnectionClosed(), error);
  }

  private boolean isConnectionClosed() {
    try {
      return replicationConnection.isClosed() || (stream != null && stream.isClosed());
    } catch (SQLException e) {
      return true;
    }
  }

  private static byte[] copyPayload(ByteBuffer buffer) {
    byte[] bytes = new byte[buffer.remaining()];
    buffer.get(bytes);
    return bytes;
  }
}
