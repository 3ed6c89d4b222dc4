package dev.henneberger.vertx.changesource.core;

import java.time.Duration;
import java.util.Map;

/**
 * Dedicated duplex connection streaming changes from a slot.
 *
 * <p>Not thread safe; a single consumer drives it.
 */
public interface ReplicationChannel extends AutoCloseable {

  void startReplication(String slotName, Map<String, String> options) throws ReplicationTransportException;

  /**
   * Returns the next pending message without blocking, or {@code null} when none is buffered.
   */
  RawMessage readPending() throws ReplicationTransportException;

  /**
   * Blocks until a message can be read or the timeout elapses.
   *
   * @return {@code false} if the timeout elapsed with nothing to read
   */
  boolean awaitReadable(Duration timeout) throws ReplicationTransportException;

  @Override
  void close() throws Exception;
}
