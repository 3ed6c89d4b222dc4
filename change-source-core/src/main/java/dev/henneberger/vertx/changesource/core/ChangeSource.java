package dev.henneberger.vertx.changesource.core;

import java.util.Iterator;

/**
 * Source of raw logical decoding messages from one replication slot.
 *
 * <p>Implementations are driven by a single consumer. Messages of one source are returned in
 * non-decreasing {@link RawMessage#position()} order.
 */
public interface ChangeSource extends AutoCloseable {

  /**
   * Returns pending changes. Depending on the transport the sequence is either a finite batch of
   * what is available now, or an open ended sequence that blocks while waiting for the next change.
   */
  Iterator<RawMessage> retrieveChanges(DecodingOptions options);

  default Iterator<RawMessage> retrieveChanges() {
    return retrieveChanges(new DecodingOptions());
  }

  String slotName();

  /**
   * Releases connections and drops the slot. Safe to call more than once; never throws.
   */
  void cleanup();

  @Override
  default void close() {
    cleanup();
  }
}
