package dev.henneberger.vertx.changesource.core;

import java.util.List;
import java.util.Objects;

/**
 * Assertions every {@link ChangeSource} implementation is expected to satisfy, for reuse in tests.
 */
public final class ChangeSourceContractKit {

  private ChangeSourceContractKit() {
  }

  public static void assertCleanupIsIdempotent(ChangeSource source) {
    Objects.requireNonNull(source, "source");
    try {
      source.cleanup();
      source.cleanup();
      source.close();
    } catch (RuntimeException e) {
      throw new AssertionError("cleanup() must never throw", e);
    }
    try {
      source.retrieveChanges();
    } catch (IllegalStateException expected) {
      return;
    }
    throw new AssertionError("Expected retrieveChanges() to fail after cleanup()");
  }

  public static void assertNonDecreasingPositions(List<RawMessage> messages) {
    Objects.requireNonNull(messages, "messages");
    for (int i = 1; i < messages.size(); i++) {
      LogPosition previous = messages.get(i - 1).position();
      LogPosition current = messages.get(i).position();
      if (current.compareTo(previous) < 0) {
        throw new AssertionError("Position went back from " + previous + " to " + current + " at index " + i);
      }
    }
  }

  public static void assertPolledBatch(List<RawMessage> batch) {
    assertNonDecreasingPositions(batch);
    for (RawMessage message : batch) {
      if (message.endPosition().isEmpty()) {
        throw new AssertionError("Polled message without end position: " + message);
      }
    }
  }

  public static void assertStreamed(List<RawMessage> messages) {
    assertNonDecreasingPositions(messages);
    for (RawMessage message : messages) {
      if (message.endPosition().isPresent()) {
        throw new AssertionError("Streamed message must not carry an end position: " + message);
      }
    }
  }
}
