package dev.henneberger.vertx.changesource.core;

import java.time.Duration;

public final class SlotBusyTimeoutException extends ChangeSourceException {

  private final Duration waited;

  public SlotBusyTimeoutException(String slotName, AdapterMode mode, Duration waited) {
    super("Timed out after " + waited.toMillis() + " ms waiting for slot '" + slotName + "' to become unused",
      slotName, mode, null);
    this.waited = waited;
  }

  public Duration waited() {
    return waited;
  }
}
