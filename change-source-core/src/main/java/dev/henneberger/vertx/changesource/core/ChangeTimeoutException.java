package dev.henneberger.vertx.changesource.core;

import java.time.Duration;

public final class ChangeTimeoutException extends ChangeSourceException {

  private final Duration timeout;

  public ChangeTimeoutException(String slotName, Duration timeout) {
    super("Server didn't send an expected message on slot '" + slotName + "' within "
      + timeout.toMillis() + " ms", slotName, AdapterMode.LOG_STREAM, null);
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}
