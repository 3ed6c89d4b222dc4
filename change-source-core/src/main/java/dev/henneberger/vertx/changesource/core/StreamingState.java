package dev.henneberger.vertx.changesource.core;

public enum StreamingState {
  NOT_STARTED,
  STREAMING,
  CONNECTION_CLOSED,
  PROTOCOL_ERROR,
  CLOSED;

  public boolean isTerminal() {
    return this != NOT_STARTED && this != STREAMING;
  }
}
