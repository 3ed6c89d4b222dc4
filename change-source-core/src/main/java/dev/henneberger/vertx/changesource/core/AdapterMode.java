package dev.henneberger.vertx.changesource.core;

public enum AdapterMode {
  POLLING,
  LOG_STREAM
}
