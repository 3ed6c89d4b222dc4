package dev.henneberger.vertx.changesource.core;

public enum SlotStatus {
  ABSENT,
  IDLE,
  ACTIVE
}
