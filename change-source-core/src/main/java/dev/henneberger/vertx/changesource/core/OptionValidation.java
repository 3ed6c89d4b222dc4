package dev.henneberger.vertx.changesource.core;

import java.time.Duration;

public final class OptionValidation {

  private OptionValidation() {
  }

  public static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  public static void requirePort(int port) {
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
  }

  public static void requirePositive(String fieldName, Duration value) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(fieldName + " must be > 0");
    }
  }

  public static void requireSlotName(String slotName) {
    require("slotName", slotName);
    // server side rule: lower case letters, numbers and underscore, at most NAMEDATALEN - 1
    if (slotName.length() > 63 || !slotName.matches("[a-z0-9_]+")) {
      throw new IllegalArgumentException(
        "slotName may only contain lower case letters, numbers and underscores (max 63 chars): " + slotName);
    }
  }
}
