package dev.henneberger.vertx.changesource.core;

import java.util.Objects;

public final class PreflightFailedException extends ChangeSourceException {

  private final PreflightReport report;

  public PreflightFailedException(PreflightReport report, String slotName, AdapterMode mode) {
    super(Objects.requireNonNull(report, "report").describe(), slotName, mode, null);
    this.report = report;
  }

  public PreflightReport report() {
    return report;
  }
}
