package dev.henneberger.vertx.changesource.core;

public final class ChangeRetrievalException extends ChangeSourceException {

  public ChangeRetrievalException(String slotName, Throwable cause) {
    super("Could not retrieve changes from slot '" + slotName + "'", slotName, AdapterMode.POLLING, cause);
  }
}
