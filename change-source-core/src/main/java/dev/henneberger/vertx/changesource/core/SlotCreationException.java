package dev.henneberger.vertx.changesource.core;

public final class SlotCreationException extends ChangeSourceException {

  public SlotCreationException(String slotName, String outputPlugin, AdapterMode mode, Throwable cause) {
    super("Could not create replication slot '" + slotName + "' with plugin '" + outputPlugin + "'",
      slotName, mode, cause);
  }
}
