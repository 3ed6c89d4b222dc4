package dev.henneberger.vertx.changesource.core;

/**
 * Server side operations on a named replication slot.
 */
public interface SlotCommands {
  SlotStatus status(String slotName) throws Exception;
  void create(String slotName, String outputPlugin) throws Exception;
  void drop(String slotName) throws Exception;
}
