package dev.henneberger.vertx.changesource.core;

import java.util.List;
import java.util.Map;

/**
 * Fetches every change currently available on a slot in one round trip, consuming them.
 */
@FunctionalInterface
public interface ChangeBatchFetcher {
  List<RawMessage> fetch(String slotName, Map<String, String> parameters) throws Exception;
}
