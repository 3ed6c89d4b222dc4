package dev.henneberger.vertx.changesource.core;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory slots with the server's rules: names are unique and an active slot cannot be dropped.
 */
final class FakeSlotCommands implements SlotCommands {

  final Map<String, String> slots = new ConcurrentHashMap<>();
  final Set<String> active = ConcurrentHashMap.newKeySet();
  final AtomicInteger creates = new AtomicInteger();
  final AtomicInteger drops = new AtomicInteger();
  final AtomicInteger dropAttempts = new AtomicInteger();
  volatile Exception createFailure;
  volatile Exception dropFailure;

  @Override
  public SlotStatus status(String slotName) {
    if (!slots.containsKey(slotName)) {
      return SlotStatus.ABSENT;
    }
    return active.contains(slotName) ? SlotStatus.ACTIVE : SlotStatus.IDLE;
  }

  @Override
  public void create(String slotName, String outputPlugin) throws Exception {
    if (createFailure != null) {
      throw createFailure;
    }
    if (slots.putIfAbsent(slotName, outputPlugin) != null) {
      throw new IllegalStateException("replication slot \"" + slotName + "\" already exists");
    }
    creates.incrementAndGet();
  }

  @Override
  public void drop(String slotName) throws Exception {
    dropAttempts.incrementAndGet();
    if (dropFailure != null) {
      throw dropFailure;
    }
    if (!slots.containsKey(slotName)) {
      throw new IllegalStateException("replication slot \"" + slotName + "\" does not exist");
    }
    if (active.contains(slotName)) {
      throw new IllegalStateException("replication slot \"" + slotName + "\" is active");
    }
    slots.remove(slotName);
    drops.incrementAndGet();
  }

  void hold(String slotName) {
    active.add(slotName);
  }

  void release(String slotName) {
    active.remove(slotName);
  }
}
