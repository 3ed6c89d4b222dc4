package dev.henneberger.vertx.changesource.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SlotLifecycleManagerTest {

  private static final String SLOT = "test";

  private final FakeSlotCommands commands = new FakeSlotCommands();
  private final SlotLifecycleManager manager =
    new SlotLifecycleManager(commands, AdapterMode.POLLING, Duration.ofMillis(20));
  private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

  @AfterEach
  void shutdown() {
    scheduler.shutdownNow();
  }

  @Test
  void createsMissingSlot() {
    manager.ensureSlot(SLOT, "pglogical_output");

    assertTrue(manager.exists(SLOT));
    assertEquals("pglogical_output", commands.slots.get(SLOT));
    assertEquals(0, commands.dropAttempts.get());
  }

  @Test
  void ensuringTwiceRecreatesInsteadOfDuplicating() {
    manager.ensureSlot(SLOT, "pglogical_output");
    manager.ensureSlot(SLOT, "pglogical_output");

    assertEquals(1, commands.slots.size());
    assertEquals(2, commands.creates.get());
    assertEquals(1, commands.drops.get());
  }

  @Test
  void leftoverDropFailureIsNotFatalByItself() {
    commands.slots.put(SLOT, "old_plugin");
    commands.dropFailure = new SQLException("permission denied", "42501");

    // the drop is attempted and logged; creation then collides with the leftover
    SlotCreationException error = assertThrows(SlotCreationException.class,
      () -> manager.ensureSlot(SLOT, "pglogical_output"));

    assertEquals(1, commands.dropAttempts.get());
    assertEquals(SLOT, error.slotName());
    assertTrue(error.getCause().getMessage().contains("already exists"));
  }

  @Test
  void creationFailureCarriesServerErrorCode() {
    commands.createFailure = new SQLException("must be superuser or replication role", "42501");

    SlotCreationException error = assertThrows(SlotCreationException.class,
      () -> manager.ensureSlot(SLOT, "pglogical_output"));

    assertEquals("42501", error.errorCode());
    assertEquals(AdapterMode.POLLING, error.mode());
    assertFalse(manager.exists(SLOT));
  }

  @Test
  void dropsIdleSlotRightAway() {
    manager.ensureSlot(SLOT, "pglogical_output");

    long started = System.nanoTime();
    manager.dropWhenIdle(SLOT, Duration.ofSeconds(5));
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertFalse(manager.exists(SLOT));
    assertTrue(elapsedMs < 1000, "took " + elapsedMs + " ms");
  }

  @Test
  void waitsForConsumerToReleaseSlot() {
    manager.ensureSlot(SLOT, "pglogical_output");
    commands.hold(SLOT);
    scheduler.schedule(() -> commands.release(SLOT), 300, TimeUnit.MILLISECONDS);

    long started = System.nanoTime();
    manager.dropWhenIdle(SLOT, Duration.ofSeconds(3));
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertFalse(manager.exists(SLOT));
    assertTrue(elapsedMs >= 250, "dropped after " + elapsedMs + " ms");
    assertTrue(elapsedMs < 3000, "dropped after " + elapsedMs + " ms");
  }

  @Test
  void givesUpOnBusySlotAndLeavesItInPlace() {
    manager.ensureSlot(SLOT, "pglogical_output");
    commands.hold(SLOT);

    SlotBusyTimeoutException error = assertThrows(SlotBusyTimeoutException.class,
      () -> manager.dropWhenIdle(SLOT, Duration.ofMillis(300)));

    assertEquals(Duration.ofMillis(300), error.waited());
    assertEquals(SlotStatus.ACTIVE, manager.status(SLOT));
    assertEquals(0, commands.drops.get());
  }

  @Test
  void missingSlotNeedsNoDrop() {
    manager.dropWhenIdle(SLOT, Duration.ofMillis(100));

    assertEquals(0, commands.dropAttempts.get());
  }

  @Test
  void quietDropReportsInsteadOfThrowing() {
    manager.ensureSlot(SLOT, "pglogical_output");
    commands.hold(SLOT);

    assertFalse(manager.dropWhenIdleQuietly(SLOT, Duration.ofMillis(100)));
    assertTrue(manager.exists(SLOT));

    commands.release(SLOT);
    assertTrue(manager.dropWhenIdleQuietly(SLOT, Duration.ofMillis(100)));
  }

  @Test
  void rejectsNonPositivePollInterval() {
    assertThrows(IllegalArgumentException.class,
      () -> new SlotLifecycleManager(commands, AdapterMode.POLLING, Duration.ZERO));
  }
}
