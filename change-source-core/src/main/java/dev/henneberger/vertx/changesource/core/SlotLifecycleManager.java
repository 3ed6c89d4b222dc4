package dev.henneberger.vertx.changesource.core;

import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and tears down the replication slot a change source reads from.
 *
 * <p>Setup is strict: any failure while creating the slot aborts with {@link SlotCreationException}.
 * Teardown waits for the slot to be released by its consumer, because the server refuses to drop an
 * active slot and a walsender may still be disconnecting when cleanup begins.
 */
public class SlotLifecycleManager {

  private static final Logger LOG = LoggerFactory.getLogger(SlotLifecycleManager.class);

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

  private final SlotCommands commands;
  private final AdapterMode mode;
  private final Duration pollInterval;

  public SlotLifecycleManager(SlotCommands commands, AdapterMode mode) {
    this(commands, mode, DEFAULT_POLL_INTERVAL);
  }

  public SlotLifecycleManager(SlotCommands commands, AdapterMode mode, Duration pollInterval) {
    this.commands = Objects.requireNonNull(commands, "commands");
    this.mode = Objects.requireNonNull(mode, "mode");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be > 0");
    }
  }

  /**
   * Drops a leftover slot of the same name, if any, then creates a fresh one bound to the plugin.
   */
  public void ensureSlot(String slotName, String outputPlugin) {
    Objects.requireNonNull(slotName, "slotName");
    Objects.requireNonNull(outputPlugin, "outputPlugin");

    SlotStatus status;
    try {
      status = commands.status(slotName);
    } catch (Exception e) {
      throw new SlotCreationException(slotName, outputPlugin, mode, e);
    }

    if (status != SlotStatus.ABSENT) {
      try {
        commands.drop(slotName);
        LOG.debug("Dropped leftover replication slot {} ({})", slotName, status);
      } catch (Exception e) {
        LOG.warn("Attempt to drop leftover slot {} failed, creating anyway", slotName, e);
      }
    }

    try {
      commands.create(slotName, outputPlugin);
    } catch (Exception e) {
      throw new SlotCreationException(slotName, outputPlugin, mode, e);
    }
    LOG.info("Created replication slot {} with plugin {} for {} source", slotName, outputPlugin, mode);
  }

  public boolean exists(String slotName) {
    return status(slotName) != SlotStatus.ABSENT;
  }

  public SlotStatus status(String slotName) {
    Objects.requireNonNull(slotName, "slotName");
    try {
      return commands.status(slotName);
    } catch (Exception e) {
      throw new ChangeSourceException("Could not read status of slot '" + slotName + "'", slotName, mode, e);
    }
  }

  /**
   * Waits for the slot to become idle and drops it.
   *
   * @throws SlotBusyTimeoutException if the slot is still active after {@code maxWait}; the slot is left in place
   */
  public void dropWhenIdle(String slotName, Duration maxWait) {
    Objects.requireNonNull(slotName, "slotName");
    Objects.requireNonNull(maxWait, "maxWait");

    long deadline = System.nanoTime() + maxWait.toNanos();
    while (true) {
      SlotStatus status = status(slotName);
      if (status == SlotStatus.ABSENT) {
        LOG.debug("Slot {} already gone", slotName);
        return;
      }
      if (status == SlotStatus.IDLE && tryDrop(slotName)) {
        LOG.info("Dropped replication slot {}", slotName);
        return;
      }

      long remainingNanos = deadline - System.nanoTime();
      if (remainingNanos <= 0) {
        throw new SlotBusyTimeoutException(slotName, mode, maxWait);
      }
      pause(slotName, Math.min(pollInterval.toNanos(), remainingNanos));
    }
  }

  /**
   * Cleanup variant of {@link #dropWhenIdle(String, Duration)} that logs instead of throwing.
   *
   * @return whether the slot is known to be gone
   */
  public boolean dropWhenIdleQuietly(String slotName, Duration maxWait) {
    try {
      dropWhenIdle(slotName, maxWait);
      return true;
    } catch (ChangeSourceException e) {
      LOG.warn("Attempt to drop slot {} ({}) failed, sqlstate={}", slotName, mode, e.errorCode(), e);
      return false;
    } catch (RuntimeException e) {
      LOG.warn("Attempt to drop slot {} ({}) failed", slotName, mode, e);
      return false;
    }
  }

  // The slot can be picked up again between the status check and the drop; keep waiting in that case.
  private boolean tryDrop(String slotName) {
    try {
      commands.drop(slotName);
      return true;
    } catch (Exception e) {
      SlotStatus after = status(slotName);
      if (after == SlotStatus.ABSENT) {
        return true;
      }
      if (after == SlotStatus.ACTIVE) {
        LOG.debug("Slot {} became active again before drop, waiting", slotName);
        return false;
      }
      throw new ChangeSourceException("Could not drop slot '" + slotName + "'", slotName, mode, e);
    }
  }

  private void pause(String slotName, long nanos) {
    try {
      Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChangeSourceException("Interrupted while waiting for slot '" + slotName + "'", slotName, mode, e);
    }
  }
}
