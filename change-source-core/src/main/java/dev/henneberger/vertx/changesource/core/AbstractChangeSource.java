package dev.henneberger.vertx.changesource.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slot setup and teardown shared by both transports.
 */
public abstract class AbstractChangeSource implements ChangeSource {

  private static final Logger LOG = LoggerFactory.getLogger(AbstractChangeSource.class);

  private final ChangeSourceSettings settings;
  private final SlotLifecycleManager slots;
  private final List<AutoCloseable> resources;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  protected AbstractChangeSource(ChangeSourceSettings settings,
                                 SlotLifecycleManager slots,
                                 List<? extends AutoCloseable> resources) {
    this.settings = new ChangeSourceSettings(Objects.requireNonNull(settings, "settings"));
    this.settings.validate();
    this.slots = Objects.requireNonNull(slots, "slots");
    this.resources = new ArrayList<>(Objects.requireNonNull(resources, "resources"));
  }

  protected abstract AdapterMode mode();

  /**
   * Called during cleanup before the slot is dropped. The consumer must let go of the slot here.
   */
  protected void detach() {
  }

  /**
   * Creates the slot. Must be the last statement of a subclass constructor; on failure every resource
   * is released and the exception propagates so no half constructed source escapes.
   */
  protected final void open() {
    try {
      slots.ensureSlot(settings.getSlotName(), settings.getOutputPlugin());
    } catch (RuntimeException e) {
      closed.set(true);
      detachQuietly();
      releaseResources();
      throw e;
    }
  }

  @Override
  public final String slotName() {
    return settings.getSlotName();
  }

  protected final ChangeSourceSettings settings() {
    return settings;
  }

  protected final SlotLifecycleManager slots() {
    return slots;
  }

  protected final boolean isClosed() {
    return closed.get();
  }

  protected final void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("change source for slot " + slotName() + " is closed");
    }
  }

  @Override
  public final void cleanup() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    detachQuietly();
    try {
      slots.dropWhenIdleQuietly(settings.getSlotName(), settings.getDropTimeout());
    } catch (RuntimeException e) {
      LOG.warn("Unexpected failure dropping slot {} ({})", slotName(), mode(), e);
    }
    releaseResources();
  }

  private void detachQuietly() {
    try {
      detach();
    } catch (RuntimeException e) {
      LOG.warn("Could not detach {} consumer from slot {}", mode(), slotName(), e);
    }
  }

  private void releaseResources() {
    for (AutoCloseable resource : resources) {
      try {
        resource.close();
      } catch (Exception e) {
        LOG.warn("Could not close {} resource of slot {}", mode(), slotName(), e);
      }
    }
  }
}
