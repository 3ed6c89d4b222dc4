package dev.henneberger.vertx.changesource.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ChangeSourcesTest {

  private final FakeSlotCommands commands = new FakeSlotCommands();
  private final AtomicInteger pollingBuilt = new AtomicInteger();
  private final AtomicInteger streamingBuilt = new AtomicInteger();

  @Test
  void flagPicksStreamingSource() {
    ChangeSource source = ChangeSources.select(true, this::polling, this::streaming);
    try {
      assertInstanceOf(StreamingChangeSource.class, source);
      assertEquals(0, pollingBuilt.get());
      assertEquals(1, streamingBuilt.get());
    } finally {
      source.cleanup();
    }
  }

  @Test
  void defaultsToPollingSource() {
    ChangeSource source = ChangeSources.select(false, this::polling, this::streaming);
    try {
      assertInstanceOf(PollingChangeSource.class, source);
      assertEquals(1, pollingBuilt.get());
      assertEquals(0, streamingBuilt.get());
      assertEquals("selected", source.slotName());
    } finally {
      source.cleanup();
    }
  }

  @Test
  void takeStopsAtLimitOrEnd() {
    List<RawMessage> three = List.of(message(1), message(2), message(3));

    assertEquals(2, ChangeSources.take(three.iterator(), 2).size());
    assertEquals(3, ChangeSources.take(three.iterator(), 10).size());
    assertEquals(0, ChangeSources.take(Collections.emptyIterator(), 10).size());
    assertThrows(IllegalArgumentException.class, () -> ChangeSources.take(three.iterator(), -1));
  }

  private ChangeSource polling() {
    pollingBuilt.incrementAndGet();
    return new PollingChangeSource(settings(), new SlotLifecycleManager(commands, AdapterMode.POLLING),
      (slot, params) -> Collections.emptyList(), List.of());
  }

  private ChangeSource streaming() {
    streamingBuilt.incrementAndGet();
    return new StreamingChangeSource(settings(), new SlotLifecycleManager(commands, AdapterMode.LOG_STREAM),
      new FakeReplicationChannel(commands, 0), List.of());
  }

  private static ChangeSourceSettings settings() {
    return new ChangeSourceSettings()
      .setSlotName("selected")
      .setOutputPlugin("pglogical_output")
      .setDropTimeout(Duration.ofSeconds(1));
  }

  private static RawMessage message(long lsn) {
    return RawMessage.streamed(LogPosition.of(lsn), "m".getBytes(StandardCharsets.UTF_8));
  }
}
