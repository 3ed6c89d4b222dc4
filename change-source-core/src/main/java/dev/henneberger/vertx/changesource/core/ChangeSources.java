package dev.henneberger.vertx.changesource.core;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

public final class ChangeSources {

  private ChangeSources() {
  }

  /**
   * Builds the streaming source when {@code streaming} is set, the polling one otherwise. The result
   * is only ever seen as a {@link ChangeSource}.
   */
  public static ChangeSource select(boolean streaming,
                                    Supplier<? extends ChangeSource> polling,
                                    Supplier<? extends ChangeSource> replicationStream) {
    Objects.requireNonNull(polling, "polling");
    Objects.requireNonNull(replicationStream, "replicationStream");
    ChangeSource source = streaming ? replicationStream.get() : polling.get();
    return Objects.requireNonNull(source, "source");
  }

  /**
   * Pulls up to {@code max} messages. Stops early when a finite sequence runs out; propagates
   * a streaming timeout.
   */
  public static List<RawMessage> take(Iterator<RawMessage> changes, int max) {
    Objects.requireNonNull(changes, "changes");
    if (max < 0) {
      throw new IllegalArgumentException("max must be >= 0");
    }
    List<RawMessage> taken = new ArrayList<>(Math.min(max, 64));
    while (taken.size() < max && changes.hasNext()) {
      taken.add(changes.next());
    }
    return taken;
  }
}
