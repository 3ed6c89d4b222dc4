package dev.henneberger.vertx.changesource.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Change source doing one request/response round trip per call.
 *
 * <p>Each call consumes what it returns: the slot's confirmed position advances on the server, so a
 * second call only sees changes produced after the first. A failed call returns nothing.
 */
public class PollingChangeSource extends AbstractChangeSource {

  private static final Logger LOG = LoggerFactory.getLogger(PollingChangeSource.class);

  private final ChangeBatchFetcher fetcher;

  public PollingChangeSource(ChangeSourceSettings settings,
                             SlotLifecycleManager slots,
                             ChangeBatchFetcher fetcher,
                             List<? extends AutoCloseable> resources) {
    super(settings, slots, resources);
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    open();
  }

  @Override
  protected AdapterMode mode() {
    return AdapterMode.POLLING;
  }

  @Override
  public Iterator<RawMessage> retrieveChanges(DecodingOptions options) {
    Objects.requireNonNull(options, "options");
    ensureOpen();

    Map<String, String> parameters = options.toParameters();
    List<RawMessage> fetched;
    try {
      fetched = fetcher.fetch(slotName(), parameters);
    } catch (Exception e) {
      LOG.debug("Fetching changes from slot {} failed with parameters {}", slotName(), parameters, e);
      throw new ChangeRetrievalException(slotName(), e);
    }

    List<RawMessage> batch = markBatchEnd(fetched == null ? Collections.emptyList() : fetched);
    LOG.debug("Fetched {} changes from slot {}", batch.size(), slotName());
    return batch.iterator();
  }

  private static List<RawMessage> markBatchEnd(List<RawMessage> fetched) {
    if (fetched.isEmpty()) {
      return Collections.emptyList();
    }
    LogPosition end = fetched.get(fetched.size() - 1).position();
    List<RawMessage> batch = new ArrayList<>(fetched.size());
    for (RawMessage message : fetched) {
      batch.add(message.endPosition().isPresent() ? message : message.withEndPosition(end));
    }
    return Collections.unmodifiableList(batch);
  }
}
