package dev.henneberger.vertx.changesource.core;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Change source reading from a long lived replication connection.
 *
 * <p>Replication is started on the first call to {@link #retrieveChanges(DecodingOptions)}; later calls
 * reuse the running stream and ignore their options. The returned sequence never ends on its own.
 * When no message arrives within the read timeout the pull fails with {@link ChangeTimeoutException}
 * instead of waiting longer: callers that expect long idle periods have to catch and decide.
 * A transport failure ends the sequence and leaves the source terminal.
 */
public class StreamingChangeSource extends AbstractChangeSource {

  private static final Logger LOG = LoggerFactory.getLogger(StreamingChangeSource.class);

  private final ReplicationChannel channel;
  private volatile StreamingState state = StreamingState.NOT_STARTED;
  private LogPosition lastPosition = LogPosition.INVALID;

  public StreamingChangeSource(ChangeSourceSettings settings,
                               SlotLifecycleManager slots,
                               ReplicationChannel channel,
                               List<? extends AutoCloseable> resources) {
    super(settings, slots, resources);
    this.channel = Objects.requireNonNull(channel, "channel");
    open();
  }

  @Override
  protected AdapterMode mode() {
    return AdapterMode.LOG_STREAM;
  }

  public StreamingState state() {
    return state;
  }

  public LogPosition lastPosition() {
    return lastPosition;
  }

  @Override
  public Iterator<RawMessage> retrieveChanges(DecodingOptions options) {
    Objects.requireNonNull(options, "options");
    ensureOpen();
    startIfNeeded(options);
    return new MessageIterator();
  }

  private synchronized void startIfNeeded(DecodingOptions options) {
    if (state != StreamingState.NOT_STARTED) {
      return;
    }
    Map<String, String> parameters = options.toParameters();
    try {
      channel.startReplication(slotName(), parameters);
    } catch (ReplicationTransportException e) {
      state = e.connectionClosed() ? StreamingState.CONNECTION_CLOSED : StreamingState.PROTOCOL_ERROR;
      throw new ChangeSourceException("Could not start replication on slot '" + slotName() + "'",
        slotName(), AdapterMode.LOG_STREAM, e);
    }
    state = StreamingState.STREAMING;
    LOG.info("Started replication on slot {} with options {}", slotName(), parameters);
  }

  /**
   * Reads the next message, waiting at most the read timeout for one to arrive.
   *
   * @return the message, or {@code null} once the stream has terminated
   */
  private RawMessage readNext() {
    Duration timeout = settings().getReadTimeout();
    while (state == StreamingState.STREAMING) {
      try {
        RawMessage message = channel.readPending();
        if (message != null) {
          return accept(message);
        }
        LOG.debug("No message pending on slot {}, waiting up to {} ms", slotName(), timeout.toMillis());
        if (!channel.awaitReadable(timeout)) {
          throw new ChangeTimeoutException(slotName(), timeout);
        }
      } catch (ReplicationTransportException e) {
        if (state == StreamingState.CLOSED) {
          return null;
        }
        state = e.connectionClosed() ? StreamingState.CONNECTION_CLOSED : StreamingState.PROTOCOL_ERROR;
        LOG.debug("While retrieving a message from slot {}: sqlstate={}", slotName(), e.errorCode(), e);
        return null;
      }
    }
    return null;
  }

  private RawMessage accept(RawMessage message) {
    RawMessage streamed = message.endPosition().isPresent() || message.transactionId().isPresent()
      ? RawMessage.streamed(message.position(), message.payload())
      : message;
    if (streamed.position().compareTo(lastPosition) < 0) {
      LOG.warn("Slot {} went back from {} to {}", slotName(), lastPosition, streamed.position());
    } else {
      lastPosition = streamed.position();
    }
    LOG.debug("Got {} byte payload at {} from slot {}", streamed.payloadSize(), streamed.position(), slotName());
    return streamed;
  }

  @Override
  protected void detach() {
    StreamingState previous = state;
    state = StreamingState.CLOSED;
    try {
      channel.close();
    } catch (Exception e) {
      LOG.warn("Could not close replication channel of slot {} (state {})", slotName(), previous, e);
    }
  }

  private final class MessageIterator implements Iterator<RawMessage> {

    private RawMessage next;
    private boolean finished;

    @Override
    public boolean hasNext() {
      if (next != null) {
        return true;
      }
      if (finished) {
        return false;
      }
      try {
        next = readNext();
      } catch (ChangeTimeoutException e) {
        finished = true;
        throw e;
      }
      if (next == null) {
        finished = true;
        return false;
      }
      return true;
    }

    @Override
    public RawMessage next() {
      if (!hasNext()) {
        throw new NoSuchElementException("replication stream of slot " + slotName() + " has ended");
      }
      RawMessage message = next;
      next = null;
      return message;
    }
  }
}
