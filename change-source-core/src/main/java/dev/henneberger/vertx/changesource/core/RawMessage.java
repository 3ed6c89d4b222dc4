package dev.henneberger.vertx.changesource.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A single undecoded change as delivered by either transport.
 *
 * <p>The payload is produced by the output plugin and is handed to a decoder untouched.
 * {@code endPosition} and {@code transactionId} are only known for batches fetched through SQL;
 * messages read from a replication stream carry neither.
 */
public final class RawMessage {

  private final LogPosition position;
  private final LogPosition endPosition;
  private final Long transactionId;
  private final byte[] payload;

  public RawMessage(LogPosition position, LogPosition endPosition, Long transactionId, byte[] payload) {
    this.position = Objects.requireNonNull(position, "position");
    this.endPosition = endPosition;
    this.transactionId = transactionId;
    this.payload = Objects.requireNonNull(payload, "payload").clone();
  }

  public static RawMessage streamed(LogPosition position, byte[] payload) {
    return new RawMessage(position, null, null, payload);
  }

  public RawMessage withEndPosition(LogPosition endPosition) {
    return new RawMessage(position, endPosition, transactionId, payload);
  }

  public LogPosition position() {
    return position;
  }

  public Optional<LogPosition> endPosition() {
    return Optional.ofNullable(endPosition);
  }

  public OptionalLong transactionId() {
    return transactionId == null ? OptionalLong.empty() : OptionalLong.of(transactionId);
  }

  public byte[] payload() {
    return payload.clone();
  }

  public int payloadSize() {
    return payload.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawMessage)) {
      return false;
    }
    RawMessage that = (RawMessage) o;
    return position.equals(that.position)
      && Objects.equals(endPosition, that.endPosition)
      && Objects.equals(transactionId, that.transactionId)
      && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(position, endPosition, transactionId);
    return 31 * result + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "RawMessage{position=" + position
      + ", endPosition=" + endPosition
      + ", transactionId=" + transactionId
      + ", payloadSize=" + payload.length + '}';
  }
}
