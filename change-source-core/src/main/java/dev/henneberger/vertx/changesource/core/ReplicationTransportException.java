package dev.henneberger.vertx.changesource.core;

public class ReplicationTransportException extends Exception {

  private final String errorCode;
  private final boolean connectionClosed;

  public ReplicationTransportException(String message, String errorCode, Throwable cause) {
    this(message, errorCode, false, cause);
  }

  public ReplicationTransportException(String message, String errorCode, boolean connectionClosed, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.connectionClosed = connectionClosed;
  }

  /**
   * Server provided error code (SQLSTATE for PostgreSQL), may be {@code null}.
   */
  public String errorCode() {
    return errorCode;
  }

  public boolean connectionClosed() {
    return connectionClosed;
  }
}
