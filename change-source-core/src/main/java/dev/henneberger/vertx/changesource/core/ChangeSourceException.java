package dev.henneberger.vertx.changesource.core;

import java.sql.SQLException;

/**
 * Base failure of a change source, carrying the slot, the mode and the server error code if any.
 */
public class ChangeSourceException extends IllegalStateException {

  private final String slotName;
  private final AdapterMode mode;
  private final String errorCode;

  public ChangeSourceException(String message, String slotName, AdapterMode mode, Throwable cause) {
    super(message, cause);
    this.slotName = slotName;
    this.mode = mode;
    this.errorCode = errorCodeOf(cause);
  }

  public String slotName() {
    return slotName;
  }

  public AdapterMode mode() {
    return mode;
  }

  public String errorCode() {
    return errorCode;
  }

  static String errorCodeOf(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof SQLException && ((SQLException) current).getSQLState() != null) {
        return ((SQLException) current).getSQLState();
      }
      if (current instanceof ReplicationTransportException
        && ((ReplicationTransportException) current).errorCode() != null) {
        return ((ReplicationTransportException) current).errorCode();
      }
      if (current instanceof ChangeSourceException && ((ChangeSourceException) current).errorCode != null) {
        return ((ChangeSourceException) current).errorCode;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return null;
  }
}
