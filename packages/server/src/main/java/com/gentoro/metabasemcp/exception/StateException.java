package com.gentoro.metabasemcp.exception;

/** A component was used before it was initialized or after it was shut down. */
public class StateException extends MetabaseMcpException {
  public StateException(String message) {
    super(MetabaseMcpErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(MetabaseMcpErrorCode.STATE_ERROR, message, cause);
  }
}
