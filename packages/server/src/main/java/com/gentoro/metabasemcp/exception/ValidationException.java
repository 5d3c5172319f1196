package com.gentoro.metabasemcp.exception;

/** Invalid caller-supplied input, detected before any remote call is made. */
public class ValidationException extends MetabaseMcpException {
  public ValidationException(String message) {
    super(MetabaseMcpErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(MetabaseMcpErrorCode.VALIDATION_ERROR, message, cause);
  }
}
