package com.gentoro.metabasemcp.exception;

/**
 * The remote platform answered with a non-success status, or the call never produced a response.
 *
 * <p>Status {@code 0} means no HTTP response was received (timeout, refused connection, ...).
 * The body is kept raw; callers never interpret it.
 */
public class GatewayException extends MetabaseMcpException {
  private final int status;
  private final String body;

  public GatewayException(int status, String body, String message) {
    super(MetabaseMcpErrorCode.REMOTE_ERROR, message);
    this.status = status;
    this.body = body == null ? "" : body;
    withContext("status", status);
  }

  public GatewayException(String message, Throwable cause) {
    super(MetabaseMcpErrorCode.REMOTE_ERROR, message, cause);
    this.status = 0;
    this.body = "";
    withContext("status", 0);
  }

  public int getStatus() {
    return status;
  }

  public String getBody() {
    return body;
  }
}
