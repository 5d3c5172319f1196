package com.gentoro.metabasemcp.exception;

/** Local listener problems (binding, starting or stopping the HTTP server). */
public class NetworkException extends MetabaseMcpException {
  public NetworkException(String message) {
    super(MetabaseMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(MetabaseMcpErrorCode.NETWORK_ERROR, message, cause);
  }
}
