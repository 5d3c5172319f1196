package com.gentoro.metabasemcp.exception;

/** Missing or malformed configuration. */
public class ConfigException extends MetabaseMcpException {
  public ConfigException(String message) {
    super(MetabaseMcpErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(MetabaseMcpErrorCode.CONFIG_ERROR, message, cause);
  }
}
