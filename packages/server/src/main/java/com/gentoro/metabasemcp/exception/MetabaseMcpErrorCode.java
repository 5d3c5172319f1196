package com.gentoro.metabasemcp.exception;

/** Stable error codes reported alongside every {@link MetabaseMcpException}. */
public enum MetabaseMcpErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  NETWORK_ERROR,
  VALIDATION_ERROR,
  NOT_FOUND,
  REMOTE_ERROR
}
