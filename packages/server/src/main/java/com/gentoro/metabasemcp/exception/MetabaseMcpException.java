package com.gentoro.metabasemcp.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for the server.
 *
 * <p>Every failure carries a {@link MetabaseMcpErrorCode} and an optional context map with the
 * identifiers that help diagnose it (dashboard id, available tab ids, HTTP status, ...).
 */
public class MetabaseMcpException extends RuntimeException {
  private final MetabaseMcpErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public MetabaseMcpException(MetabaseMcpErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public MetabaseMcpException(MetabaseMcpErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public MetabaseMcpErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic value and return {@code this} for chaining. */
  public MetabaseMcpException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
