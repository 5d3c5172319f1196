package com.gentoro.metabasemcp.exception;

import java.util.Collection;
import java.util.List;

/**
 * A tab or dashcard identifier does not exist in the fetched representation. The identifiers that
 * do exist are reported in the message and under the {@code available} context key.
 */
public class NotFoundException extends MetabaseMcpException {
  private final List<Object> available;

  public NotFoundException(String message, Collection<?> available) {
    super(MetabaseMcpErrorCode.NOT_FOUND, message + ". Available: " + List.copyOf(available));
    this.available = List.copyOf(available);
    withContext("available", this.available);
  }

  public List<Object> getAvailable() {
    return available;
  }
}
