package com.gentoro.metabasemcp.exception;

import java.util.function.Function;

/** Utility helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining the top
   * frames in call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Extract a user-facing message from a throwable.
   *
   * <p>Server exceptions already carry a diagnostic message and are reported verbatim; a remote
   * failure found anywhere in the cause chain wins over wrapping messages. Anything else is
   * reported as {@code SimpleName: message}.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }

    Throwable current = t;
    while (current != null) {
      if (current instanceof GatewayException remote) {
        return safeMessage(remote.getMessage());
      }
      current = current.getCause();
    }

    String message = t.getMessage();
    if (t instanceof MetabaseMcpException) {
      return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }
    if (message != null && !message.trim().isEmpty()) {
      return t.getClass().getSimpleName() + ": " + message;
    }
    return t.getClass().getSimpleName();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static MetabaseMcpException rethrowIfUnchecked(
      Throwable t, Function<Throwable, MetabaseMcpException> supplier) {
    if (t instanceof MetabaseMcpException) {
      return (MetabaseMcpException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
