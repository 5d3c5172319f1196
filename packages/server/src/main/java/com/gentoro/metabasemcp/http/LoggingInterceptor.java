package com.gentoro.metabasemcp.http;

import java.io.IOException;
import java.util.Set;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Logs outgoing Metabase calls. Credentials headers are never written to the log. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(LoggingInterceptor.class);

  static final Set<String> REDACTED_HEADERS = Set.of("x-api-key", "x-metabase-session");

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "➡️ Sending {} {}\nHeaders:\n{}", request.method(), request.url(), redact(request.headers()));
      log.trace("Request body:\n{}", bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      long durationMs = (System.nanoTime() - startTime) / 1_000_000;
      log.warn(
          "{} {} failed after {}ms: {}",
          request.method(),
          request.url(),
          durationMs,
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    long durationMs = (System.nanoTime() - startTime) / 1_000_000;
    log.debug(
        "⬅️ Received {} for {} {} in {} ms",
        response.code(),
        request.method(),
        request.url(),
        durationMs);
    if (log.isTraceEnabled()) {
      String responseBody = "";
      try {
        ResponseBody peeked = response.peekBody(Long.MAX_VALUE);
        responseBody = peeked.string();
      } catch (IOException e) {
        log.debug("Could not read response body", e);
      }
      log.trace("Response body:\n{}", responseBody.isEmpty() ? "[empty]" : responseBody);
    }
    return response;
  }

  static String redact(Headers headers) {
    StringBuilder sb = new StringBuilder();
    headers.forEach(
        pair -> {
          String value =
              REDACTED_HEADERS.contains(pair.getFirst().toLowerCase()) ? "***" : pair.getSecond();
          sb.append(pair.getFirst()).append(": ").append(value).append('\n');
        });
    return sb.toString();
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
