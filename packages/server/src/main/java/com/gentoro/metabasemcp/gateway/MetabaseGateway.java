package com.gentoro.metabasemcp.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.MetabaseSettings;
import com.gentoro.metabasemcp.exception.GatewayException;
import com.gentoro.metabasemcp.http.OkHttpFactory;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.io.IOException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * OkHttp based {@link Gateway}.
 *
 * <p>Uses the {@code X-API-KEY} header when an API key is configured. Otherwise logs in once via
 * {@code POST /api/session} and sends the returned token as {@code X-Metabase-Session}. A 401 on a
 * session-authenticated call drops the cached token so the next call logs in again; the failing
 * call itself is reported, not retried.
 */
public class MetabaseGateway implements Gateway, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(MetabaseGateway.class);

  static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final MetabaseSettings settings;
  private final OkHttpClient client;
  private final Object sessionLock = new Object();
  private volatile String sessionToken;

  public MetabaseGateway(MetabaseSettings settings) {
    this(settings, OkHttpFactory.create(settings.timeout()));
  }

  public MetabaseGateway(MetabaseSettings settings, OkHttpClient client) {
    this.settings = settings;
    this.client = client;
    log.info(
        "Using {} authentication against {}",
        settings.usesApiKey() ? "api_key" : "session",
        settings.url());
  }

  @Override
  public JsonNode send(HttpMethod method, String path, JsonNode body) {
    Request.Builder builder = new Request.Builder().url(apiUrl(path));
    builder.header("Content-Type", "application/json");
    authenticate(builder);

    if (method == HttpMethod.GET) {
      builder.get();
    } else {
      String payload = body == null ? "{}" : body.toString();
      builder.method(method.name(), RequestBody.create(payload, JSON));
    }

    log.debug("Making {} request to {}", method, path);
    try (Response response = client.newCall(builder.build()).execute()) {
      String text = readBody(response);
      if (!response.isSuccessful()) {
        if (response.code() == 401 && !settings.usesApiKey()) {
          sessionToken = null;
        }
        String message =
            "API request failed with status " + response.code() + ": " + text;
        log.warn("{} {} -> {}", method, path, message);
        throw new GatewayException(response.code(), text, message);
      }
      log.debug("Successful response from {}", path);
      return JacksonUtility.toJsonNode(text);
    } catch (IOException e) {
      throw new GatewayException(
          "API request " + method + " " + path + " failed: " + describe(e), e);
    }
  }

  /** Session token for email/password authentication, logging in when none is cached. */
  String sessionToken() {
    String token = sessionToken;
    if (token != null) {
      return token;
    }
    synchronized (sessionLock) {
      if (sessionToken == null) {
        sessionToken = login();
      }
      return sessionToken;
    }
  }

  private String login() {
    ObjectNode credentials = JacksonUtility.getJsonMapper().createObjectNode();
    credentials.put("username", settings.userEmail());
    credentials.put("password", settings.password());

    Request request =
        new Request.Builder()
            .url(settings.url() + "/api/session")
            .post(RequestBody.create(credentials.toString(), JSON))
            .build();
    try (Response response = client.newCall(request).execute()) {
      String text = readBody(response);
      if (!response.isSuccessful()) {
        throw new GatewayException(
            response.code(),
            text,
            "Authentication failed: " + response.code() + " - " + text);
      }
      JsonNode session = JacksonUtility.toJsonNode(text);
      String id = session.path("id").asText(null);
      if (id == null || id.isBlank()) {
        throw new GatewayException(response.code(), text, "Authentication response had no session id");
      }
      log.info("Successfully obtained session token");
      return id;
    } catch (IOException e) {
      throw new GatewayException("Authentication request failed: " + describe(e), e);
    }
  }

  private void authenticate(Request.Builder builder) {
    if (settings.usesApiKey()) {
      builder.header("X-API-KEY", settings.apiKey());
    } else {
      builder.header("X-Metabase-Session", sessionToken());
    }
  }

  private String apiUrl(String path) {
    String normalized = path.startsWith("/") ? path : "/" + path;
    return settings.url() + "/api" + normalized;
  }

  private static String readBody(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }

  private static String describe(IOException e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }

  @Override
  public void close() {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
