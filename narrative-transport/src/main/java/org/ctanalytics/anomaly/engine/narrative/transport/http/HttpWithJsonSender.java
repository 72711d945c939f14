package org.ctanalytics.anomaly.engine.narrative.transport.http;

import java.io.IOException;
import java.util.Optional;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts a JSON string to a URL and hands back the body of a successful reply. Stateless apart
 * from the underlying client.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private final OkHttpClient client;

  public HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public Optional<String> send(String url, String jsonString) {
    LOGGER.debug("Sending json string to {}: {}", url, jsonString);
    RequestBody body = RequestBody.create(jsonString, JSON);
    Request request = new Request.Builder().url(url).post(body).build();
    try (Response response = client.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        LOGGER.error(
            "Error response from {}. Response Code: {}, Response Message: {}",
            url,
            response.code(),
            response.message());
        return Optional.empty();
      }
      ResponseBody responseBody = response.body();
      return responseBody == null ? Optional.empty() : Optional.of(responseBody.string());
    } catch (IOException ioe) {
      LOGGER.error("Unable to send json string to URL: {}", url, ioe);
    }
    return Optional.empty();
  }
}
