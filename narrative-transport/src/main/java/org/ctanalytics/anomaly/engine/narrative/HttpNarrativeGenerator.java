package org.ctanalytics.anomaly.engine.narrative;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.Optional;
import okhttp3.OkHttpClient;
import org.ctanalytics.anomaly.engine.narrative.transport.ObjectMapperProvider;
import org.ctanalytics.anomaly.engine.narrative.transport.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts the payload as JSON and reads the {@code text} field of the reply. Every failure ends in
 * an empty narrative.
 */
public class HttpNarrativeGenerator implements NarrativeGenerator {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpNarrativeGenerator.class);
  private static final String TEXT_FIELD = "text";

  private final String url;
  private final HttpWithJsonSender sender;

  public HttpNarrativeGenerator(String url, Duration timeout) {
    this(url, new HttpWithJsonSender(new OkHttpClient.Builder().callTimeout(timeout).build()));
  }

  @VisibleForTesting
  HttpNarrativeGenerator(String url, HttpWithJsonSender sender) {
    Preconditions.checkArgument(url != null && !url.isBlank(), "narrative url is required");
    this.url = url;
    this.sender = sender;
  }

  @Override
  public Optional<String> explain(NarrativePayload payload) {
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    String jsonString;
    try {
      jsonString = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      LOGGER.error("Failed to serialize narrative payload for {}", payload.getAnomalyId(), e);
      return Optional.empty();
    }

    Optional<String> body = sender.send(url, jsonString);
    if (body.isEmpty()) {
      LOGGER.warn("No narrative received for anomaly {}", payload.getAnomalyId());
      return Optional.empty();
    }
    try {
      JsonNode text = objectMapper.readTree(body.get()).get(TEXT_FIELD);
      if (text == null || !text.isTextual()) {
        LOGGER.warn(
            "Narrative reply for anomaly {} has no text field: {}",
            payload.getAnomalyId(),
            body.get());
        return Optional.empty();
      }
      return Optional.of(text.asText());
    } catch (JsonProcessingException e) {
      LOGGER.warn("Unparseable narrative reply for anomaly {}", payload.getAnomalyId(), e);
      return Optional.empty();
    }
  }
}
