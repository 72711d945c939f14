package org.ctanalytics.anomaly.engine.narrative;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpNarrativeGeneratorTest {

  private MockWebServer mockWebServer;
  private String url;

  @BeforeEach
  public void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    url = mockWebServer.url("/narrative").toString();
  }

  @AfterEach
  public void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void returnsTextOfReply() throws InterruptedException, IOException {
    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .addHeader("Content-Type", "application/json")
            .setBody("{\"text\": \"CPU saturation drove the latency spike.\"}"));

    Optional<String> narrative =
        new HttpNarrativeGenerator(url, Duration.ofSeconds(5))
            .explain(NarrativeTestData.payload());

    assertEquals(Optional.of("CPU saturation drove the latency spike."), narrative);
    assertEquals(1, mockWebServer.getRequestCount());

    RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
    assertEquals("POST", request.getMethod());
    JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
    assertEquals("1.0", body.get("schema_version").asText());
    assertEquals("anomaly-1", body.get("anomaly_id").asText());
    assertEquals("critical", body.get("severity").asText());
    assertEquals("cpu_usage", body.get("primary_cause").get("feature").asText());
    assertEquals(
        0.3, body.get("contributing_factors").get(1).get("attribution_weight").asDouble());
    assertEquals(
        "2024-03-04T10:14:00Z", body.get("timeline").get(0).get("timestamp").asText());
    assertEquals(41.0, body.get("timeline").get(0).get("delta_from_baseline").asDouble());
    assertTrue(body.has("low_causal_confidence"));
    assertTrue(!body.has("anomalyId") && !body.has("lowCausalConfidence"));
  }

  @Test
  void errorStatusGivesEmptyNarrative() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));

    assertTrue(
        new HttpNarrativeGenerator(url, Duration.ofSeconds(5))
            .explain(NarrativeTestData.payload())
            .isEmpty());
  }

  @Test
  void replyWithoutTextGivesEmptyNarrative() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"summary\": 1}"));
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("not json"));

    HttpNarrativeGenerator generator = new HttpNarrativeGenerator(url, Duration.ofSeconds(5));
    assertTrue(generator.explain(NarrativeTestData.payload()).isEmpty());
    assertTrue(generator.explain(NarrativeTestData.payload()).isEmpty());
  }

  @Test
  void slowReplyTimesOut() {
    // loads the client and serializer classes so only the call itself is timed below
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"text\": \"ok\"}"));
    assertEquals(
        Optional.of("ok"),
        new HttpNarrativeGenerator(url, Duration.ofSeconds(5))
            .explain(NarrativeTestData.payload()));

    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody("{\"text\": \"late\"}")
            .setHeadersDelay(5, TimeUnit.SECONDS));
    Duration timeout = Duration.ofMillis(200);
    HttpNarrativeGenerator generator = new HttpNarrativeGenerator(url, timeout);
    NarrativePayload payload = NarrativeTestData.payload();

    long start = System.nanoTime();
    Optional<String> narrative = generator.explain(payload);
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(narrative.isEmpty());
    assertTrue(elapsedMillis < 10 * timeout.toMillis(), "took " + elapsedMillis + "ms");
  }
}
