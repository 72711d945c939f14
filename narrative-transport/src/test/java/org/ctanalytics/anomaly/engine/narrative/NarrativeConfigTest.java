package org.ctanalytics.anomaly.engine.narrative;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class NarrativeConfigTest {

  @Test
  void defaultsToNoOpGenerator() {
    NarrativeConfig config = NarrativeConfig.from(ConfigFactory.empty());

    assertTrue(config.getUrl().isEmpty());
    assertEquals(Duration.ofSeconds(15), config.getTimeout());
    assertInstanceOf(NoOpNarrativeGenerator.class, config.createGenerator());
    assertTrue(config.createGenerator().explain(NarrativeTestData.payload()).isEmpty());
  }

  @Test
  void configuredUrlUsesHttpGenerator() {
    NarrativeConfig config =
        NarrativeConfig.from(
            ConfigFactory.parseMap(
                Map.of(
                    "anomaly.engine.narrative.url", "http://localhost:9000/explain",
                    "anomaly.engine.narrative.timeout", "3s")));

    assertEquals(Optional.of("http://localhost:9000/explain"), config.getUrl());
    assertEquals(Duration.ofSeconds(3), config.getTimeout());
    assertInstanceOf(HttpNarrativeGenerator.class, config.createGenerator());
  }

  @Test
  void payloadCarriesWireNames() {
    NarrativePayload payload = NarrativeTestData.payload();

    assertEquals(NarrativePayload.SCHEMA_VERSION, payload.getSchemaVersion());
    assertEquals("critical", payload.getSeverity());
    assertEquals(2, payload.getContributingFactors().size());
  }
}
