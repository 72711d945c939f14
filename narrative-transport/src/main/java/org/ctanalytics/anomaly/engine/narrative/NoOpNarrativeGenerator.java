package org.ctanalytics.anomaly.engine.narrative;

import java.util.Optional;

/** Used when no narrative endpoint is configured. */
public class NoOpNarrativeGenerator implements NarrativeGenerator {

  @Override
  public Optional<String> explain(NarrativePayload payload) {
    return Optional.empty();
  }
}
