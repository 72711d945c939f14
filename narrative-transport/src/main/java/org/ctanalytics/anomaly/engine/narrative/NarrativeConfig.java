package org.ctanalytics.anomaly.engine.narrative;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Optional;

public class NarrativeConfig {
  private static final String NARRATIVE_CONFIG = "anomaly.engine.narrative";
  private static final String URL = "url";
  private static final String TIMEOUT = "timeout";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

  private final String url;
  private final Duration timeout;

  public static NarrativeConfig from(Config appConfig) {
    return new NarrativeConfig(
        appConfig.hasPath(NARRATIVE_CONFIG)
            ? appConfig.getConfig(NARRATIVE_CONFIG)
            : ConfigFactory.empty());
  }

  private NarrativeConfig(Config narrativeConfig) {
    this.url = narrativeConfig.hasPath(URL) ? narrativeConfig.getString(URL) : null;
    this.timeout =
        narrativeConfig.hasPath(TIMEOUT) ? narrativeConfig.getDuration(TIMEOUT) : DEFAULT_TIMEOUT;
  }

  public Optional<String> getUrl() {
    return Optional.ofNullable(url).filter(value -> !value.isBlank());
  }

  public Duration getTimeout() {
    return timeout;
  }

  /** HTTP generator when an endpoint is configured, otherwise one that never answers. */
  public NarrativeGenerator createGenerator() {
    return getUrl()
        .<NarrativeGenerator>map(endpoint -> new HttpNarrativeGenerator(endpoint, timeout))
        .orElseGet(NoOpNarrativeGenerator::new);
  }
}
