package org.ctanalytics.anomaly.engine.narrative;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.ctanalytics.anomaly.engine.datamodel.AnomalyRecord;
import org.ctanalytics.anomaly.engine.datamodel.RootCauseResult;

/**
 * Versioned request sent to the narrative collaborator, serialized in snake_case by {@code
 * ObjectMapperProvider}. Changing the shape means bumping {@link #SCHEMA_VERSION}.
 */
@SuperBuilder
@Getter
@ToString
public class NarrativePayload {
  public static final String SCHEMA_VERSION = "1.0";

  private final String schemaVersion;
  private final String anomalyId;
  private final String source;
  private final String severity;
  private final double confidence;
  private final Cause primaryCause;
  private final boolean lowCausalConfidence;
  private final List<Factor> contributingFactors;
  private final List<Event> timeline;

  public static NarrativePayload from(AnomalyRecord record, RootCauseResult rootCause) {
    return NarrativePayload.builder()
        .schemaVersion(SCHEMA_VERSION)
        .anomalyId(record.getId())
        .source(record.getSource())
        .severity(record.getSeverity() == null ? null : record.getSeverity().wireName())
        .confidence(record.getConfidence())
        .primaryCause(
            new Cause(
                rootCause.getPrimaryCause().getFeature(),
                rootCause.getPrimaryCause().getConfidence()))
        .lowCausalConfidence(rootCause.isLowCausalConfidence())
        .contributingFactors(
            rootCause.getContributingFactors().stream()
                .map(factor -> new Factor(factor.getFeature(), factor.getAttributionWeight()))
                .collect(ImmutableList.toImmutableList()))
        .timeline(
            rootCause.getTimeline().stream()
                .map(
                    entry ->
                        new Event(
                            entry.getTimestamp(),
                            entry.getFeature(),
                            entry.getValue(),
                            entry.getDeltaFromBaseline()))
                .collect(Collectors.toUnmodifiableList()))
        .build();
  }

  @Getter
  public static class Cause {
    private final String feature;
    private final double confidence;

    Cause(String feature, double confidence) {
      this.feature = feature;
      this.confidence = confidence;
    }
  }

  @Getter
  public static class Factor {
    private final String feature;
    private final double attributionWeight;

    Factor(String feature, double attributionWeight) {
      this.feature = feature;
      this.attributionWeight = attributionWeight;
    }
  }

  @Getter
  public static class Event {
    private final Instant timestamp;
    private final String feature;
    private final double value;
    private final double deltaFromBaseline;

    Event(Instant timestamp, String feature, double value, double deltaFromBaseline) {
      this.timestamp = timestamp;
      this.feature = feature;
      this.value = value;
      this.deltaFromBaseline = deltaFromBaseline;
    }
  }
}
