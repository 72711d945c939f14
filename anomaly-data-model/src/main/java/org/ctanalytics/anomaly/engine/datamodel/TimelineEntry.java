package org.ctanalytics.anomaly.engine.datamodel;

import java.time.Instant;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class TimelineEntry {
  private final Instant timestamp;
  private final String feature;
  private final double value;
  private final double deltaFromBaseline;
}
