package org.ctanalytics.anomaly.engine.datamodel;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class ContributingFactor {
  private final String feature;
  private final double attributionWeight;
}
