package org.ctanalytics.anomaly.engine.datamodel;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class CausalEdge {
  private final String causeFeature;
  private final String effectFeature;
  private final int lag;
  private final double pValue;
  private final CausalDirection direction;
}
