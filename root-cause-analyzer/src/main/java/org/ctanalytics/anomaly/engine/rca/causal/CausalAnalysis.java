package org.ctanalytics.anomaly.engine.rca.causal;

import java.util.List;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import org.ctanalytics.anomaly.engine.datamodel.CausalEdge;

@SuperBuilder
@Getter
public class CausalAnalysis {
  // unidirectional edges, ascending p-value
  private final List<CausalEdge> ranking;
  private final List<CausalEdge> ambiguous;
}
