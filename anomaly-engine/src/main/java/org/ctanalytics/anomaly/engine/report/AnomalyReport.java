package org.ctanalytics.anomaly.engine.report;

import java.util.Optional;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.ctanalytics.anomaly.engine.datamodel.AnomalyRecord;
import org.ctanalytics.anomaly.engine.datamodel.RootCauseResult;

/** Everything handed to persistence for one anomalous evaluation. */
@SuperBuilder
@Getter
@ToString
public class AnomalyReport {
  private final AnomalyRecord record;
  private final RootCauseResult rootCause;
  // null when the narrative collaborator had nothing to say
  private final String narrative;

  public Optional<String> narrative() {
    return Optional.ofNullable(narrative);
  }
}
