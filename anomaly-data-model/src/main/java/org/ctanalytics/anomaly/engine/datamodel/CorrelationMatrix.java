package org.ctanalytics.anomaly.engine.datamodel;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.tuple.Pair;

/** Symmetric pairwise association matrix, keyed by feature pair in schema order. */
public class CorrelationMatrix {

  private final ImmutableMap<Pair<String, String>, Correlation> entries;

  public CorrelationMatrix(Map<Pair<String, String>, Correlation> entries) {
    this.entries = ImmutableMap.copyOf(entries);
  }

  public Optional<Correlation> get(String featureA, String featureB) {
    Correlation correlation = entries.get(Pair.of(featureA, featureB));
    if (correlation == null) {
      correlation = entries.get(Pair.of(featureB, featureA));
    }
    return Optional.ofNullable(correlation);
  }

  public Map<Pair<String, String>, Correlation> getEntries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }
}
