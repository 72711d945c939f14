package org.ctanalytics.anomaly.engine.detector.forecast;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/** Least-squares linear trend over the most recent values, extrapolated a few steps ahead. */
public class TrendForecaster {
  private static final int MIN_TREND_POINTS = 3;

  private final int window;
  private final int steps;

  public TrendForecaster(int window, int steps) {
    Preconditions.checkArgument(window >= MIN_TREND_POINTS, "trend window too small: %s", window);
    Preconditions.checkArgument(steps > 0, "horizon must be positive: %s", steps);
    this.window = window;
    this.steps = steps;
  }

  public List<Double> project(List<Double> values) {
    Preconditions.checkArgument(!values.isEmpty(), "cannot project an empty series");
    if (values.size() < MIN_TREND_POINTS) {
      return Collections.nCopies(steps, values.get(values.size() - 1));
    }
    List<Double> recent = values.subList(Math.max(0, values.size() - window), values.size());
    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < recent.size(); i++) {
      regression.addData(i, recent.get(i));
    }
    List<Double> projection = new ArrayList<>(steps);
    for (int step = 0; step < steps; step++) {
      projection.add(regression.predict(recent.size() + step));
    }
    return projection;
  }
}
