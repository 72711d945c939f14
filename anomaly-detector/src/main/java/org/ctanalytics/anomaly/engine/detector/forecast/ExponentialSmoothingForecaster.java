package org.ctanalytics.anomaly.engine.detector.forecast;

import com.google.common.base.Preconditions;
import java.util.List;

/** Simple exponential smoothing; the smoothed level is the one-step-ahead forecast. */
public class ExponentialSmoothingForecaster {
  private final double alpha;

  public ExponentialSmoothingForecaster(double alpha) {
    Preconditions.checkArgument(alpha > 0 && alpha <= 1, "alpha must be in (0, 1]: %s", alpha);
    this.alpha = alpha;
  }

  public double level(List<Double> values) {
    Preconditions.checkArgument(!values.isEmpty(), "cannot smooth an empty series");
    double level = values.get(0);
    for (int i = 1; i < values.size(); i++) {
      level = alpha * values.get(i) + (1 - alpha) * level;
    }
    return level;
  }
}
