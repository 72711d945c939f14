package org.ctanalytics.anomaly.engine.detector.forecast;

import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;
import java.util.Map;
import org.ctanalytics.anomaly.engine.detector.DetectorConfig;

public class ForecastConfig {
  private static final String FORECAST_CONFIG = "forecast";
  private static final String HORIZON_STEPS = "horizon.steps";
  private static final String TREND_WINDOW = "trend.window";
  private static final String SMOOTHING_ALPHA = "smoothing.alpha";
  private static final String SMOOTHING_OVERRIDES = "smoothing.overrides";
  private static final String LIMITS = "limits";
  private static final String ACTIONS = "actions";

  private static final int DEFAULT_HORIZON_STEPS = 5;
  private static final int DEFAULT_TREND_WINDOW = 10;
  private static final double DEFAULT_SMOOTHING_ALPHA = 0.3;
  static final String DEFAULT_ACTION = "SCALE_UP";

  private final int horizonSteps;
  private final int trendWindow;
  private final double smoothingAlpha;
  private final Map<String, Double> smoothingOverrides;
  private final Map<String, Double> limits;
  private final Map<String, String> actions;

  public static ForecastConfig from(Config appConfig) {
    String path = DetectorConfig.ENGINE_CONFIG + "." + FORECAST_CONFIG;
    return new ForecastConfig(
        appConfig.hasPath(path) ? appConfig.getConfig(path) : ConfigFactory.empty());
  }

  private ForecastConfig(Config forecastConfig) {
    this.horizonSteps =
        forecastConfig.hasPath(HORIZON_STEPS)
            ? forecastConfig.getInt(HORIZON_STEPS)
            : DEFAULT_HORIZON_STEPS;
    this.trendWindow =
        forecastConfig.hasPath(TREND_WINDOW)
            ? forecastConfig.getInt(TREND_WINDOW)
            : DEFAULT_TREND_WINDOW;
    this.smoothingAlpha =
        forecastConfig.hasPath(SMOOTHING_ALPHA)
            ? forecastConfig.getDouble(SMOOTHING_ALPHA)
            : DEFAULT_SMOOTHING_ALPHA;
    this.smoothingOverrides = readDoubles(forecastConfig, SMOOTHING_OVERRIDES);
    this.limits = readDoubles(forecastConfig, LIMITS);
    ImmutableMap.Builder<String, String> actionsBuilder = ImmutableMap.builder();
    if (forecastConfig.hasPath(ACTIONS)) {
      Config actionsConfig = forecastConfig.getConfig(ACTIONS);
      for (String feature : actionsConfig.root().keySet()) {
        actionsBuilder.put(feature, actionsConfig.getString(ConfigUtil.joinPath(feature)));
      }
    }
    this.actions = actionsBuilder.build();
  }

  private static Map<String, Double> readDoubles(Config config, String path) {
    ImmutableMap.Builder<String, Double> builder = ImmutableMap.builder();
    if (config.hasPath(path)) {
      Config section = config.getConfig(path);
      for (String feature : section.root().keySet()) {
        builder.put(feature, section.getDouble(ConfigUtil.joinPath(feature)));
      }
    }
    return builder.build();
  }

  public int getHorizonSteps() {
    return horizonSteps;
  }

  public int getTrendWindow() {
    return trendWindow;
  }

  public double smoothingAlpha(String feature) {
    return smoothingOverrides.getOrDefault(feature, smoothingAlpha);
  }

  public Map<String, Double> getLimits() {
    return limits;
  }

  public String recommendedAction(String feature) {
    return actions.getOrDefault(feature, DEFAULT_ACTION);
  }
}
