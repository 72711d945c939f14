package org.ctanalytics.anomaly.engine.detector.forecast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ctanalytics.anomaly.engine.detector.baseline.BaselineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Projects metric trends and flags configured limits the projection would exceed. */
public class ResourceExhaustionPredictor {
  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceExhaustionPredictor.class);

  private final ForecastConfig config;
  private final TrendForecaster trendForecaster;

  public ResourceExhaustionPredictor(ForecastConfig config) {
    this.config = config;
    this.trendForecaster = new TrendForecaster(config.getTrendWindow(), config.getHorizonSteps());
  }

  /** Forecast every metric of the source from the raw values its baseline still holds. */
  public ForecastReport predict(String source, BaselineStore baselineStore) {
    Map<String, List<Double>> series = new LinkedHashMap<>();
    for (String metric : baselineStore.getSchema().getMetricNames()) {
      if (baselineStore.contains(metric)) {
        series.put(metric, baselineStore.state(metric).getRecentValues());
      }
    }
    return predict(source, series);
  }

  public ForecastReport predict(String source, Map<String, List<Double>> series) {
    List<FeatureForecast> forecasts = new ArrayList<>();
    List<ExhaustionAlert> alerts = new ArrayList<>();
    series.forEach(
        (feature, values) -> {
          if (values.isEmpty()) {
            return;
          }
          List<Double> projection = trendForecaster.project(values);
          double peak = Collections.max(projection);
          double level =
              new ExponentialSmoothingForecaster(config.smoothingAlpha(feature)).level(values);
          forecasts.add(
              FeatureForecast.builder()
                  .feature(feature)
                  .trendProjection(ImmutableList.copyOf(projection))
                  .smoothedLevel(level)
                  .predictedPeak(peak)
                  .build());
          Double limit = config.getLimits().get(feature);
          if (limit != null && peak > limit) {
            LOGGER.info(
                "Source {}: {} projected to reach {} against limit {}",
                source,
                feature,
                peak,
                limit);
            alerts.add(
                ExhaustionAlert.builder()
                    .feature(feature)
                    .predictedPeak(peak)
                    .limit(limit)
                    .recommendedAction(config.recommendedAction(feature))
                    .build());
          }
        });
    return ForecastReport.builder()
        .source(source)
        .forecasts(ImmutableList.copyOf(forecasts))
        .alerts(ImmutableList.copyOf(alerts))
        .build();
  }
}
