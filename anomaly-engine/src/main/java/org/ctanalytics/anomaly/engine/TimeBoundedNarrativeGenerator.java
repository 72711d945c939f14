package org.ctanalytics.anomaly.engine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.ctanalytics.anomaly.engine.narrative.NarrativeGenerator;
import org.ctanalytics.anomaly.engine.narrative.NarrativePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the wrapped generator on its own executor and waits at most {@code timeout}. A late call
 * is cancelled and counted; the caller only ever sees an empty narrative.
 */
class TimeBoundedNarrativeGenerator implements NarrativeGenerator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(TimeBoundedNarrativeGenerator.class);
  static final String NARRATIVE_UNAVAILABLE_COUNTER = "anomaly.engine.narrative.unavailable";
  private static final String REASON_TAG = "reason";

  private final NarrativeGenerator delegate;
  private final Duration timeout;
  private final ExecutorService executor;
  private final Counter timeoutCounter;
  private final Counter failureCounter;
  private final Counter rejectedCounter;

  TimeBoundedNarrativeGenerator(
      NarrativeGenerator delegate,
      Duration timeout,
      ExecutorService executor,
      MeterRegistry meterRegistry) {
    this.delegate = delegate;
    this.timeout = timeout;
    this.executor = executor;
    this.timeoutCounter =
        Counter.builder(NARRATIVE_UNAVAILABLE_COUNTER)
            .tag(REASON_TAG, "timeout")
            .register(meterRegistry);
    this.failureCounter =
        Counter.builder(NARRATIVE_UNAVAILABLE_COUNTER)
            .tag(REASON_TAG, "failure")
            .register(meterRegistry);
    this.rejectedCounter =
        Counter.builder(NARRATIVE_UNAVAILABLE_COUNTER)
            .tag(REASON_TAG, "rejected")
            .register(meterRegistry);
  }

  @Override
  public Optional<String> explain(NarrativePayload payload) {
    Future<Optional<String>> future;
    try {
      future = executor.submit(() -> delegate.explain(payload));
    } catch (RejectedExecutionException e) {
      rejectedCounter.increment();
      LOGGER.warn(
          "Narrative executor rejected anomaly {}, leaving its narrative empty",
          payload.getAnomalyId(),
          e);
      return Optional.empty();
    }
    try {
      Optional<String> narrative = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return narrative == null ? Optional.empty() : narrative;
    } catch (TimeoutException e) {
      future.cancel(true);
      timeoutCounter.increment();
      LOGGER.warn(
          "Narrative for anomaly {} not ready after {}, leaving it empty",
          payload.getAnomalyId(),
          timeout);
    } catch (ExecutionException e) {
      failureCounter.increment();
      LOGGER.warn("Narrative for anomaly {} failed", payload.getAnomalyId(), e.getCause());
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while waiting for narrative of anomaly {}", payload.getAnomalyId());
    }
    return Optional.empty();
  }
}
