package org.ctanalytics.anomaly.engine.narrative;

import java.util.Optional;

/**
 * External collaborator that turns a finished analysis into prose. An empty result means the
 * narrative is unavailable; callers must not treat it as an error.
 */
public interface NarrativeGenerator {

  Optional<String> explain(NarrativePayload payload);
}
