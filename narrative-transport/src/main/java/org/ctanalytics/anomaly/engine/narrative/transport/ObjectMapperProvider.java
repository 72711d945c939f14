package org.ctanalytics.anomaly.engine.narrative.transport;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared mapper for everything the engine puts on the wire: snake_case property names, ISO-8601
 * instants and no null fields.
 */
public class ObjectMapperProvider {
  private static volatile ObjectMapper objectMapper;

  public static ObjectMapper get() {
    if (objectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (objectMapper == null) {
          objectMapper =
              new ObjectMapper()
                  .registerModule(new JavaTimeModule())
                  .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                  .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                  .setSerializationInclusion(Include.NON_NULL);
        }
      }
    }
    return objectMapper;
  }
}
