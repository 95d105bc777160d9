package com.github.spud.sample.ai.stylist.domain.config;

import java.util.Map;
import java.util.Optional;

/**
 * One tier of the configuration lookup chain. Implementations are ordered with
 * {@link org.springframework.core.annotation.Order}; {@link ConfigResolver} asks them in that
 * order and keeps the first non-empty answer.
 */
public interface VectorSource {

  ConfigSource tier();

  /**
   * @return the vector for {@code key}, or empty when this tier has nothing for it
   * @throws MalformedSourceException when this tier has a value for the key that is unusable
   */
  Optional<double[]> lookup(String key, Map<String, double[]> runtimeOverrides)
    throws MalformedSourceException;
}
