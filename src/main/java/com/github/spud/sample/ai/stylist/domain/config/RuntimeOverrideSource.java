package com.github.spud.sample.ai.stylist.domain.config;

import com.github.spud.sample.ai.stylist.application.config.BeautyStandardProperties;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Per-call overrides supplied by the caller
 */
@Slf4j
@Order(1)
@Component
@RequiredArgsConstructor
public class RuntimeOverrideSource implements VectorSource {

  private final BeautyStandardProperties properties;

  @Override
  public ConfigSource tier() {
    return ConfigSource.RUNTIME_CONFIG;
  }

  @Override
  public Optional<double[]> lookup(String key, Map<String, double[]> runtimeOverrides) {
    if (runtimeOverrides == null) {
      return Optional.empty();
    }
    double[] vector = runtimeOverrides.get(key);
    if (vector == null) {
      return Optional.empty();
    }
    if (vector.length != properties.getDimensions()) {
      log.warn("Ignoring runtime override for {}: expected {} values, got {}", key,
        properties.getDimensions(), vector.length);
      return Optional.empty();
    }
    return Optional.of(vector.clone());
  }
}
