package com.github.spud.sample.ai.stylist.domain.config;

import com.github.spud.sample.ai.stylist.application.config.BeautyStandardProperties;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Inline vector from a variable, read from the Spring {@link Environment} property sources so
 * OS variables, system properties and application config all qualify. See {@link EnvironmentVectorParser} for
 * the accepted encodings.
 */
@Order(2)
@Component
@RequiredArgsConstructor
public class EnvironmentVectorSource implements VectorSource {

  private final Environment environment;
  private final ConfigKeyNaming naming;
  private final BeautyStandardProperties properties;

  @Override
  public ConfigSource tier() {
    return ConfigSource.ENVIRONMENT;
  }

  @Override
  public Optional<double[]> lookup(String key, Map<String, double[]> runtimeOverrides)
    throws MalformedSourceException {
    String variable = naming.embeddingVariable(key);
    String raw = RawPropertyReader.get(environment, variable);
    if (!StringUtils.hasText(raw)) {
      return Optional.empty();
    }
    try {
      return Optional.of(EnvironmentVectorParser.parse(raw, properties.getDimensions()));
    } catch (MalformedSourceException e) {
      throw new MalformedSourceException(variable + ": " + e.getMessage(), e);
    }
  }
}
