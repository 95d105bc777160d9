package com.github.spud.sample.ai.stylist.domain.config;

import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertySource;

/**
 * Reads a property value as written, skipping {@code ${...}} placeholder resolution. Vector and
 * path variables are data; a stray {@code ${} is kept literally.
 */
final class RawPropertyReader {

  private RawPropertyReader() {
  }

  static String get(Environment environment, String name) {
    if (!(environment instanceof ConfigurableEnvironment configurable)) {
      return environment.getProperty(name);
    }
    for (PropertySource<?> source : configurable.getPropertySources()) {
      Object value = source.getProperty(name);
      if (value != null) {
        return value.toString();
      }
    }
    return null;
  }
}
