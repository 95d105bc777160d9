package com.github.spud.sample.ai.stylist.domain.config;

import java.util.Arrays;
import java.util.Objects;

/**
 * A resolved vector setting. Immutable; the vector is copied in and out.
 */
public final class ConfigValue {

  private final String key;
  private final double[] vector;
  private final ConfigSource source;

  public ConfigValue(String key, double[] vector, ConfigSource source) {
    this.key = Objects.requireNonNull(key, "key");
    this.vector = Objects.requireNonNull(vector, "vector").clone();
    this.source = Objects.requireNonNull(source, "source");
  }

  public String getKey() {
    return key;
  }

  public double[] getVector() {
    return vector.clone();
  }

  public int dimensions() {
    return vector.length;
  }

  public ConfigSource getSource() {
    return source;
  }

  public boolean isPlaceholder() {
    return source == ConfigSource.PLACEHOLDER;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConfigValue that)) {
      return false;
    }
    return key.equals(that.key) && source == that.source && Arrays.equals(vector, that.vector);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, source, Arrays.hashCode(vector));
  }

  @Override
  public String toString() {
    return "ConfigValue{key='" + key + "', source=" + source + ", dimensions=" + vector.length + "}";
  }
}
