package com.github.spud.sample.ai.stylist.domain.config;

import com.github.spud.sample.ai.stylist.application.config.BeautyStandardProperties;
import java.nio.file.Path;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps a configuration key to the variable and file names its tiers read. The beauty standard
 * key uses the configured names; any other key {@code foo.bar} maps to {@code FOO_BAR},
 * {@code FOO_BAR_PATH} and {@code <dataDirectory>/foo.bar.npy}. Keys name a file directly under
 * the data directory, so path separators and {@code ..} are rejected.
 */
@Component
@RequiredArgsConstructor
public class ConfigKeyNaming {

  private final BeautyStandardProperties properties;

  public String embeddingVariable(String key) {
    if (isBeautyStandard(key)) {
      return properties.getEmbeddingVariable();
    }
    return key.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
  }

  public String pathVariable(String key) {
    if (isBeautyStandard(key)) {
      return properties.getPathVariable();
    }
    return embeddingVariable(key) + "_PATH";
  }

  public Path defaultPath(String key) {
    if (isBeautyStandard(key)) {
      return Path.of(properties.getDefaultPath());
    }
    requireFileSafe(key);
    return Path.of(properties.getDataDirectory(), key + ".npy");
  }

  public void requireFileSafe(String key) {
    if (key.indexOf('/') >= 0 || key.indexOf('\\') >= 0 || key.contains("..")) {
      throw new IllegalArgumentException(
        "Configuration key must not contain path separators or '..': " + key);
    }
  }

  private boolean isBeautyStandard(String key) {
    return properties.getKey().equals(key);
  }
}
