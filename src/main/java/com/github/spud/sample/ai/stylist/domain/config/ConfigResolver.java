package com.github.spud.sample.ai.stylist.domain.config;

import com.github.spud.sample.ai.stylist.application.config.BeautyStandardProperties;
import com.github.spud.sample.ai.stylist.domain.error.StorageException;
import com.github.spud.sample.ai.stylist.infrastructure.npy.NpyVectorCodec;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Resolves vector settings such as the beauty standard embedding.
 *
 * <p>Tiers are tried in order: runtime overrides, environment, .npy file. A tier that is
 * missing or malformed is skipped, and when every tier misses a zero vector tagged
 * {@link ConfigSource#PLACEHOLDER} is returned. Resolution therefore never fails on bad
 * configuration; callers that need a real value must check {@link ConfigValue#getSource()}.
 */
@Slf4j
@Service
public class ConfigResolver {

  private final List<VectorSource> sources;
  private final FileVectorSource fileSource;
  private final NpyVectorCodec codec;
  private final ConfigKeyNaming naming;
  private final BeautyStandardProperties properties;

  public ConfigResolver(List<VectorSource> sources, FileVectorSource fileSource,
    NpyVectorCodec codec, ConfigKeyNaming naming, BeautyStandardProperties properties) {
    this.sources = List.copyOf(sources);
    this.fileSource = fileSource;
    this.codec = codec;
    this.naming = naming;
    this.properties = properties;
  }

  public ConfigValue resolve(String key) {
    return resolve(key, Map.of());
  }

  public ConfigValue resolve(String key, Map<String, double[]> runtimeOverrides) {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Configuration key must not be blank");
    }
    naming.requireFileSafe(key);
    Map<String, double[]> overrides = runtimeOverrides != null ? runtimeOverrides : Map.of();

    for (VectorSource source : sources) {
      try {
        Optional<double[]> vector = source.lookup(key, overrides);
        if (vector.isPresent()) {
          log.debug("Resolved {} from {}", key, source.tier());
          return new ConfigValue(key, vector.get(), source.tier());
        }
      } catch (MalformedSourceException e) {
        log.warn("Skipping {} source for {}: {}", source.tier(), key, e.getMessage());
      }
    }

    log.warn("Using placeholder zero vector for {}. Set {} or point {} at a .npy file.", key,
      naming.embeddingVariable(key), naming.pathVariable(key));
    return new ConfigValue(key, new double[properties.getDimensions()], ConfigSource.PLACEHOLDER);
  }

  public ConfigValue beautyStandardEmbedding(Map<String, double[]> runtimeOverrides) {
    return resolve(properties.getKey(), runtimeOverrides);
  }

  /**
   * Writes the beauty standard embedding to the file the file tier reads.
   */
  public void persist(double[] vector) {
    Path path;
    try {
      path = fileSource.pathFor(properties.getKey());
    } catch (InvalidPathException e) {
      throw new StorageException("Invalid embedding path: " + e.getMessage(), e);
    }
    persist(vector, path);
  }

  /**
   * Writes {@code vector} as a .npy file at {@code path}, replacing any existing file. The write
   * goes through a temporary file and a rename, so concurrent readers see the old or the new
   * content only. Unlike resolution this validates strictly.
   *
   * @throws StorageException if the vector has the wrong length or non-finite values, or the
   *                          file cannot be written
   */
  public void persist(double[] vector, Path path) {
    if (vector == null || vector.length != properties.getDimensions()) {
      throw new StorageException("Embedding must have " + properties.getDimensions()
        + " values, got " + (vector == null ? "null" : vector.length));
    }
    for (int i = 0; i < vector.length; i++) {
      if (!Double.isFinite(vector[i])) {
        throw new StorageException("Embedding has a non-finite value at index " + i);
      }
    }
    try {
      codec.writeAtomically(path, vector);
    } catch (IOException e) {
      throw new StorageException("Could not write embedding to " + path, e);
    }
    log.info("Embedding saved to {}", path);
  }
}
