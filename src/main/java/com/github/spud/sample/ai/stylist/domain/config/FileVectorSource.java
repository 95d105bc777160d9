package com.github.spud.sample.ai.stylist.domain.config;

import com.github.spud.sample.ai.stylist.application.config.BeautyStandardProperties;
import com.github.spud.sample.ai.stylist.infrastructure.npy.NpyVectorCodec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Vector stored in a NumPy .npy file
 */
@Slf4j
@Order(3)
@Component
@RequiredArgsConstructor
public class FileVectorSource implements VectorSource {

  private final Environment environment;
  private final ConfigKeyNaming naming;
  private final NpyVectorCodec codec;
  private final BeautyStandardProperties properties;

  @Override
  public ConfigSource tier() {
    return ConfigSource.FILE;
  }

  @Override
  public Optional<double[]> lookup(String key, Map<String, double[]> runtimeOverrides)
    throws MalformedSourceException {
    Path path;
    try {
      path = pathFor(key);
    } catch (InvalidPathException e) {
      throw new MalformedSourceException("invalid path in " + naming.pathVariable(key), e);
    }
    if (!Files.isRegularFile(path)) {
      log.debug("No embedding file for {} at {}", key, path);
      return Optional.empty();
    }
    try {
      return Optional.of(codec.read(path, properties.getDimensions()));
    } catch (IOException e) {
      throw new MalformedSourceException(path + ": " + e.getMessage(), e);
    }
  }

  /**
   * The file this tier reads for {@code key}: the path variable when set, otherwise the default.
   */
  public Path pathFor(String key) {
    String configured = RawPropertyReader.get(environment, naming.pathVariable(key));
    return StringUtils.hasText(configured) ? Path.of(configured.strip()) : naming.defaultPath(key);
  }
}
