package com.github.spud.sample.ai.stylist.application.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Where the beauty standard embedding is looked up and persisted
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "app.beauty-standard")
public class BeautyStandardProperties {

  /**
   * Configuration key callers use to request the embedding
   */
  @NotBlank
  private String key = "beauty_standard_embedding";

  /**
   * Variable holding an inline vector: comma-separated decimals, or "base64:" followed by
   * little-endian float64 bytes
   */
  @NotBlank
  private String embeddingVariable = "BEAUTY_STANDARD_EMBEDDING";

  /**
   * Variable holding the path of the .npy file
   */
  @NotBlank
  private String pathVariable = "BEAUTY_STANDARD_EMBEDDING_PATH";

  /**
   * Path used when the path variable is unset
   */
  @NotBlank
  private String defaultPath = "data/beauty_standard_embedding.npy";

  /**
   * Directory holding .npy files for keys other than the beauty standard one
   */
  @NotBlank
  private String dataDirectory = "data";

  /**
   * Vector length. Fixed by the embedding model; anything else is rejected at startup.
   */
  @Min(768)
  @Max(768)
  private int dimensions = 768;
}
