package com.github.spud.sample.ai.stylist.domain.config;

/**
 * Tier that supplied a resolved configuration value, in precedence order
 */
public enum ConfigSource {
  RUNTIME_CONFIG,
  ENVIRONMENT,
  FILE,
  PLACEHOLDER
}
