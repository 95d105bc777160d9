package com.github.spud.sample.ai.stylist.application.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Agent state table settings
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "app.agent-state")
public class AgentStateProperties {

  /**
   * Table that held per-step checkpoints before agent_state replaced it. Interpolated into DDL,
   * so only plain identifiers are accepted.
   */
  @NotBlank
  @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]{0,62}")
  private String legacyTable = "checkpoints";

  /**
   * Drop the legacy table once on startup. Destroys all rows in it; leave off unless an operator
   * asked for it.
   */
  private boolean migrateLegacyOnStartup = false;
}
