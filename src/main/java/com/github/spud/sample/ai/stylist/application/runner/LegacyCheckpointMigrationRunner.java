package com.github.spud.sample.ai.stylist.application.runner;

import com.github.spud.sample.ai.stylist.domain.state.AgentStateStore;
import com.github.spud.sample.ai.stylist.domain.state.MigrationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the legacy checkpoint drop at startup when an operator opted in with
 * {@code app.agent-state.migrate-legacy-on-startup=true}. A failure stops startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.agent-state.migrate-legacy-on-startup", havingValue = "true")
public class LegacyCheckpointMigrationRunner implements ApplicationRunner {

  private final AgentStateStore agentStateStore;

  @Override
  public void run(ApplicationArguments args) {
    MigrationResult result = agentStateStore.migrateFromLegacyCheckpoints();
    if (result.isTablePresent()) {
      log.warn("[DB] dropped legacy table {} ({} rows discarded)", result.getLegacyTable(),
        result.getRowsDiscarded());
    }
  }
}
