package com.github.spud.sample.ai.stylist.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import com.github.spud.sample.ai.stylist.application.config.AgentStateProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

class LegacyCheckpointMigrationTest {

  private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
  private final TransactionTemplate transactionTemplate = mock(TransactionTemplate.class);

  @Test
  void acceptsDefaultTableName() {
    assertThat(migrationFor(new AgentStateProperties()).validatedTableName())
      .isEqualTo("checkpoints");
  }

  @ParameterizedTest
  @ValueSource(strings = {"checkpoints; DROP TABLE agent_state", "public.checkpoints",
    "1checkpoints", "check-points", ""})
  void rejectsNamesThatAreNotPlainIdentifiers(String table) {
    AgentStateProperties properties = new AgentStateProperties();
    properties.setLegacyTable(table);
    LegacyCheckpointMigration migration = migrationFor(properties);

    assertThatThrownBy(migration::dropLegacyTable)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("Invalid legacy table name");
    verifyNoInteractions(jdbcTemplate, transactionTemplate);
  }

  private LegacyCheckpointMigration migrationFor(AgentStateProperties properties) {
    return new LegacyCheckpointMigration(jdbcTemplate, transactionTemplate, properties);
  }
}
