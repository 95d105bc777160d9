package com.github.spud.sample.ai.stylist.it.state;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.stylist.domain.state.AgentStateStore;
import com.github.spud.sample.ai.stylist.domain.state.MigrationResult;
import com.github.spud.sample.ai.stylist.it.support.ContainersSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("it")
class LegacyCheckpointMigrationIntegrationTest extends ContainersSupport {

  @Autowired
  private AgentStateStore store;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.execute("DROP TABLE IF EXISTS checkpoints CASCADE");
  }

  @Test
  @DisplayName("Drops a populated legacy table and reports the discarded rows")
  void dropsPopulatedLegacyTable() {
    // same thread twice: the duplicate the old schema could not prevent
    jdbcTemplate.execute("""
      CREATE TABLE checkpoints (
        thread_id TEXT NOT NULL,
        checkpoint_id TEXT NOT NULL,
        checkpoint JSONB
      )
      """);
    jdbcTemplate.update("INSERT INTO checkpoints VALUES ('t1', 'c1', '{}'), ('t1', 'c1', '{}'),"
      + " ('t2', 'c9', NULL)");
    store.upsert("kept-session", "still here");

    MigrationResult result = store.migrateFromLegacyCheckpoints();

    assertThat(result.getLegacyTable()).isEqualTo("checkpoints");
    assertThat(result.isTablePresent()).isTrue();
    assertThat(result.getRowsDiscarded()).isEqualTo(3);
    assertThat(result.isVerifiedRemoved()).isTrue();
    assertThat(result.getRemainingTables()).contains("agent_state").doesNotContain("checkpoints");
    assertThat(store.get("kept-session")).isPresent();
  }

  @Test
  @DisplayName("Running again after the drop is a no-op")
  void secondRunIsNoOp() {
    jdbcTemplate.execute("CREATE TABLE checkpoints (thread_id TEXT)");
    store.migrateFromLegacyCheckpoints();

    MigrationResult result = store.migrateFromLegacyCheckpoints();

    assertThat(result.isTablePresent()).isFalse();
    assertThat(result.getRowsDiscarded()).isZero();
    assertThat(result.isVerifiedRemoved()).isTrue();
  }
}
