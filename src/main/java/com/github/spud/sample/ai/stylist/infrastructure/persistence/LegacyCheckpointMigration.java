package com.github.spud.sample.ai.stylist.infrastructure.persistence;

import com.github.spud.sample.ai.stylist.application.config.AgentStateProperties;
import com.github.spud.sample.ai.stylist.domain.state.MigrationResult;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Drops the per-step checkpoint table that agent_state replaced.
 *
 * <p>The old table could hold several rows per thread with no usable uniqueness constraint, and
 * there is no way to tell which duplicate is authoritative, so the whole table goes. Rows are
 * counted first for the audit log. Count and drop share one transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LegacyCheckpointMigration {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  private static final String TABLE_EXISTS_SQL = """
    SELECT EXISTS (
      SELECT 1 FROM information_schema.tables
      WHERE table_schema = current_schema() AND table_name = ?
    )
    """;

  private static final String LIST_TABLES_SQL = """
    SELECT table_name FROM information_schema.tables
    WHERE table_schema = current_schema() AND table_type = 'BASE TABLE'
    ORDER BY table_name
    """;

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final AgentStateProperties properties;

  public MigrationResult dropLegacyTable() {
    String table = validatedTableName();

    MigrationResult result = transactionTemplate.execute(status -> {
      if (!tableExists(table)) {
        log.info("Legacy table {} does not exist, nothing to drop", table);
        return MigrationResult.builder()
          .legacyTable(table)
          .tablePresent(false)
          .rowsDiscarded(0)
          .verifiedRemoved(true)
          .remainingTables(listTables())
          .build();
      }

      Long rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
      long discarded = rows != null ? rows : 0L;
      log.warn("Dropping legacy table {} with {} rows", table, discarded);
      jdbcTemplate.execute("DROP TABLE IF EXISTS " + table + " CASCADE");

      boolean removed = !tableExists(table);
      if (!removed) {
        log.warn("Legacy table {} still present after drop", table);
      }
      return MigrationResult.builder()
        .legacyTable(table)
        .tablePresent(true)
        .rowsDiscarded(discarded)
        .verifiedRemoved(removed)
        .remainingTables(listTables())
        .build();
    });

    log.info("Legacy checkpoint migration: table={}, present={}, rowsDiscarded={}, removed={}, "
        + "remainingTables={}", result.getLegacyTable(), result.isTablePresent(),
      result.getRowsDiscarded(), result.isVerifiedRemoved(), result.getRemainingTables());
    return result;
  }

  private boolean tableExists(String table) {
    Boolean exists = jdbcTemplate.queryForObject(TABLE_EXISTS_SQL, Boolean.class,
      table.toLowerCase(Locale.ROOT));
    return Boolean.TRUE.equals(exists);
  }

  private List<String> listTables() {
    return jdbcTemplate.queryForList(LIST_TABLES_SQL, String.class);
  }

  /**
   * The table name ends up in DDL text, so it must be a bare identifier.
   */
  String validatedTableName() {
    String table = properties.getLegacyTable();
    if (table == null || !IDENTIFIER.matcher(table).matches()) {
      throw new IllegalArgumentException("Invalid legacy table name: " + table);
    }
    return table;
  }
}
