package com.github.spud.sample.ai.stylist.domain.state;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of dropping the legacy checkpoint table, kept for the operator's audit trail
 */
@Value
@Builder
public class MigrationResult {

  String legacyTable;
  boolean tablePresent;
  long rowsDiscarded;
  boolean verifiedRemoved;
  @Builder.Default
  List<String> remainingTables = List.of();
}
