package com.github.spud.sample.ai.stylist.domain.state;

import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent state snapshot (maps to agent_state table)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStateRecord {

  private String sessionId;
  private String stateBlob;
  private OffsetDateTime createdAt;
  private OffsetDateTime updatedAt;
}
