package com.github.spud.sample.ai.stylist.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

/**
 * Latest orchestration state of one conversation. Rows are written only through
 * {@code AgentStateRepository#upsert}; the primary key is what keeps concurrent writers from
 * producing a second row.
 */
@Getter
@Setter
@Entity
@Table(name = "agent_state")
public class AgentStateEntity {

  @Id
  @Size(max = 255)
  @Column(name = "session_id", nullable = false)
  private String sessionId;

  @NotNull
  @Column(name = "state_blob", nullable = false, columnDefinition = "text")
  private String stateBlob;

  @NotNull
  @ColumnDefault("now()")
  @Column(name = "created_at", nullable = false)
  private OffsetDateTime createdAt;

  @NotNull
  @ColumnDefault("now()")
  @Column(name = "updated_at", nullable = false)
  private OffsetDateTime updatedAt;

}
