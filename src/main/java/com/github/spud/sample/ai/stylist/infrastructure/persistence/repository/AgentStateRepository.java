package com.github.spud.sample.ai.stylist.infrastructure.persistence.repository;

import com.github.spud.sample.ai.stylist.infrastructure.persistence.entity.AgentStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.NativeQuery;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface AgentStateRepository extends JpaRepository<AgentStateEntity, String> {

  /**
   * Insert-or-replace in a single statement. Postgres resolves a concurrent insert of the same
   * key through the primary key instead of raising a unique violation, so there is no
   * read-before-write for writers in other processes to race with. created_at keeps the value
   * from the first write.
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Transactional
  @NativeQuery("""
    INSERT INTO agent_state (session_id, state_blob, created_at, updated_at)
    VALUES (:sessionId, :stateBlob, clock_timestamp(), clock_timestamp())
    ON CONFLICT (session_id) DO UPDATE
    SET state_blob = EXCLUDED.state_blob, updated_at = EXCLUDED.updated_at
    """)
  int upsert(@Param("sessionId") String sessionId, @Param("stateBlob") String stateBlob);

}
