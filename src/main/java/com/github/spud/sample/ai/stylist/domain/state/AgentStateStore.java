package com.github.spud.sample.ai.stylist.domain.state;

import com.github.spud.sample.ai.stylist.domain.error.StorageException;
import com.github.spud.sample.ai.stylist.infrastructure.persistence.LegacyCheckpointMigration;
import com.github.spud.sample.ai.stylist.infrastructure.persistence.entity.AgentStateEntity;
import com.github.spud.sample.ai.stylist.infrastructure.persistence.repository.AgentStateRepository;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.util.StringUtils;

/**
 * Durable latest-state store for agent conversations, one row per session id.
 *
 * <p>Safe for concurrent writers in separate processes: {@link #upsert} is a single
 * insert-or-replace statement, so racing writes for the same session leave one row holding
 * whichever payload the database applied last. Only storage outages surface, as
 * {@link StorageException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentStateStore {

  /**
   * Width of the session_id column
   */
  static final int MAX_SESSION_ID_LENGTH = 255;

  private final AgentStateRepository repository;
  private final LegacyCheckpointMigration legacyCheckpointMigration;

  public void upsert(String sessionId, String stateBlob) {
    requireSessionId(sessionId);
    Objects.requireNonNull(stateBlob, "stateBlob");
    if (stateBlob.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("stateBlob must not contain NUL characters");
    }
    try {
      repository.upsert(sessionId, stateBlob);
    } catch (DataAccessException | TransactionException e) {
      throw new StorageException("Failed to write agent state for session " + sessionId, e);
    }
    log.debug("Upserted agent state: sessionId={}, size={}", sessionId, stateBlob.length());
  }

  /**
   * @return the stored state, or empty when nothing was ever written for {@code sessionId}
   */
  public Optional<AgentStateRecord> get(String sessionId) {
    requireSessionId(sessionId);
    try {
      return repository.findById(sessionId).map(AgentStateStore::toRecord);
    } catch (DataAccessException | TransactionException e) {
      throw new StorageException("Failed to read agent state for session " + sessionId, e);
    }
  }

  /**
   * Administrative, outside the request path. Drops the legacy checkpoint table without trying
   * to salvage its rows; safe to run repeatedly.
   */
  public MigrationResult migrateFromLegacyCheckpoints() {
    try {
      return legacyCheckpointMigration.dropLegacyTable();
    } catch (DataAccessException | TransactionException e) {
      throw new StorageException("Failed to drop legacy checkpoint table", e);
    }
  }

  private static void requireSessionId(String sessionId) {
    if (!StringUtils.hasText(sessionId)) {
      throw new IllegalArgumentException("sessionId must not be blank");
    }
    if (sessionId.codePointCount(0, sessionId.length()) > MAX_SESSION_ID_LENGTH) {
      throw new IllegalArgumentException(
        "sessionId must be at most " + MAX_SESSION_ID_LENGTH + " characters");
    }
    if (sessionId.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("sessionId must not contain NUL characters");
    }
  }

  private static AgentStateRecord toRecord(AgentStateEntity entity) {
    return AgentStateRecord.builder()
      .sessionId(entity.getSessionId())
      .stateBlob(entity.getStateBlob())
      .createdAt(entity.getCreatedAt())
      .updatedAt(entity.getUpdatedAt())
      .build();
  }
}
