package com.github.spud.sample.ai.stylist.domain.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.spud.sample.ai.stylist.domain.error.StorageException;
import com.github.spud.sample.ai.stylist.infrastructure.util.JsonUtils;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.json.JsonParseException;
import org.springframework.stereotype.Component;

/**
 * Stores structured orchestration state as the JSON blob of {@link AgentStateStore}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentStateCheckpointer {

  private static final TypeReference<Map<String, Object>> STATE_MAP = new TypeReference<>() {
  };

  private final AgentStateStore store;

  public void save(String sessionId, Object state) {
    String json;
    try {
      json = JsonUtils.toJson(state);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(
        "Agent state for session " + sessionId + " cannot be serialized", e);
    }
    store.upsert(sessionId, json);
    log.debug("Saved checkpoint for session {}", sessionId);
  }

  public <T> Optional<T> load(String sessionId, Class<T> type) {
    return store.get(sessionId).map(record -> {
      try {
        return JsonUtils.fromJson(record.getStateBlob(), type);
      } catch (JsonParseException e) {
        throw new StorageException("Stored state for session " + sessionId + " is unreadable", e);
      }
    });
  }

  public Optional<Map<String, Object>> loadAsMap(String sessionId) {
    return store.get(sessionId).map(record -> {
      try {
        return JsonUtils.fromJson(record.getStateBlob(), STATE_MAP);
      } catch (JsonParseException e) {
        throw new StorageException("Stored state for session " + sessionId + " is unreadable", e);
      }
    });
  }
}
