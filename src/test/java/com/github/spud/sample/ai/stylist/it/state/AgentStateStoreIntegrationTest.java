package com.github.spud.sample.ai.stylist.it.state;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.stylist.domain.state.AgentStateRecord;
import com.github.spud.sample.ai.stylist.domain.state.AgentStateStore;
import com.github.spud.sample.ai.stylist.it.support.ContainersSupport;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

/**
 * Agent state store against a real Postgres, covering the single-row invariant under
 * concurrent writers
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("it")
class AgentStateStoreIntegrationTest extends ContainersSupport {

  @Autowired
  private AgentStateStore store;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @Test
  @DisplayName("Second upsert replaces the first")
  void upsertThenUpsertReturnsLatest() {
    String sessionId = "s1-" + UUID.randomUUID();

    store.upsert(sessionId, "stateA");
    store.upsert(sessionId, "stateB");

    Optional<AgentStateRecord> record = store.get(sessionId);
    assertThat(record).isPresent();
    assertThat(record.get().getStateBlob()).isEqualTo("stateB");
    assertThat(rowCount(sessionId)).isEqualTo(1);
  }

  @Test
  @DisplayName("Unknown session is empty, not an error")
  void getUnknownSessionIsEmpty() {
    assertThat(store.get("never-started-" + UUID.randomUUID())).isEmpty();
  }

  @Test
  @DisplayName("Update keeps created_at and moves updated_at forward")
  void updateKeepsCreationTime() {
    String sessionId = UUID.randomUUID().toString();

    store.upsert(sessionId, "{\"step\":1}");
    AgentStateRecord first = store.get(sessionId).orElseThrow();
    store.upsert(sessionId, "{\"step\":2}");
    AgentStateRecord second = store.get(sessionId).orElseThrow();

    assertThat(second.getCreatedAt()).isEqualTo(first.getCreatedAt());
    assertThat(second.getUpdatedAt()).isAfter(first.getUpdatedAt());
  }

  @Test
  @DisplayName("Large payloads are stored intact")
  void storesLargePayload() {
    String sessionId = UUID.randomUUID().toString();
    String payload = "x".repeat(2_000_000);

    store.upsert(sessionId, payload);

    assertThat(store.get(sessionId).orElseThrow().getStateBlob()).hasSize(2_000_000);
  }

  @Test
  @DisplayName("Concurrent upserts for one session never conflict and leave one row")
  void concurrentUpsertsLeaveSingleRow() throws Exception {
    String sessionId = UUID.randomUUID().toString();
    int writers = 16;
    int writesPerWriter = 10;
    ExecutorService executor = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    List<String> payloads = new ArrayList<>();

    try {
      for (int w = 0; w < writers; w++) {
        for (int i = 0; i < writesPerWriter; i++) {
          payloads.add("writer-" + w + "-write-" + i);
        }
        int writer = w;
        futures.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < writesPerWriter; i++) {
            store.upsert(sessionId, "writer-" + writer + "-write-" + i);
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        // rethrows any exception a writer hit
        future.get(60, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(rowCount(sessionId)).isEqualTo(1);
    assertThat(store.get(sessionId).orElseThrow().getStateBlob()).isIn(payloads);
  }

  private Integer rowCount(String sessionId) {
    return jdbcTemplate.queryForObject(
      "SELECT COUNT(*) FROM agent_state WHERE session_id = ?", Integer.class, sessionId);
  }
}
