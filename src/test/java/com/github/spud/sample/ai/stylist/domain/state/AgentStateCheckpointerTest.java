package com.github.spud.sample.ai.stylist.domain.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.stylist.domain.error.StorageException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AgentStateCheckpointerTest {

  private AgentStateStore store;
  private AgentStateCheckpointer checkpointer;

  @BeforeEach
  void setUp() {
    store = mock(AgentStateStore.class);
    checkpointer = new AgentStateCheckpointer(store);
  }

  @Test
  void saveWritesJson() {
    checkpointer.save("s1", new StylingState("ranking_agent", List.of("p1", "p2")));

    ArgumentCaptor<String> blob = ArgumentCaptor.forClass(String.class);
    verify(store).upsert(eq("s1"), blob.capture());
    assertThat(blob.getValue())
      .contains("\"currentAgent\":\"ranking_agent\"")
      .contains("\"rankedProducts\":[\"p1\",\"p2\"]");
  }

  @Test
  void loadReadsTypedState() {
    when(store.get("s1")).thenReturn(Optional.of(record(
      "{\"currentAgent\":\"styling_agent\",\"rankedProducts\":[\"p9\"]}")));

    StylingState state = checkpointer.load("s1", StylingState.class).orElseThrow();

    assertThat(state.getCurrentAgent()).isEqualTo("styling_agent");
    assertThat(state.getRankedProducts()).containsExactly("p9");
  }

  @Test
  void loadAsMapReadsUntypedState() {
    when(store.get("s1")).thenReturn(Optional.of(record("{\"next_step\":\"clarify\"}")));

    Map<String, Object> state = checkpointer.loadAsMap("s1").orElseThrow();

    assertThat(state).containsEntry("next_step", "clarify");
  }

  @Test
  void loadOfUnknownSessionIsEmpty() {
    when(store.get("missing")).thenReturn(Optional.empty());

    assertThat(checkpointer.load("missing", StylingState.class)).isEmpty();
  }

  @Test
  void unreadableBlobIsStorageError() {
    when(store.get("s1")).thenReturn(Optional.of(record("{not json")));

    assertThatThrownBy(() -> checkpointer.load("s1", StylingState.class))
      .isInstanceOf(StorageException.class)
      .hasMessageContaining("s1");
  }

  private static AgentStateRecord record(String blob) {
    return AgentStateRecord.builder().sessionId("s1").stateBlob(blob).build();
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  static class StylingState {

    private String currentAgent;
    private List<String> rankedProducts;
  }
}
