package com.flamingo.ai.memoryengine.service.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.memoryengine.agent.MemoryRerankingAgent;
import com.flamingo.ai.memoryengine.agent.dto.MemorySelection;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.model.SimilarityResult;
import com.flamingo.ai.memoryengine.exception.LlmServiceException;
import com.flamingo.ai.memoryengine.service.format.MemoryFormatter;
import com.flamingo.ai.memoryengine.service.status.StatusEvent;
import com.flamingo.ai.memoryengine.service.store.OperationTimeouts;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MemoryRerankingServiceTest {

  private static final String QUERY = "Plan a weekend trip for my family";

  @Mock private MemoryRerankingAgent agent;

  private MemoryEngineConfig config;
  private SimpleMeterRegistry meterRegistry;
  private MemoryRerankingService service;
  private List<StatusEvent> events;

  @BeforeEach
  void setUp() {
    config = new MemoryEngineConfig();
    meterRegistry = new SimpleMeterRegistry();
    Clock clock = Clock.fixed(Instant.parse("2025-09-15T09:30:00Z"), ZoneOffset.UTC);
    MemoryFormatter formatter = new MemoryFormatter(clock, config);
    OperationTimeouts timeouts = new OperationTimeouts(Runnable::run, config);
    service = new MemoryRerankingService(agent, timeouts, formatter, config, meterRegistry);
    events = new ArrayList<>();
  }

  private static List<SimilarityResult> candidates(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> new SimilarityResult("m" + i, "Memory " + i, 0.9 - i * 0.01, null, null))
        .toList();
  }

  private static List<String> ids(List<SimilarityResult> results) {
    return results.stream().map(SimilarityResult::memoryId).toList();
  }

  @Nested
  @DisplayName("Without LLM")
  class WithoutLlmTests {

    @Test
    @DisplayName("should keep similarity order when reranking is disabled")
    void shouldKeepOrderWhenDisabled() {
      config.getReranking().setEnabled(false);
      List<SimilarityResult> candidates = candidates(3);

      List<SimilarityResult> selected = service.select(QUERY, candidates, 10, events::add);

      assertThat(selected).containsExactlyElementsOf(candidates);
      verifyNoInteractions(agent);
    }

    @Test
    @DisplayName("should not call the LLM at exactly the trigger threshold")
    void shouldNotCallLlmAtThreshold() {
      List<SimilarityResult> selected = service.select(QUERY, candidates(8), 10, events::add);

      assertThat(ids(selected)).containsExactly("m0", "m1", "m2", "m3", "m4", "m5", "m6", "m7");
      verifyNoInteractions(agent);
      assertThat(events.get(events.size() - 1).done()).isTrue();
    }
  }

  @Nested
  @DisplayName("With LLM")
  class WithLlmTests {

    @Test
    @DisplayName("should keep the model's order and drop unknown or repeated ids")
    void shouldKeepModelOrder() {
      when(agent.select(anyString(), anyString(), anyString(), anyInt()))
          .thenReturn(new MemorySelection(Arrays.asList("m5", "m2", "unknown", "m5", " m9 ")));

      List<SimilarityResult> selected = service.select(QUERY, candidates(20), 10, events::add);

      assertThat(ids(selected)).containsExactly("m5", "m2", "m9");
      assertThat(meterRegistry.counter("memory.rerank.llm.invocations").count()).isEqualTo(1.0);
      assertThat(events.get(0).description())
          .isEqualTo("🤖 LLM Analyzing 16 Memories for Relevance");
    }

    @Test
    @DisplayName("should send only the extended candidate pool to the model")
    void shouldSendExtendedPool() {
      when(agent.select(anyString(), anyString(), anyString(), anyInt()))
          .thenReturn(new MemorySelection(List.of("m0")));

      service.select(QUERY, candidates(30), 10, null);

      ArgumentCaptor<String> memories = ArgumentCaptor.forClass(String.class);
      verify(agent)
          .select(
              eq("Monday September 15 2025 at 09:30:00 UTC"),
              eq(QUERY),
              memories.capture(),
              eq(10));
      assertThat(memories.getValue().split("\n")).hasSize(16);
      assertThat(memories.getValue()).startsWith("[m0] Memory 0").doesNotContain("[m16]");
    }

    @Test
    @DisplayName("should cap the selection at maxReturned")
    void shouldCapSelection() {
      List<String> all = IntStream.range(0, 16).mapToObj(i -> "m" + i).toList();
      when(agent.select(anyString(), anyString(), anyString(), anyInt()))
          .thenReturn(new MemorySelection(all));

      List<SimilarityResult> selected = service.select(QUERY, candidates(20), 10, null);

      assertThat(selected).hasSize(10);
    }

    @Test
    @DisplayName("should fall back to truncation when the model fails")
    void shouldFallBackOnFailure() {
      when(agent.select(anyString(), anyString(), anyString(), anyInt()))
          .thenThrow(new LlmServiceException("rate limited", null));

      List<SimilarityResult> selected = service.select(QUERY, candidates(20), 10, events::add);

      assertThat(ids(selected)).containsExactlyElementsOf(ids(candidates(10)));
      assertThat(meterRegistry.counter("memory.rerank.llm.failures").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should return nothing when the model selects nothing")
    void shouldReturnEmptyWhenModelSelectsNothing() {
      when(agent.select(anyString(), anyString(), anyString(), anyInt()))
          .thenReturn(new MemorySelection(null));

      List<SimilarityResult> selected = service.select(QUERY, candidates(20), 10, events::add);

      assertThat(selected).isEmpty();
      assertThat(events)
          .last()
          .isEqualTo(new StatusEvent("📭 No Relevant Memories After LLM Analysis", true));
    }
  }

  @Test
  @DisplayName("shouldUseLlm should compare against maxReturned times the trigger multiplier")
  void shouldUseLlmShouldApplyMultiplier() {
    assertThat(service.shouldUseLlm(9, 10)).isTrue();
    assertThat(service.shouldUseLlm(8, 10)).isFalse();

    config.getReranking().setEnabled(false);

    assertThat(service.shouldUseLlm(100, 10)).isFalse();
  }
}
