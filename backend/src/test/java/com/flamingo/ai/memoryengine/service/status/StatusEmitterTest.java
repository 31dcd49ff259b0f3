package com.flamingo.ai.memoryengine.service.status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StatusEmitterTest {

  @Test
  @DisplayName("should deliver progress and done events in order")
  void shouldDeliverEvents() {
    List<StatusEvent> events = new ArrayList<>();

    StatusEmitter.progress(events::add, "💭 1/2: I like jazz");
    StatusEmitter.done(events::add, "🧠 Injected 2 Memories to Context");

    assertThat(events)
        .containsExactly(
            new StatusEvent("💭 1/2: I like jazz", false),
            new StatusEvent("🧠 Injected 2 Memories to Context", true));
  }

  @Test
  @DisplayName("should ignore a missing sink")
  void shouldIgnoreMissingSink() {
    assertThatCode(() -> StatusEmitter.done(null, "📭 No Memories Found"))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("should not propagate sink failures")
  void shouldNotPropagateSinkFailures() {
    StatusSink broken =
        event -> {
          throw new IllegalStateException("client disconnected");
        };

    assertThatCode(() -> StatusEmitter.progress(broken, "🤖 LLM Analyzing 12 Memories"))
        .doesNotThrowAnyException();
  }
}
