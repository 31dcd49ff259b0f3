package com.flamingo.ai.memoryengine.service.memory;

import com.flamingo.ai.memoryengine.domain.model.ConsolidationResult;
import com.flamingo.ai.memoryengine.domain.model.ConversationMessage;
import com.flamingo.ai.memoryengine.service.status.StatusSink;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Entry points called by the host application once per conversation turn. */
public interface MemoryPipelineService {

  /**
   * Pre-response hook: classifies the latest user message, retrieves relevant memories and injects
   * them as a context block into the system message.
   *
   * @param messages the outgoing model request; not modified
   * @param userId the current user
   * @param sink optional status sink
   * @return the messages to send, with the context block when memories were selected
   */
  List<ConversationMessage> onIncoming(
      List<ConversationMessage> messages, String userId, StatusSink sink);

  /**
   * Post-response hook: starts background consolidation of the latest user message. Returns
   * immediately.
   *
   * @return completes with the consolidation tally; already complete when nothing was started
   */
  CompletableFuture<ConsolidationResult> onOutgoing(
      List<ConversationMessage> messages, String userId, StatusSink sink);
}
