package com.flamingo.ai.memoryengine.service.memory;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.MessageRole;
import com.flamingo.ai.memoryengine.domain.model.ConsolidationResult;
import com.flamingo.ai.memoryengine.domain.model.ConversationMessage;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.SimilarityResult;
import com.flamingo.ai.memoryengine.exception.ErrorKind;
import com.flamingo.ai.memoryengine.service.cache.MemoryCacheService;
import com.flamingo.ai.memoryengine.service.classifier.ClassificationVerdict;
import com.flamingo.ai.memoryengine.service.classifier.ContentClassifier;
import com.flamingo.ai.memoryengine.service.classifier.SkipReason;
import com.flamingo.ai.memoryengine.service.consolidation.ConsolidationService;
import com.flamingo.ai.memoryengine.service.consolidation.ConsolidationTaskRegistry;
import com.flamingo.ai.memoryengine.service.format.MemoryFormatter;
import com.flamingo.ai.memoryengine.service.rerank.MemoryRerankingService;
import com.flamingo.ai.memoryengine.service.similarity.SimilarityEngine;
import com.flamingo.ai.memoryengine.service.status.StatusEmitter;
import com.flamingo.ai.memoryengine.service.status.StatusSink;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of MemoryPipelineService.
 *
 * <p>Personalization is best-effort: every failure on the retrieval path degrades to "no memories"
 * and the original messages are returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryPipelineServiceImpl implements MemoryPipelineService {

  private final ContentClassifier classifier;
  private final SimilarityEngine similarityEngine;
  private final MemoryRerankingService rerankingService;
  private final ConsolidationService consolidationService;
  private final ConsolidationTaskRegistry taskRegistry;
  private final MemoryCacheService memoryCacheService;
  private final MemoryFormatter formatter;
  private final MemoryEngineConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "memory.pipeline.incoming", description = "Time to retrieve and inject memories")
  public List<ConversationMessage> onIncoming(
      List<ConversationMessage> messages, String userId, StatusSink sink) {
    if (messages == null || messages.isEmpty()) {
      return List.of();
    }
    List<ConversationMessage> original = messages.stream().filter(Objects::nonNull).toList();
    if (!config.isEnabled() || userId == null || userId.isBlank()) {
      return original;
    }

    Optional<String> userMessage = latestUserMessage(original);
    if (userMessage.isEmpty()) {
      StatusEmitter.done(sink, SkipReason.SIZE.statusMessage());
      return original;
    }

    String message = userMessage.get();
    ClassificationVerdict verdict = classifier.classify(message);
    memoryCacheService.putVerdict(userId, message, verdict);
    if (verdict.isSkip()) {
      StatusEmitter.done(sink, verdict.reason().statusMessage());
      return original;
    }

    try {
      List<SimilarityResult> selected = retrieve(message, userId, sink);
      if (selected.isEmpty()) {
        return original;
      }
      return inject(original, selected, sink);
    } catch (RuntimeException e) {
      ErrorKind kind = ErrorKind.of(e);
      log.warn("Memory retrieval failed for user {} ({}): {}", userId, kind, e.getMessage());
      meterRegistry.counter("memory.retrieval.errors", "kind", kind.tag()).increment();
      return original;
    }
  }

  @Override
  public CompletableFuture<ConsolidationResult> onOutgoing(
      List<ConversationMessage> messages, String userId, StatusSink sink) {
    if (!config.isEnabled()
        || !config.getConsolidation().isEnabled()
        || messages == null
        || userId == null
        || userId.isBlank()) {
      return CompletableFuture.completedFuture(ConsolidationResult.empty());
    }

    Optional<String> userMessage = latestUserMessage(messages);
    if (userMessage.isEmpty()) {
      return CompletableFuture.completedFuture(ConsolidationResult.empty());
    }

    String message = userMessage.get();
    Optional<ClassificationVerdict> cachedVerdict = memoryCacheService.verdict(userId, message);
    if (cachedVerdict.isPresent() && cachedVerdict.get().isSkip()) {
      log.debug("Not consolidating message for user {}: {}", userId, cachedVerdict.get().reason());
      return CompletableFuture.completedFuture(ConsolidationResult.empty());
    }

    List<SimilarityResult> cached = memoryCacheService.similarities(userId, message).orElse(null);
    return taskRegistry.submit(
        userId,
        () -> {
          // On a verdict cache miss the classifier runs here, off the caller's thread.
          ClassificationVerdict verdict =
              cachedVerdict.orElseGet(() -> classifier.classify(message));
          if (verdict.isSkip()) {
            log.debug("Not consolidating message for user {}: {}", userId, verdict.reason());
            return ConsolidationResult.empty();
          }
          return consolidationService.consolidate(message, userId, cached, sink);
        });
  }

  private List<SimilarityResult> retrieve(String message, String userId, StatusSink sink) {
    List<MemoryRecord> memories = memoryCacheService.memories(userId);
    if (memories.isEmpty()) {
      log.info("No memories found for user {}", userId);
      StatusEmitter.done(sink, "📭 No Memories Found");
      return List.of();
    }

    List<SimilarityResult> all = similarityEngine.score(userId, message, memories);
    if (!all.isEmpty()) {
      memoryCacheService.putSimilarities(userId, message, all);
    }

    List<SimilarityResult> candidates =
        similarityEngine.filter(all, similarityEngine.retrievalThreshold());
    meterRegistry.counter("memory.retrieval.count").increment(candidates.size());
    logScoreSummary(all);

    if (candidates.isEmpty()) {
      log.info("No relevant memories found above similarity threshold");
      StatusEmitter.done(sink, "📭 No Relevant Memories Found");
      return List.of();
    }

    return rerankingService.select(
        message, candidates, config.getRetrieval().getMaxReturned(), sink);
  }

  private List<ConversationMessage> inject(
      List<ConversationMessage> messages, List<SimilarityResult> selected, StatusSink sink) {
    int count = selected.size();
    for (int i = 0; i < count; i++) {
      StatusEmitter.progress(
          sink, "💭 " + (i + 1) + "/" + count + ": " + formatter.preview(selected.get(i).content()));
    }

    String contextBlock = formatter.contextBlock(selected);
    List<ConversationMessage> result = new ArrayList<>(messages);
    int systemIndex = -1;
    for (int i = 0; i < result.size(); i++) {
      if (result.get(i).role() == MessageRole.SYSTEM) {
        systemIndex = i;
        break;
      }
    }
    if (systemIndex >= 0) {
      ConversationMessage system = result.get(systemIndex);
      String existing = system.content() == null ? "" : system.content();
      result.set(systemIndex, ConversationMessage.system(existing + "\n\n" + contextBlock));
    } else {
      result.add(0, ConversationMessage.system(contextBlock));
    }

    meterRegistry.counter("memory.retrieval.injected").increment(count);
    StatusEmitter.done(
        sink, "🧠 Injected " + count + (count == 1 ? " Memory" : " Memories") + " to Context");
    return List.copyOf(result);
  }

  private void logScoreSummary(List<SimilarityResult> results) {
    if (results.isEmpty() || !log.isInfoEnabled()) {
      return;
    }
    int size = results.size();
    double top = results.get(0).relevance();
    double median =
        size % 2 == 1
            ? results.get(size / 2).relevance()
            : (results.get(size / 2 - 1).relevance() + results.get(size / 2).relevance()) / 2;
    double lowest = results.get(size - 1).relevance();
    String head =
        results.stream()
            .limit(config.getRetrieval().extendedCount())
            .map(r -> String.format(Locale.ROOT, "%.3f", r.relevance()))
            .collect(Collectors.joining(", "));
    log.info(
        "Memory similarity scores: count={}, top={}, median={}, lowest={}, first=[{}]",
        size,
        String.format(Locale.ROOT, "%.3f", top),
        String.format(Locale.ROOT, "%.3f", median),
        String.format(Locale.ROOT, "%.3f", lowest),
        head);
  }

  /** Content of the last USER message with non-blank text. */
  static Optional<String> latestUserMessage(List<ConversationMessage> messages) {
    for (int i = messages.size() - 1; i >= 0; i--) {
      ConversationMessage message = messages.get(i);
      if (message != null
          && message.role() == MessageRole.USER
          && message.content() != null
          && !message.content().isBlank()) {
        return Optional.of(message.content());
      }
    }
    return Optional.empty();
  }
}
