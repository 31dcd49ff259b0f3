package com.flamingo.ai.memoryengine.service.classifier;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.exception.InvalidInputException;
import com.flamingo.ai.memoryengine.service.classifier.ReferenceEmbeddingTable.ReferenceEmbeddings;
import com.flamingo.ai.memoryengine.service.embedding.EmbeddingService;
import com.flamingo.ai.memoryengine.util.VectorMath;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides whether a message carries personal information worth remembering.
 *
 * <p>Stages run cheapest first and the first hit wins: size validation, structural patterns, then
 * semantic comparison against the reference exemplars. Holds no per-user state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentClassifier {

  private final StructuralPatternDetector structuralPatternDetector;
  private final ReferenceEmbeddingTable referenceEmbeddingTable;
  private final EmbeddingService embeddingService;
  private final MemoryEngineConfig config;
  private final MeterRegistry meterRegistry;

  /** Classifies a raw user message. Never throws; failures past validation allow the message. */
  public ClassificationVerdict classify(String message) {
    String trimmed;
    try {
      trimmed = validateSize(message);
    } catch (InvalidInputException e) {
      log.debug("Skipping message: {}", e.getMessage());
      return record(ClassificationVerdict.skip(SkipReason.SIZE));
    }

    Optional<String> structuralRule = structuralPatternDetector.firstMatch(message);
    if (structuralRule.isPresent()) {
      log.info("Fast-path skip: structural rule '{}' matched", structuralRule.get());
      return record(ClassificationVerdict.skip(SkipReason.STRUCTURAL));
    }

    return record(classifySemantically(trimmed));
  }

  /**
   * Trims the message and checks it against the configured size window.
   *
   * @return the trimmed message
   * @throws InvalidInputException if empty or outside the window
   */
  public String validateSize(String message) {
    if (message == null || message.isBlank()) {
      throw new InvalidInputException("Message is empty");
    }
    String trimmed = message.strip();
    int min = config.getClassifier().getMinChars();
    int max = config.getClassifier().getMaxChars();
    if (trimmed.length() < min || trimmed.length() > max) {
      throw new InvalidInputException(
          "Message length " + trimmed.length() + " outside [" + min + ", " + max + "]");
    }
    return trimmed;
  }

  private ClassificationVerdict classifySemantically(String trimmed) {
    Optional<ReferenceEmbeddings> references = referenceEmbeddingTable.get();
    if (references.isEmpty()) {
      log.warn("Reference embeddings not initialized, allowing message through");
      return ClassificationVerdict.allow();
    }

    try {
      float[] messageEmbedding = embeddingService.embedUncached(List.of(trimmed)).get(0);
      double personal = VectorMath.maxDot(messageEmbedding, references.get().personal());
      double margin = config.getClassifier().getSkipMargin();

      SkipReason winner = null;
      double winningGap = margin;
      for (Map.Entry<SkipReason, float[][]> category :
          references.get().skipCategories().entrySet()) {
        double similarity = VectorMath.maxDot(messageEmbedding, category.getValue());
        double gap = similarity - personal;
        if (gap > winningGap) {
          winner = category.getKey();
          winningGap = gap;
        }
      }

      if (winner != null) {
        log.info(
            "Skipping message: {} content detected (gap {} over personal sim {}, margin {})",
            winner.tag(),
            String.format(Locale.ROOT, "%.3f", winningGap),
            String.format(Locale.ROOT, "%.3f", personal),
            margin);
        return ClassificationVerdict.skip(winner);
      }
      return ClassificationVerdict.allow();
    } catch (RuntimeException e) {
      log.warn("Semantic skip detection failed, allowing message through: {}", e.getMessage());
      return ClassificationVerdict.allow();
    }
  }

  private ClassificationVerdict record(ClassificationVerdict verdict) {
    if (verdict.isSkip()) {
      meterRegistry.counter("memory.classifier.skip", "reason", verdict.reason().tag()).increment();
    } else {
      meterRegistry.counter("memory.classifier.allow").increment();
    }
    return verdict;
  }
}
