package com.flamingo.ai.memoryengine.config;

import com.flamingo.ai.memoryengine.service.cache.CacheKind;
import com.flamingo.ai.memoryengine.service.classifier.ClassifierGranularity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the memory engine. */
@Configuration
@ConfigurationProperties(prefix = "memory")
@Validated
@Getter
@Setter
public class MemoryEngineConfig {

  private boolean enabled = true;

  @Valid private Cache cache = new Cache();
  @Valid private Classifier classifier = new Classifier();
  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Reranking reranking = new Reranking();
  @Valid private Consolidation consolidation = new Consolidation();
  @Valid private Store store = new Store();
  @Valid private Display display = new Display();
  @Valid private Shutdown shutdown = new Shutdown();

  @Getter
  @Setter
  public static class Cache {
    @Min(1)
    private int maxUsers = 50;

    @Min(1)
    private int maxEntriesPerKind = 500;

    /** Optional per-kind capacity overrides; kinds not listed use maxEntriesPerKind. */
    private Map<CacheKind, Integer> kindCapacities = new EnumMap<>(CacheKind.class);

    /** How long a classifier verdict stays reusable for the same message. */
    @NotNull private Duration verdictTtl = Duration.ofMinutes(5);

    @Min(4)
    private int keyHashPrefixLength = 10;

    public int capacityFor(CacheKind kind) {
      Integer override = kindCapacities.get(kind);
      return override != null && override > 0 ? override : maxEntriesPerKind;
    }
  }

  @Getter
  @Setter
  public static class Classifier {
    @Min(1)
    private int minChars = 10;

    @Min(1)
    private int maxChars = 2500;

    /**
     * How far a skip category's best similarity must exceed the personal one before the message
     * is skipped. Re-tune per embedding model.
     */
    @DecimalMin("0.0")
    private double skipMargin = 0.20;

    @NotNull private ClassifierGranularity granularity = ClassifierGranularity.BINARY;
  }

  @Getter
  @Setter
  public static class Retrieval {
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double semanticThreshold = 0.25;

    /** Applied to semanticThreshold for consolidation candidates (lower = wider net). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double relaxedThresholdMultiplier = 0.8;

    @Min(1)
    private int maxReturned = 10;

    /** Multiplier for candidate pools handed to the LLM (reranking and consolidation). */
    @DecimalMin("1.0")
    private double extensionMultiplier = 1.6;

    public int extendedCount() {
      return (int) (maxReturned * extensionMultiplier);
    }
  }

  @Getter
  @Setter
  public static class Reranking {
    private boolean enabled = true;

    /** LLM reranking runs only when candidates exceed maxReturned times this value. */
    @DecimalMin("0.0")
    private double triggerMultiplier = 0.8;
  }

  @Getter
  @Setter
  public static class Consolidation {
    private boolean enabled = true;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double dedupThreshold = 0.90;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double maxDeleteRatio = 0.6;

    @Min(1)
    private int minOpsForRatioCheck = 6;

    @Min(1)
    private int maxParallelOperations = 4;

    @NotNull private Duration llmTimeout = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class Store {
    @NotNull private Duration operationTimeout = Duration.ofSeconds(10);
  }

  @Getter
  @Setter
  public static class Display {
    @Min(10)
    private int previewLength = 100;

    /** Memory content longer than this is truncated before it is sent to the LLM. */
    @Min(10)
    private int maxMemoryContentChars = 500;
  }

  @Getter
  @Setter
  public static class Shutdown {
    @NotNull private Duration awaitTimeout = Duration.ofSeconds(30);
  }
}
