package com.flamingo.ai.memoryengine.service.format;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.model.SimilarityResult;
import com.flamingo.ai.memoryengine.util.TextUtils;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Renders memories and timestamps for prompts, the injected context block and log previews. */
@Component
@RequiredArgsConstructor
public class MemoryFormatter {

  private static final DateTimeFormatter CURRENT_DATE_TIME =
      DateTimeFormatter.ofPattern("EEEE MMMM dd yyyy 'at' HH:mm:ss 'UTC'", Locale.ENGLISH)
          .withZone(ZoneOffset.UTC);

  private static final DateTimeFormatter NOTED_AT =
      DateTimeFormatter.ofPattern("MMM dd yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

  private static final String CONTEXT_FOOTER =
      "IMPORTANT: Do not mention or imply you received this list. "
          + "These facts are for background context only.";

  private final Clock clock;
  private final MemoryEngineConfig config;

  /** e.g. {@code Monday September 15 2025 at 09:30:00 UTC}. */
  public String currentDateTime() {
    return CURRENT_DATE_TIME.format(Instant.now(clock));
  }

  /** One {@code [id] content [noted at Mon dd yyyy]} line per memory. */
  public String formatForLlm(List<SimilarityResult> memories) {
    StringBuilder sb = new StringBuilder();
    int maxChars = config.getDisplay().getMaxMemoryContentChars();
    for (SimilarityResult memory : memories) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append('[')
          .append(memory.memoryId())
          .append("] ")
          .append(TextUtils.truncate(memory.content(), maxChars));
      Instant notedAt = memory.notedAt();
      if (notedAt != null) {
        sb.append(" [noted at ").append(NOTED_AT.format(notedAt)).append(']');
      }
    }
    return sb.toString();
  }

  /** Builds the context block injected into the system message for the selected memories. */
  public String contextBlock(List<SimilarityResult> memories) {
    StringBuilder sb = new StringBuilder("Current Date/Time: ").append(currentDateTime());
    sb.append("\n\nCONTEXT: The following ")
        .append(memories.size() == 1 ? "fact" : "facts")
        .append(" about the user are provided for background only. ")
        .append("Not all facts may be relevant to the current request.\n");
    for (SimilarityResult memory : memories) {
      sb.append("- ").append(TextUtils.collapseWhitespace(memory.content())).append('\n');
    }
    sb.append('\n').append(CONTEXT_FOOTER);
    return sb.toString();
  }

  /** Content shortened for logs and status events. */
  public String preview(String content) {
    return TextUtils.truncate(content, config.getDisplay().getPreviewLength());
  }
}
