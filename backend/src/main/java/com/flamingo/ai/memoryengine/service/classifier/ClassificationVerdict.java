package com.flamingo.ai.memoryengine.service.classifier;

import java.util.Objects;

/**
 * Classifier outcome: either allow, or skip with a reason.
 *
 * @param reason the skip reason, null when the message is allowed
 */
public record ClassificationVerdict(SkipReason reason) {

  private static final ClassificationVerdict ALLOW = new ClassificationVerdict(null);

  public static ClassificationVerdict allow() {
    return ALLOW;
  }

  public static ClassificationVerdict skip(SkipReason reason) {
    return new ClassificationVerdict(Objects.requireNonNull(reason, "reason"));
  }

  public boolean isSkip() {
    return reason != null;
  }
}
