package com.flamingo.ai.memoryengine.service.classifier;

import java.util.Locale;

/** Why a message is not worth memory processing. */
public enum SkipReason {
  SIZE("📏 Message Length Out of Limits, skipping memory operations"),
  STRUCTURAL("🚫 Structured or Technical Content Detected, skipping memory operations"),
  NON_PERSONAL("🚫 Non-Personal Content Detected, skipping memory operations"),
  TECHNICAL("🚫 Technical Content Detected, skipping memory operations"),
  INSTRUCTION("🚫 Formatting Instruction Detected, skipping memory operations"),
  ARITHMETIC("🚫 Calculation Request Detected, skipping memory operations"),
  TRANSLATION("🚫 Translation Request Detected, skipping memory operations"),
  GRAMMAR("🚫 Proofreading Request Detected, skipping memory operations");

  private final String statusMessage;

  SkipReason(String statusMessage) {
    this.statusMessage = statusMessage;
  }

  /** Text emitted to the status sink when a message is skipped. */
  public String statusMessage() {
    return statusMessage;
  }

  /** Lower-case value for metric tags. */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
