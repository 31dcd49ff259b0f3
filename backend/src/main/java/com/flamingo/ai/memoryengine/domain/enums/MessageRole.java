package com.flamingo.ai.memoryengine.domain.enums;

/** Defines the role of a conversation message sender. */
public enum MessageRole {
  /** Message from the user. */
  USER,

  /** Message from the AI assistant. */
  ASSISTANT,

  /** System message; the memory context block is merged into the first one. */
  SYSTEM
}
