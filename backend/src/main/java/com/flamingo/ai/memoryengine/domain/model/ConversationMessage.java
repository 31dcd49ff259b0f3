package com.flamingo.ai.memoryengine.domain.model;

import com.flamingo.ai.memoryengine.domain.enums.MessageRole;

/** One message of the outgoing model request handed over by the host application. */
public record ConversationMessage(MessageRole role, String content) {

  public static ConversationMessage system(String content) {
    return new ConversationMessage(MessageRole.SYSTEM, content);
  }

  public static ConversationMessage user(String content) {
    return new ConversationMessage(MessageRole.USER, content);
  }

  public static ConversationMessage assistant(String content) {
    return new ConversationMessage(MessageRole.ASSISTANT, content);
  }
}
