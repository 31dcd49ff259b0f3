package com.flamingo.ai.memoryengine.agent.dto;

import java.util.List;

/** Structured JSON output from MemoryRerankingAgent: memory ids, most relevant first. */
public record MemorySelection(List<String> ids) {

  public List<String> safeIds() {
    return ids == null ? List.of() : ids;
  }
}
