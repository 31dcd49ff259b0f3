package com.flamingo.ai.memoryengine.config;

import com.flamingo.ai.memoryengine.agent.MemoryConsolidationAgent;
import com.flamingo.ai.memoryengine.agent.MemoryRerankingAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the memory agents with LangChain4j AI Services.
 *
 * <p>Each agent is an interface carrying its prompts as @SystemMessage/@UserMessage templates; the
 * typed return value is the output schema the model response has to satisfy.
 */
@Configuration
public class AiAgentConfig {

  /** Turns a user message plus candidate memories into create/update/delete operations. */
  @Bean
  public MemoryConsolidationAgent memoryConsolidationAgent(ChatModel chatModel) {
    return AiServices.builder(MemoryConsolidationAgent.class).chatModel(chatModel).build();
  }

  /** Picks and orders the memories most relevant to a user message. */
  @Bean
  public MemoryRerankingAgent memoryRerankingAgent(ChatModel chatModel) {
    return AiServices.builder(MemoryRerankingAgent.class).chatModel(chatModel).build();
  }
}
