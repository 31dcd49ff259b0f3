package com.flamingo.ai.memoryengine.agent;

import com.flamingo.ai.memoryengine.agent.dto.MemorySelection;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent selecting the memories that best personalize a response.
 *
 * <p>Candidates arrive pre-ranked by embedding similarity; the agent returns an ordered subset.
 */
public interface MemoryRerankingAgent {

  @SystemMessage(
      """
        You are a memory relevance analyzer. Select the memories about the user that help
        personalize the answer to their message.

        Relevance:
        - Direct: memories about the topic, people or domain of the message
        - Contextual: personal facts that change what a good answer recommends
        - Background: situational details that add useful personalization

        Rules:
        - Prefer current facts over historical ones unless the message is about the past
          or the history explains the present situation
        - Order ids by relevance, most relevant first
        - Return at most {{maxCount}} ids
        - Return an empty list when the message needs no personal context, such as a
          general technical explanation

        Example (current date September 15 2025):
        Message: "What are some good anniversary gift ideas for my wife, Sarah?"
        Memories:
        [mem-101] My wife is named Sarah
        [mem-102] My wife Sarah loves hiking and mystery novels
        [mem-103] My wedding anniversary with Sarah is in October
        [mem-104] I am on a tight budget this month
        [mem-105] I live in Denver
        Return: {"ids": ["mem-102", "mem-103", "mem-101", "mem-104"]}

        Example:
        Message: "Can you explain how quantum bits differ from regular bits?"
        Memories:
        [mem-026] I work as a senior software engineer at Tesla
        [mem-027] My wife is named Sarah
        Return: {"ids": []}

        Return ONLY a JSON object with an "ids" array.
        """)
  @UserMessage(
      """
        CURRENT DATE/TIME: {{currentDateTime}}

        USER MESSAGE: {{userMessage}}

        CANDIDATE MEMORIES:
        {{memories}}
        """)
  MemorySelection select(
      @V("currentDateTime") String currentDateTime,
      @V("userMessage") String userMessage,
      @V("memories") String memories,
      @V("maxCount") int maxCount);
}
