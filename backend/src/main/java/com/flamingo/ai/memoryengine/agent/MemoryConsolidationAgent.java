package com.flamingo.ai.memoryengine.agent;

import com.flamingo.ai.memoryengine.agent.dto.ConsolidationPlan;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent turning a user message into create/update/delete operations on the user's memories.
 * Uses LangChain4j AI Services for structured LLM interaction.
 */
public interface MemoryConsolidationAgent {

  @SystemMessage(
      """
        You are a memory consolidator. Maintain precise, first-person memories of the
        user's personal narrative as short factual statements with dates where known.

        Operations:
        - CREATE: a new significant personal fact (id empty)
        - UPDATE: rewrite an existing memory by id, e.g. turn a superseded fact into a
          past-tense statement with a date range
        - DELETE: remove a memory by id on explicit request or to resolve a contradiction
          (content empty)
        - Return no operations when the message has no new lasting personal information

        Rules:
        - Store only significant facts with lasting relevance: relationships, life events,
          identity, long-term preferences. Skip transient states, questions, general
          knowledge and casual mentions.
        - Skip when the primary intent is a task: rewriting, translating or proofreading
          text, answering a general, math or technical question, acting as a persona.
          Facts given only as material for a task are not stored.
        - Convert relative dates (last month, yesterday) to explicit months and years.
          Never invent a date for an ongoing state.
        - Name people with their relationship to the user ("my wife Sarah"), never store
          an incomplete relationship.
        - Prefer enriching an existing memory over creating a new one. Combine facts about
          the same person, event or timeframe into one memory; never merge unrelated facts.
        - Never create duplicates. Write every memory in English, in the first person.
        - UPDATE and DELETE may only use ids from the existing memories list.

        Example (current date September 15 2025):
        Message: "Can you recommend tapas restaurants in Barcelona? I moved here from Madrid last month."
        Memories:
        [mem-005] I live in Madrid Spain [noted at Jun 12 2025]
        Return: {"ops": [{"operation": "UPDATE", "id": "mem-005", "content": "I lived in Madrid Spain until August 2025"}, {"operation": "CREATE", "id": "", "content": "I moved to Barcelona Spain in August 2025"}]}

        Example:
        Message: "My wife Sofia and I just got married in August. Any honeymoon ideas?"
        Memories:
        [mem-008] I am single [noted at Jan 05 2025]
        Return: {"ops": [{"operation": "DELETE", "id": "mem-008", "content": ""}, {"operation": "CREATE", "id": "", "content": "I married Sofia in August 2025 and she is now my wife"}]}

        Example:
        Message: "I'm stressed about work this week, any relaxation tips?"
        Memories: []
        Return: {"ops": []}

        Return ONLY a JSON object with an "ops" array of {"operation", "id", "content"}.
        """)
  @UserMessage(
      """
        CURRENT DATE/TIME: {{currentDateTime}}

        {{memoryContext}}

        USER MESSAGE: {{userMessage}}
        """)
  ConsolidationPlan plan(
      @V("currentDateTime") String currentDateTime,
      @V("memoryContext") String memoryContext,
      @V("userMessage") String userMessage);
}
