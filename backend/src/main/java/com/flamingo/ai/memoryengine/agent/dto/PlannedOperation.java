package com.flamingo.ai.memoryengine.agent.dto;

/**
 * One operation proposed by MemoryConsolidationAgent, before validation.
 *
 * <p>{@code operation} stays a raw string so an unknown value can be rejected instead of failing
 * the whole response.
 */
public record PlannedOperation(
    String operation, // "CREATE", "UPDATE", "DELETE"
    String id, // empty for CREATE
    String content // empty for DELETE
    ) {}
