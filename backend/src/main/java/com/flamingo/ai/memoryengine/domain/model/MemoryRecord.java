package com.flamingo.ai.memoryengine.domain.model;

import java.time.Instant;

/**
 * A persisted memory as seen by the engine. Held for one pipeline pass only.
 *
 * @param id store identifier
 * @param ownerUserId owning user
 * @param content short first-person factual statement
 * @param createdAt creation time, may be null
 * @param updatedAt last update time, may be null
 */
public record MemoryRecord(
    String id, String ownerUserId, String content, Instant createdAt, Instant updatedAt) {}
