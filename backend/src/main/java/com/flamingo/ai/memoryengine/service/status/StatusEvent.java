package com.flamingo.ai.memoryengine.service.status;

/**
 * Progress notification for the host UI.
 *
 * @param description human-readable text
 * @param done whether this is the last event of the current step
 */
public record StatusEvent(String description, boolean done) {}
