package com.flamingo.ai.memoryengine.service.status;

import lombok.extern.slf4j.Slf4j;

/** Emits status events to an optional sink; never throws. */
@Slf4j
public final class StatusEmitter {

  private StatusEmitter() {}

  public static void emit(StatusSink sink, String description, boolean done) {
    if (sink == null) {
      return;
    }
    try {
      sink.accept(new StatusEvent(description, done));
    } catch (RuntimeException e) {
      log.debug("Status sink rejected event '{}': {}", description, e.getMessage());
    }
  }

  /** Emits an intermediate event. */
  public static void progress(StatusSink sink, String description) {
    emit(sink, description, false);
  }

  /** Emits a final event. */
  public static void done(StatusSink sink, String description) {
    emit(sink, description, true);
  }
}
