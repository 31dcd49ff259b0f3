package com.flamingo.ai.memoryengine.service.status;

/** Receives fire-and-forget progress events from the pipeline. */
@FunctionalInterface
public interface StatusSink {

  void accept(StatusEvent event);
}
