package com.flamingo.ai.memoryengine.exception;

import java.util.Locale;

/** Classifies engine failures for logging, metrics and degradation decisions. */
public enum ErrorKind {
  /** Message failed size validation; expected and never logged as an error. */
  INVALID_INPUT,

  /** A store, model or embedding call exceeded its deadline. */
  TIMEOUT,

  /** Model output did not parse or did not match the expected schema. */
  VALIDATION_FAILURE,

  /** The language-model transport failed (network, rate limit, provider error). */
  MODEL_FAILURE,

  /** The underlying memory store call failed. */
  STORE_FAILURE,

  /** An operation kind outside CREATE/UPDATE/DELETE. */
  UNSUPPORTED,

  /** Any failure not raised by the engine itself. */
  UNEXPECTED;

  /** Kind of an arbitrary failure. */
  public static ErrorKind of(Throwable error) {
    if (error instanceof MemoryEngineException) {
      return ((MemoryEngineException) error).getKind();
    }
    return UNEXPECTED;
  }

  /** Lower-case value for metric tags. */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
