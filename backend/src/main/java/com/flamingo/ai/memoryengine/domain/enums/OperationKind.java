package com.flamingo.ai.memoryengine.domain.enums;

import com.flamingo.ai.memoryengine.exception.UnsupportedOperationKindException;
import java.util.Locale;

/** The closed set of store mutations a consolidation plan may contain. */
public enum OperationKind {
  CREATE,
  UPDATE,
  DELETE;

  /**
   * Parses the operation name produced by the LLM.
   *
   * @throws UnsupportedOperationKindException for anything outside the set
   */
  public static OperationKind parse(String value) {
    if (value == null || value.isBlank()) {
      throw new UnsupportedOperationKindException(String.valueOf(value));
    }
    try {
      return valueOf(value.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new UnsupportedOperationKindException(value);
    }
  }
}
