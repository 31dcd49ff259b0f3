package com.flamingo.ai.memoryengine.service.classifier;

/** How non-personal reference exemplars are grouped into skip categories. */
public enum ClassifierGranularity {
  /** All non-personal exemplars form one {@link SkipReason#NON_PERSONAL} category. */
  BINARY,

  /** Each exemplar group is its own skip category, so the verdict names the kind of content. */
  CATEGORIZED
}
