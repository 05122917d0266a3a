package com.flamingo.ai.stripsequencer.service.sequencing;

/** How the order of a {@link SequencingResult} was obtained. */
public enum SequencingStrategy {
  /** Greedy nearest-neighbor chain from the first upload. */
  GREEDY_CHAIN,
  /** Upload order, returned because no chain could be built. */
  UPLOAD_ORDER_FALLBACK
}
