package com.flamingo.ai.stripsequencer.domain.model;

/**
 * Stable reference from a {@link Segment} back to the upload it came from.
 *
 * @param uploadIndex 0-based position of the upload in the submitted batch
 * @param name display name of the upload, usually the original file name
 */
public record SegmentIdentity(int uploadIndex, String name) {

  @Override
  public String toString() {
    return "#" + uploadIndex + " '" + name + "'";
  }
}
