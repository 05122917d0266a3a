package com.flamingo.ai.stripsequencer.domain.model;

/**
 * A decoded image upload.
 *
 * @param index 0-based position of this upload in the submitted batch
 * @param fileName original file name (or a generated one when the client sent none)
 * @param mimeType MIME type of the image data (e.g. {@code image/png})
 * @param data raw image bytes
 */
public record ImageUpload(int index, String fileName, String mimeType, byte[] data) {

  public int size() {
    return data.length;
  }
}
