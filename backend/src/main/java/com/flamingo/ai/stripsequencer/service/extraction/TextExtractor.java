package com.flamingo.ai.stripsequencer.service.extraction;

import com.flamingo.ai.stripsequencer.domain.model.ImageUpload;

/** Extracts the text shown in an uploaded image. */
public interface TextExtractor {

  /**
   * Reads the text in the image, one line of output per line of text.
   *
   * @param upload the decoded image
   * @return the extracted text, empty when the image shows none; never null
   * @throws com.flamingo.ai.stripsequencer.exception.TextExtractionException on failure
   */
  String extract(ImageUpload upload);
}
