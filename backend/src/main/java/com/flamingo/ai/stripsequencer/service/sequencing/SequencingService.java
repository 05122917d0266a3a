package com.flamingo.ai.stripsequencer.service.sequencing;

import com.flamingo.ai.stripsequencer.domain.model.ImageUpload;
import com.flamingo.ai.stripsequencer.domain.model.TextFragment;
import java.util.List;

/**
 * Orders uploaded strip panels by the meaning of their text.
 *
 * <p>When no chain can be built and upload-order fallback is enabled, the panels come back in the
 * order they were uploaded, with the reason attached to the result.
 */
public interface SequencingService {

  /**
   * Extracts the text of every image and orders the images.
   *
   * @param uploads decoded images in upload order
   * @return the images' segments in reconstructed order
   * @throws com.flamingo.ai.stripsequencer.exception.EmptyInputException if there are no uploads
   * @throws com.flamingo.ai.stripsequencer.exception.TextExtractionException if any extraction
   *     fails
   */
  SequencingResult sequenceUploads(List<ImageUpload> uploads);

  /**
   * Orders fragments whose text was extracted elsewhere.
   *
   * @param fragments fragments in upload order
   * @return the fragments' segments in reconstructed order
   * @throws com.flamingo.ai.stripsequencer.exception.EmptyInputException if there are no fragments
   */
  SequencingResult sequenceTexts(List<TextFragment> fragments);
}
