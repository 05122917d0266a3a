package com.flamingo.ai.stripsequencer.api.rest;

import com.flamingo.ai.stripsequencer.api.dto.request.DataUrlSequenceRequest;
import com.flamingo.ai.stripsequencer.api.dto.request.TextSequenceRequest;
import com.flamingo.ai.stripsequencer.api.dto.response.SequenceResponse;
import com.flamingo.ai.stripsequencer.domain.model.ImageUpload;
import com.flamingo.ai.stripsequencer.service.extraction.ImageUploadDecoder;
import com.flamingo.ai.stripsequencer.service.sequencing.SequencingService;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for ordering comic strip panels. */
@RestController
@RequestMapping("/api/sequences")
@RequiredArgsConstructor
public class SequenceController {

  private final SequencingService sequencingService;
  private final ImageUploadDecoder imageUploadDecoder;

  /** Extracts the text of each uploaded image and returns the images in reading order. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<SequenceResponse> sequenceImages(
      @RequestParam(value = "files", required = false) List<MultipartFile> files) {
    List<ImageUpload> uploads =
        imageUploadDecoder.fromMultipart(files != null ? files : List.of());
    return ResponseEntity.ok(
        SequenceResponse.fromResult(sequencingService.sequenceUploads(uploads)));
  }

  /** Same as {@link #sequenceImages}, for images sent as Base64 data URLs. */
  @PostMapping(value = "/data-urls", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<SequenceResponse> sequenceDataUrls(
      @Valid @RequestBody DataUrlSequenceRequest request) {
    List<DataUrlSequenceRequest.Upload> requested = request.getUploads();
    imageUploadDecoder.requireBatchSize(requested.size());
    List<ImageUpload> uploads = new ArrayList<>(requested.size());
    for (int i = 0; i < requested.size(); i++) {
      DataUrlSequenceRequest.Upload upload = requested.get(i);
      uploads.add(imageUploadDecoder.fromDataUrl(i, upload.getFileName(), upload.getContent()));
    }
    return ResponseEntity.ok(
        SequenceResponse.fromResult(sequencingService.sequenceUploads(uploads)));
  }

  /** Orders fragments whose text was extracted elsewhere. */
  @PostMapping(value = "/text", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<SequenceResponse> sequenceTexts(
      @Valid @RequestBody TextSequenceRequest request) {
    return ResponseEntity.ok(
        SequenceResponse.fromResult(
            sequencingService.sequenceTexts(request.toTextFragments())));
  }
}
