package com.flamingo.ai.stripsequencer.service.extraction;

import com.flamingo.ai.stripsequencer.config.SequencingConfig;
import com.flamingo.ai.stripsequencer.domain.model.ImageUpload;
import com.flamingo.ai.stripsequencer.exception.InvalidUploadException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/**
 * Turns raw uploads into {@link ImageUpload}s: multipart files, or Base64 {@code data:} URLs as
 * produced by browser upload widgets.
 *
 * <p>Rejects empty payloads, non-image MIME types, oversized images and batches with too many
 * files.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageUploadDecoder {

  static final String DEFAULT_MIME_TYPE = MediaType.IMAGE_PNG_VALUE;
  private static final String BASE64_MARKER = "base64,";

  private final SequencingConfig sequencingConfig;

  /**
   * Decodes multipart files, keeping their order.
   *
   * @param files uploaded parts
   * @return one upload per file, indexed by position
   */
  public List<ImageUpload> fromMultipart(List<MultipartFile> files) {
    requireBatchSize(files.size());
    List<ImageUpload> uploads = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      MultipartFile file = files.get(i);
      String fileName = fileNameOrDefault(file.getOriginalFilename(), i);
      byte[] data;
      try {
        data = file.getBytes();
      } catch (IOException e) {
        throw new InvalidUploadException(fileName, "Could not read upload '" + fileName + "'", e);
      }
      uploads.add(validated(i, fileName, mimeTypeOrDefault(file.getContentType()), data));
    }
    return uploads;
  }

  /**
   * Decodes a {@code data:} URL. Everything after the first {@code base64,} is the payload; the
   * MIME type comes from the {@code data:<type>;} prefix when there is one.
   *
   * @param index position of the upload in its batch
   * @param fileName client-side file name, may be null
   * @param content the data URL
   * @return the decoded upload
   */
  public ImageUpload fromDataUrl(int index, String fileName, String content) {
    String name = fileNameOrDefault(fileName, index);
    if (content == null || content.isBlank()) {
      throw new InvalidUploadException(name, "Upload '" + name + "' has no content");
    }

    int marker = content.indexOf(BASE64_MARKER);
    String header = marker >= 0 ? content.substring(0, marker) : "";
    String payload = marker >= 0 ? content.substring(marker + BASE64_MARKER.length()) : content;

    byte[] data;
    try {
      data = Base64.getMimeDecoder().decode(payload.strip());
    } catch (IllegalArgumentException e) {
      throw new InvalidUploadException(name, "Upload '" + name + "' is not valid Base64", e);
    }
    return validated(index, name, mimeTypeOrDefault(mimeTypeFromHeader(header)), data);
  }

  /** Checks the number of uploads in one request against the configured maximum. */
  public void requireBatchSize(int count) {
    int maxFiles = sequencingConfig.getUpload().getMaxFiles();
    if (count > maxFiles) {
      throw new InvalidUploadException(
          null, "Too many uploads: " + count + " (maximum " + maxFiles + ")");
    }
  }

  private ImageUpload validated(int index, String fileName, String mimeType, byte[] data) {
    if (data == null || data.length == 0) {
      throw new InvalidUploadException(fileName, "Upload '" + fileName + "' is empty");
    }
    if (!mimeType.startsWith("image/")) {
      throw new InvalidUploadException(
          fileName, "Upload '" + fileName + "' is not an image (" + mimeType + ")");
    }
    long maxBytes = sequencingConfig.getUpload().getMaxFileSizeBytes();
    if (data.length > maxBytes) {
      throw new InvalidUploadException(
          fileName,
          "Upload '" + fileName + "' is " + data.length + " bytes (maximum " + maxBytes + ")");
    }
    return new ImageUpload(index, fileName, mimeType, data);
  }

  private static String mimeTypeFromHeader(String header) {
    // data:image/png;
    if (!header.startsWith("data:")) {
      return null;
    }
    String type = header.substring("data:".length());
    int semicolon = type.indexOf(';');
    return semicolon >= 0 ? type.substring(0, semicolon) : type;
  }

  private static String mimeTypeOrDefault(String mimeType) {
    if (mimeType == null || mimeType.isBlank()) {
      return DEFAULT_MIME_TYPE;
    }
    try {
      MediaType mediaType = MediaType.parseMediaType(mimeType);
      return (mediaType.getType() + "/" + mediaType.getSubtype()).toLowerCase(Locale.ROOT);
    } catch (InvalidMediaTypeException e) {
      log.debug("Unparseable MIME type '{}', using {}", mimeType, DEFAULT_MIME_TYPE);
      return DEFAULT_MIME_TYPE;
    }
  }

  private static String fileNameOrDefault(String fileName, int index) {
    return fileName == null || fileName.isBlank() ? "upload-" + (index + 1) : fileName;
  }
}
