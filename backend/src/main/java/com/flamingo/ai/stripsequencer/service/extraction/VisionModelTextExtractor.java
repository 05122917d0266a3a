package com.flamingo.ai.stripsequencer.service.extraction;

import com.flamingo.ai.stripsequencer.config.SequencingConfig;
import com.flamingo.ai.stripsequencer.domain.model.ImageUpload;
import com.flamingo.ai.stripsequencer.exception.TextExtractionException;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Base64;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Text extraction through a vision-capable chat model. The image is sent inline as Base64 and the
 * model is asked for a plain line-by-line transcription.
 */
@Service
@Slf4j
public class VisionModelTextExtractor implements TextExtractor {

  private static final String SYSTEM_PROMPT =
      """
      You are an OCR engine for comic strip panels. Transcribe every piece of text visible in
      the image, including speech balloons, captions and sound effects. Output one line of text
      per line in the image, top to bottom, left to right. Output only the transcription, with
      no commentary, quotes or markdown. If the image contains no text, output exactly %s.
      """;

  private final ChatModel visionChatModel;
  private final MeterRegistry meterRegistry;
  private final String noTextMarker;

  public VisionModelTextExtractor(
      @Qualifier("visionChatModel") ChatModel visionChatModel,
      MeterRegistry meterRegistry,
      SequencingConfig sequencingConfig) {
    this.visionChatModel = visionChatModel;
    this.meterRegistry = meterRegistry;
    this.noTextMarker = sequencingConfig.getExtraction().getNoTextMarker();
  }

  @Override
  @Timed(value = "extraction.vision", description = "Time to extract text from one image")
  @Retry(name = "ocr")
  public String extract(ImageUpload upload) {
    log.debug(
        "Extracting text from '{}' ({} bytes, {})",
        upload.fileName(),
        upload.size(),
        upload.mimeType());

    ChatResponse response;
    try {
      response =
          visionChatModel.chat(
              SystemMessage.from(SYSTEM_PROMPT.formatted(noTextMarker)),
              UserMessage.from(
                  TextContent.from("Transcribe the text in this image."),
                  ImageContent.from(
                      Base64.getEncoder().encodeToString(upload.data()), upload.mimeType())));
    } catch (RuntimeException e) {
      meterRegistry.counter("extraction.requests.failure").increment();
      throw new TextExtractionException(
          upload.fileName(), "Vision model call failed: " + e.getMessage(), e);
    }

    String answer = response.aiMessage() != null ? response.aiMessage().text() : null;
    String text = normalize(answer, noTextMarker);
    meterRegistry
        .counter("extraction.requests.success", "empty", String.valueOf(text.isEmpty()))
        .increment();
    log.debug(
        "Extracted {} line(s) from '{}'",
        text.isEmpty() ? 0 : text.lines().count(),
        upload.fileName());
    return text;
  }

  /**
   * Normalizes a transcription: every line trimmed, blank lines removed, lines joined with {@code
   * \n}. A null answer or one equal to the no-text marker yields an empty string.
   */
  static String normalize(String answer, String noTextMarker) {
    if (answer == null) {
      return "";
    }
    String text =
        answer
            .lines()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.joining("\n"));
    if (text.equals(noTextMarker)) {
      return "";
    }
    return text;
  }
}
