package com.flamingo.ai.stripsequencer.service.sequencing;

import com.flamingo.ai.stripsequencer.config.SequencingConfig;
import com.flamingo.ai.stripsequencer.domain.model.ImageUpload;
import com.flamingo.ai.stripsequencer.domain.model.Ordering;
import com.flamingo.ai.stripsequencer.domain.model.Segment;
import com.flamingo.ai.stripsequencer.domain.model.TextFragment;
import com.flamingo.ai.stripsequencer.exception.DistanceComputationException;
import com.flamingo.ai.stripsequencer.exception.EmptyInputException;
import com.flamingo.ai.stripsequencer.exception.NoSelectableCandidateException;
import com.flamingo.ai.stripsequencer.exception.TextExtractionException;
import com.flamingo.ai.stripsequencer.service.distance.DistanceOracle;
import com.flamingo.ai.stripsequencer.service.extraction.TextExtractor;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** Implementation of {@link SequencingService}. */
@Service
@Slf4j
public class SequencingServiceImpl implements SequencingService {

  private final SequencingEngine sequencingEngine;
  private final DistanceOracle distanceOracle;
  private final TextExtractor textExtractor;
  private final Executor extractionExecutor;
  private final SequencingConfig sequencingConfig;
  private final MeterRegistry meterRegistry;

  public SequencingServiceImpl(
      SequencingEngine sequencingEngine,
      DistanceOracle distanceOracle,
      TextExtractor textExtractor,
      @Qualifier("extractionExecutor") Executor extractionExecutor,
      SequencingConfig sequencingConfig,
      MeterRegistry meterRegistry) {
    this.sequencingEngine = sequencingEngine;
    this.distanceOracle = distanceOracle;
    this.textExtractor = textExtractor;
    this.extractionExecutor = extractionExecutor;
    this.sequencingConfig = sequencingConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "sequencing.uploads", description = "Time to extract and sequence uploads")
  public SequencingResult sequenceUploads(List<ImageUpload> uploads) {
    if (uploads == null || uploads.isEmpty()) {
      throw new EmptyInputException("No uploads to sequence");
    }

    log.info("Extracting text from {} upload(s)", uploads.size());
    List<CompletableFuture<String>> extractions = new ArrayList<>(uploads.size());
    List<Segment> segments = new ArrayList<>(uploads.size());
    try {
      for (ImageUpload upload : uploads) {
        extractions.add(submitExtraction(upload));
      }

      long deadline =
          System.nanoTime()
              + TimeUnit.SECONDS.toNanos(sequencingConfig.getExtraction().getTimeoutSeconds());
      for (int i = 0; i < uploads.size(); i++) {
        ImageUpload upload = uploads.get(i);
        String text = awaitExtraction(extractions.get(i), upload, deadline);
        segments.add(Segment.of(upload.index(), upload.fileName(), text));
      }
    } catch (RuntimeException e) {
      extractions.forEach(extraction -> extraction.cancel(true));
      throw e;
    }

    return sequenceSegments(segments);
  }

  @Override
  @Timed(value = "sequencing.texts", description = "Time to sequence extracted texts")
  public SequencingResult sequenceTexts(List<TextFragment> fragments) {
    List<Segment> segments = new ArrayList<>();
    if (fragments != null) {
      for (int i = 0; i < fragments.size(); i++) {
        TextFragment fragment = fragments.get(i);
        segments.add(Segment.of(i, fragment.name(), fragment.text()));
      }
    }
    return sequenceSegments(segments);
  }

  private SequencingResult sequenceSegments(List<Segment> segments) {
    CountingDistanceOracle oracle = new CountingDistanceOracle(distanceOracle);
    try {
      Ordering ordering = sequencingEngine.sequence(segments, oracle);
      meterRegistry.counter("sequencing.runs", "strategy", "greedy_chain").increment();
      log.info(
          "Sequenced {} segment(s) with {} distance call(s), anchor {}",
          ordering.size(),
          oracle.calls(),
          ordering.anchor().identity());
      return SequencingResult.chained(ordering);
    } catch (NoSelectableCandidateException e) {
      return fallbackOrRethrow(segments, e, "no_selectable_candidate");
    } catch (DistanceComputationException e) {
      return fallbackOrRethrow(segments, e, "distance_failed");
    } finally {
      meterRegistry.summary("sequencing.oracle.calls").record(oracle.calls());
    }
  }

  private SequencingResult fallbackOrRethrow(
      List<Segment> segments, RuntimeException cause, String reason) {
    if (!sequencingConfig.isFallbackToUploadOrder()) {
      throw cause;
    }
    log.warn(
        "Falling back to upload order for {} segment(s): {}", segments.size(), cause.getMessage());
    meterRegistry.counter("sequencing.fallbacks", "reason", reason).increment();
    meterRegistry.counter("sequencing.runs", "strategy", "upload_order_fallback").increment();
    return SequencingResult.fallback(Ordering.uploadOrder(segments), cause.getMessage());
  }

  private CompletableFuture<String> submitExtraction(ImageUpload upload) {
    try {
      return CompletableFuture.supplyAsync(() -> textExtractor.extract(upload), extractionExecutor);
    } catch (RejectedExecutionException e) {
      meterRegistry.counter("extraction.requests.rejected").increment();
      log.warn("Extraction pool is saturated, rejecting '{}'", upload.fileName());
      throw new TextExtractionException(
          upload.fileName(), "Text extraction capacity exhausted, try again later", e);
    }
  }

  private String awaitExtraction(
      CompletableFuture<String> extraction, ImageUpload upload, long deadline) {
    try {
      long remaining = Math.max(0L, deadline - System.nanoTime());
      String text = extraction.get(remaining, TimeUnit.NANOSECONDS);
      return text != null ? text : "";
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new TextExtractionException(
          upload.fileName(), "Text extraction failed: " + cause.getMessage(), cause);
    } catch (TimeoutException e) {
      throw new TextExtractionException(upload.fileName(), "Text extraction timed out", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TextExtractionException(upload.fileName(), "Text extraction interrupted", e);
    }
  }
}
