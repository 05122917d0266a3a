package com.flamingo.ai.stripsequencer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for upload handling, text extraction and sequencing. */
@Configuration
@ConfigurationProperties(prefix = "sequencing")
@Getter
@Setter
public class SequencingConfig {

  /**
   * Return panels in upload order when no chain can be built (incomparable panels or a failing
   * distance oracle) instead of failing the request.
   */
  private boolean fallbackToUploadOrder = true;

  private Distance distance = new Distance();
  private Upload upload = new Upload();
  private Extraction extraction = new Extraction();

  @Getter
  @Setter
  public static class Distance {
    /** Word vector source: "embedding-model" (default) or "file". */
    private String vectors = "embedding-model";

    /** Path of a word2vec text-format file, required when {@code vectors=file}. */
    private String vectorsFile;

    /** Retry unknown words in lower case when reading vectors from a file. */
    private boolean lowercaseFallback = false;

    /** Scale word vectors to unit length before measuring word-to-word distances. */
    private boolean normalizeVectors = true;

    /** Maximum number of words whose embedding-model vectors are kept in memory. */
    private int cacheSize = 50_000;
  }

  @Getter
  @Setter
  public static class Upload {
    /** Maximum number of images accepted in one request. */
    private int maxFiles = 50;

    /** Maximum image size in bytes; larger uploads are rejected. */
    private long maxFileSizeBytes = 10 * 1024 * 1024L; // 10 MB
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Answer the vision model gives for an image without text. */
    private String noTextMarker = "NO_TEXT";

    /** Seconds to wait for all extractions of one request. */
    private int timeoutSeconds = 120;
  }
}
