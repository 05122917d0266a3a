package com.flamingo.ai.stripsequencer.service.distance;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory word vectors read from the word2vec / GloVe text format: one {@code word v1 v2 ... vd}
 * entry per line, optionally preceded by a {@code count dimension} header line.
 *
 * <p>Lookup is case-sensitive. With {@code lowercaseFallback} a word that is not found as written
 * is looked up again in lower case.
 */
@Slf4j
public class TextFormatWordVectors implements WordVectors {

  private final Map<String, float[]> vectors;
  private final int dimension;
  private final boolean lowercaseFallback;

  public TextFormatWordVectors(Map<String, float[]> vectors, boolean lowercaseFallback) {
    this.vectors = Map.copyOf(vectors);
    this.dimension =
        vectors.values().stream().findFirst().map(vector -> vector.length).orElse(0);
    this.lowercaseFallback = lowercaseFallback;
  }

  /**
   * Loads a vector file from disk.
   *
   * @param path UTF-8 text file in word2vec text format
   * @param lowercaseFallback whether unknown words are retried in lower case
   * @return the loaded vectors
   * @throws IOException if the file cannot be read
   * @throws IllegalStateException if a line is malformed or has the wrong dimension
   */
  public static TextFormatWordVectors load(Path path, boolean lowercaseFallback)
      throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      TextFormatWordVectors loaded = read(reader, lowercaseFallback);
      log.info(
          "Loaded {} word vectors of dimension {} from {}",
          loaded.vocabularySize(),
          loaded.dimension(),
          path);
      return loaded;
    }
  }

  /** Parses vectors from an open reader; the reader is not closed. */
  public static TextFormatWordVectors read(Reader reader, boolean lowercaseFallback)
      throws IOException {
    BufferedReader lines =
        reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
    Map<String, float[]> vectors = new HashMap<>();
    int expectedDimension = -1;
    int lineNumber = 0;

    String line;
    while ((line = lines.readLine()) != null) {
      lineNumber++;
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      String[] parts = trimmed.split("\\s+");
      if (lineNumber == 1 && isHeader(parts)) {
        continue;
      }
      if (parts.length < 2) {
        throw new IllegalStateException("Line " + lineNumber + " has no vector components");
      }

      int lineDimension = parts.length - 1;
      if (expectedDimension < 0) {
        expectedDimension = lineDimension;
      } else if (lineDimension != expectedDimension) {
        throw new IllegalStateException(
            "Line "
                + lineNumber
                + " has dimension "
                + lineDimension
                + ", expected "
                + expectedDimension);
      }

      float[] vector = new float[lineDimension];
      for (int i = 0; i < lineDimension; i++) {
        try {
          vector[i] = Float.parseFloat(parts[i + 1]);
        } catch (NumberFormatException e) {
          throw new IllegalStateException(
              "Line " + lineNumber + " has a non-numeric component '" + parts[i + 1] + "'", e);
        }
      }
      vectors.putIfAbsent(parts[0], vector);
    }

    return new TextFormatWordVectors(vectors, lowercaseFallback);
  }

  private static boolean isHeader(String[] parts) {
    return parts.length == 2 && parts[0].matches("\\d+") && parts[1].matches("\\d+");
  }

  @Override
  public Optional<float[]> vectorFor(String word) {
    float[] vector = vectors.get(word);
    if (vector == null && lowercaseFallback) {
      vector = vectors.get(word.toLowerCase(Locale.ROOT));
    }
    return Optional.ofNullable(vector);
  }

  @Override
  public String getSourceName() {
    return "TextFormatWordVectors";
  }

  public int vocabularySize() {
    return vectors.size();
  }

  public int dimension() {
    return dimension;
  }
}
