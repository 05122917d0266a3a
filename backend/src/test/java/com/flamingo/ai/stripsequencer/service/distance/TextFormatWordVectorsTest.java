package com.flamingo.ai.stripsequencer.service.distance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("TextFormatWordVectors Tests")
class TextFormatWordVectorsTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("Should parse vectors and skip the word2vec header")
  void shouldParseVectorsAndSkipHeader() throws IOException {
    String content = "2 3\nhello 0.1 0.2 0.3\nworld -1 0 1.5\n";

    TextFormatWordVectors vectors = TextFormatWordVectors.read(new StringReader(content), false);

    assertThat(vectors.vocabularySize()).isEqualTo(2);
    assertThat(vectors.dimension()).isEqualTo(3);
    assertThat(vectors.vectorFor("hello")).hasValueSatisfying(
        v -> assertThat(v).containsExactly(0.1f, 0.2f, 0.3f));
    assertThat(vectors.vectorFor("world")).hasValueSatisfying(
        v -> assertThat(v).containsExactly(-1f, 0f, 1.5f));
  }

  @Test
  @DisplayName("Should parse files without a header and skip blank lines")
  void shouldParseWithoutHeader() throws IOException {
    String content = "cat 1 0\n\ndog 0 1\n";

    TextFormatWordVectors vectors = TextFormatWordVectors.read(new StringReader(content), false);

    assertThat(vectors.vocabularySize()).isEqualTo(2);
    assertThat(vectors.dimension()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should report unknown words as empty")
  void shouldReportUnknownWords() throws IOException {
    TextFormatWordVectors vectors =
        TextFormatWordVectors.read(new StringReader("cat 1 0\n"), false);

    assertThat(vectors.vectorFor("Cat")).isEmpty();
    assertThat(vectors.vectorFor("cat,")).isEmpty();
  }

  @Test
  @DisplayName("Should fall back to lower case when enabled")
  void shouldFallBackToLowerCase() throws IOException {
    TextFormatWordVectors vectors =
        TextFormatWordVectors.read(new StringReader("cat 1 0\n"), true);

    assertThat(vectors.vectorFor("CAT")).isPresent();
  }

  @Test
  @DisplayName("Should keep the first vector of a repeated word")
  void shouldKeepFirstVectorOfRepeatedWord() throws IOException {
    TextFormatWordVectors vectors =
        TextFormatWordVectors.read(new StringReader("cat 1 0\ncat 0 1\n"), false);

    assertThat(vectors.vectorFor("cat")).hasValueSatisfying(
        v -> assertThat(v).containsExactly(1f, 0f));
  }

  @Test
  @DisplayName("Should reject lines with a different dimension")
  void shouldRejectDimensionMismatch() {
    String content = "cat 1 0\ndog 0 1 2\n";

    assertThatThrownBy(() -> TextFormatWordVectors.read(new StringReader(content), false))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Line 2")
        .hasMessageContaining("expected 2");
  }

  @Test
  @DisplayName("Should reject non-numeric components")
  void shouldRejectNonNumericComponents() {
    assertThatThrownBy(
            () -> TextFormatWordVectors.read(new StringReader("cat 1 abc\n"), false))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("non-numeric");
  }

  @Test
  @DisplayName("Should load vectors from a UTF-8 file")
  void shouldLoadFromFile() throws IOException {
    Path file = tempDir.resolve("vectors.txt");
    Files.writeString(file, "3 2\ncafé 1 1\nthé 2 2\nnaïve 0 3\n", StandardCharsets.UTF_8);

    TextFormatWordVectors vectors = TextFormatWordVectors.load(file, false);

    assertThat(vectors.vocabularySize()).isEqualTo(3);
    assertThat(vectors.vectorFor("café")).isPresent();
  }
}
