package com.flamingo.ai.stripsequencer.service.sequencing;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** Whitespace tokenization used for every segment handed to a distance oracle. */
public final class Tokenizer {

  /** Unicode white space plus the ASCII information separators U+001C to U+001F. */
  private static final Pattern WHITESPACE =
      Pattern.compile("[\\s\\x1C-\\x1F]+", Pattern.UNICODE_CHARACTER_CLASS);

  private Tokenizer() {}

  /**
   * Splits text on runs of whitespace, ignoring leading and trailing whitespace. Whitespace
   * includes non-ASCII separators such as no-break and em spaces. Punctuation stays attached to its
   * word.
   *
   * @param text the text to split, may be null
   * @return the tokens in order; empty when the text is null or blank
   */
  public static List<String> tokenize(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    return Arrays.stream(WHITESPACE.split(text)).filter(token -> !token.isEmpty()).toList();
  }
}
