package com.slack.dispatch.storage;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Splits free text into lower cased alphanumeric tokens for match-all filtering and indexing. */
public class TermTokenizer {
  private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

  public static Set<String> tokenize(String text) {
    Set<String> tokens = new LinkedHashSet<>();
    if (text == null || text.isEmpty()) {
      return tokens;
    }
    for (String token : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  /** Collects the tokens of every string value of a row. */
  public static Set<String> tokenize(ScanRow row) {
    Set<String> tokens = new LinkedHashSet<>();
    for (Object value : row.fields.values()) {
      if (value instanceof String s) {
        tokens.addAll(tokenize(s));
      }
    }
    return tokens;
  }
}
