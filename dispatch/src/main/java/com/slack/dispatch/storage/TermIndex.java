package com.slack.dispatch.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inverted index over one data file: the distinct values of every field and the distinct text
 * tokens of its string values. A worker uses it to skip a file when no row of the file can satisfy
 * the equality and match-all filters of a request.
 */
public class TermIndex {
  private final Map<String, Set<String>> fieldValues;
  private final Set<String> tokens;

  @JsonCreator
  public TermIndex(
      @JsonProperty("fieldValues") Map<String, Set<String>> fieldValues,
      @JsonProperty("tokens") Set<String> tokens) {
    this.fieldValues = fieldValues == null ? Map.of() : Map.copyOf(fieldValues);
    this.tokens = tokens == null ? Set.of() : Set.copyOf(tokens);
  }

  public static TermIndex build(Collection<ScanRow> rows) {
    Map<String, Set<String>> fieldValues = new HashMap<>();
    Set<String> tokens = new HashSet<>();
    for (ScanRow row : rows) {
      for (Map.Entry<String, Object> field : row.fields.entrySet()) {
        fieldValues
            .computeIfAbsent(field.getKey(), (k) -> new HashSet<>())
            .add(stringValue(field.getValue()));
      }
      tokens.addAll(TermTokenizer.tokenize(row));
    }
    return new TermIndex(fieldValues, tokens);
  }

  /** String form used to compare row values with equality keys. */
  public static String stringValue(Object value) {
    return String.valueOf(value);
  }

  @JsonProperty("fieldValues")
  public Map<String, Set<String>> getFieldValues() {
    return fieldValues;
  }

  @JsonProperty("tokens")
  public Set<String> getTokens() {
    return tokens;
  }

  /**
   * Returns false only if no row of the indexed file can match every equality key and every
   * match-all term.
   */
  public boolean mayMatch(Map<String, String> equalKeys, List<String> matchAllKeys) {
    for (Map.Entry<String, String> equalKey : equalKeys.entrySet()) {
      Set<String> values = fieldValues.get(equalKey.getKey());
      if (values == null || !values.contains(equalKey.getValue())) {
        return false;
      }
    }
    for (String matchAllKey : matchAllKeys) {
      for (String token : TermTokenizer.tokenize(matchAllKey)) {
        if (!tokens.contains(token)) {
          return false;
        }
      }
    }
    return true;
  }
}
