package com.slack.dispatch.storage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryIndexStore implements IndexStore {
  private final Map<String, TermIndex> indexes = new ConcurrentHashMap<>();

  public InMemoryIndexStore put(String indexFileName, TermIndex index) {
    indexes.put(indexFileName, index);
    return this;
  }

  @Override
  public Optional<TermIndex> find(String indexFileName) {
    return Optional.ofNullable(indexes.get(indexFileName));
  }
}
