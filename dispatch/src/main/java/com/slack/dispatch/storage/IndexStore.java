package com.slack.dispatch.storage;

import java.io.IOException;
import java.util.Optional;

/** Inverted index files held by a worker, addressed by the index file name. */
public interface IndexStore {

  /**
   * @return the index, or empty when this worker holds no index of that name
   * @throws IOException if the index exists but can't be read
   */
  Optional<TermIndex> find(String indexFileName) throws IOException;
}
