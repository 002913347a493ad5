package com.slack.dispatch.storage;

import com.slack.dispatch.util.JsonUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Reads term indexes serialized as JSON files named after the index file under a directory. */
public class JsonIndexStore implements IndexStore {
  private final Path indexDirectory;

  public JsonIndexStore(Path indexDirectory) {
    this.indexDirectory = indexDirectory;
  }

  @Override
  public Optional<TermIndex> find(String indexFileName) throws IOException {
    Path path = indexDirectory.resolve(indexFileName).normalize();
    if (!path.startsWith(indexDirectory.normalize())) {
      throw new IOException("Index file name " + indexFileName + " escapes the index directory");
    }
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    return Optional.of(JsonUtil.read(Files.readString(path), TermIndex.class));
  }

  public void write(String indexFileName, TermIndex index) throws IOException {
    Files.createDirectories(indexDirectory);
    Files.writeString(indexDirectory.resolve(indexFileName), JsonUtil.writeAsString(index));
  }
}
