package com.slack.dispatch.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.slack.dispatch.util.JsonUtil;
import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads data files stored as newline delimited JSON under a directory, one {@code
 * <fileId>.jsonl} file per data file. Every line is an object with a numeric {@code _timestamp}.
 */
public class JsonLinesFileStore implements FileStore {
  public static final String FILE_SUFFIX = ".jsonl";

  private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

  private final Path dataDirectory;

  public JsonLinesFileStore(Path dataDirectory) {
    this.dataDirectory = dataDirectory;
  }

  public Path pathOf(long fileId) {
    return dataDirectory.resolve(fileId + FILE_SUFFIX);
  }

  @Override
  public boolean contains(long fileId) {
    return Files.isRegularFile(pathOf(fileId));
  }

  @Override
  public RowScanner openScanner(long fileId) throws IOException {
    Path path = pathOf(fileId);
    if (!Files.isRegularFile(path)) {
      throw new FileNotFoundException("Missing data file " + path.toAbsolutePath());
    }
    BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
    return new RowScanner() {
      @Override
      public ScanRow next() throws IOException {
        String line;
        do {
          line = reader.readLine();
          if (line == null) {
            return null;
          }
        } while (line.isBlank());
        try {
          return ScanRow.fromMap(JsonUtil.read(line, ROW_TYPE));
        } catch (IllegalArgumentException e) {
          throw new IOException("Malformed row in " + path + ": " + e.getMessage(), e);
        }
      }

      @Override
      public void close() throws IOException {
        reader.close();
      }
    };
  }
}
