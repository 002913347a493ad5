package com.slack.dispatch.storage;

import java.io.FileNotFoundException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryFileStore implements FileStore {
  private final Map<Long, List<ScanRow>> files = new ConcurrentHashMap<>();

  public InMemoryFileStore put(long fileId, List<ScanRow> rows) {
    files.put(fileId, List.copyOf(rows));
    return this;
  }

  @Override
  public boolean contains(long fileId) {
    return files.containsKey(fileId);
  }

  @Override
  public RowScanner openScanner(long fileId) throws FileNotFoundException {
    List<ScanRow> rows = files.get(fileId);
    if (rows == null) {
      throw new FileNotFoundException("File " + fileId + " is not present in this store");
    }
    Iterator<ScanRow> iterator = rows.iterator();
    return new RowScanner() {
      @Override
      public ScanRow next() {
        return iterator.hasNext() ? iterator.next() : null;
      }

      @Override
      public void close() {}
    };
  }
}
