package com.slack.dispatch.testlib;

import com.slack.dispatch.storage.FileStore;
import com.slack.dispatch.storage.InMemoryFileStore;
import com.slack.dispatch.storage.RowScanner;
import com.slack.dispatch.storage.ScanRow;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.atomic.AtomicInteger;

/** Wraps a store so every row takes {@code rowDelayMs} to read. Tracks open scanners. */
public class SlowFileStore implements FileStore {
  private final InMemoryFileStore delegate;
  private final long rowDelayMs;
  private final AtomicInteger opened = new AtomicInteger();
  private final AtomicInteger closed = new AtomicInteger();

  public SlowFileStore(InMemoryFileStore delegate, long rowDelayMs) {
    this.delegate = delegate;
    this.rowDelayMs = rowDelayMs;
  }

  @Override
  public boolean contains(long fileId) {
    return delegate.contains(fileId);
  }

  @Override
  public RowScanner openScanner(long fileId) throws IOException {
    RowScanner scanner = delegate.openScanner(fileId);
    opened.incrementAndGet();
    return new RowScanner() {
      @Override
      public ScanRow next() throws IOException {
        try {
          Thread.sleep(rowDelayMs);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new InterruptedIOException("interrupted reading file " + fileId);
        }
        return scanner.next();
      }

      @Override
      public void close() throws IOException {
        scanner.close();
        closed.incrementAndGet();
      }
    };
  }

  public int openedScanners() {
    return opened.get();
  }

  /** Scanners opened but not closed yet. */
  public int openScanners() {
    return opened.get() - closed.get();
  }
}
