package com.slack.dispatch.storage;

import java.io.Closeable;
import java.io.IOException;

/** Sequential reader over the rows of one data file. Must be closed once the scan ends. */
public interface RowScanner extends Closeable {

  /** Returns the next row, or null once the file is exhausted. */
  ScanRow next() throws IOException;
}
