package com.slack.dispatch.storage;

import java.io.IOException;

/** The data files held locally by a worker, addressed by file id. Read only. */
public interface FileStore {

  boolean contains(long fileId);

  /**
   * Opens a scanner over the rows of a locally present file.
   *
   * @throws java.io.FileNotFoundException if the file is not held by this worker
   */
  RowScanner openScanner(long fileId) throws IOException;
}
