package com.slack.dispatch.partition;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import java.util.Optional;

/**
 * Metadata of one candidate data file, as supplied by query planning: which org and stream type it
 * belongs to, the time range it covers in epoch microseconds and, when the file has one, the name
 * of its inverted index file.
 */
public class FileKey {
  public final long id;
  public final String orgId;
  public final String streamType;
  public final long minTs;
  public final long maxTs;
  private final String indexFileName;

  public FileKey(
      long id,
      String orgId,
      String streamType,
      long minTs,
      long maxTs,
      String indexFileName) {
    checkArgument(orgId != null && !orgId.isEmpty(), "orgId can't be null or empty");
    checkArgument(streamType != null && !streamType.isEmpty(), "streamType can't be null or empty");
    checkArgument(maxTs >= minTs, "maxTs should be greater than or equal to minTs");
    checkArgument(
        indexFileName == null || !indexFileName.isEmpty(), "indexFileName can't be empty");
    this.id = id;
    this.orgId = orgId;
    this.streamType = streamType;
    this.minTs = minTs;
    this.maxTs = maxTs;
    this.indexFileName = indexFileName;
  }

  public static FileKey of(long id, String orgId, String streamType) {
    return new FileKey(id, orgId, streamType, 0, 0, null);
  }

  public static FileKey withIndex(long id, String orgId, String streamType, String indexFileName) {
    return new FileKey(id, orgId, streamType, 0, 0, indexFileName);
  }

  public static FileKey withTimeRange(
      long id, String orgId, String streamType, long minTs, long maxTs) {
    return new FileKey(id, orgId, streamType, minTs, maxTs, null);
  }

  public Optional<String> getIndexFileName() {
    return Optional.ofNullable(indexFileName);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FileKey that)) return false;
    return id == that.id
        && minTs == that.minTs
        && maxTs == that.maxTs
        && orgId.equals(that.orgId)
        && streamType.equals(that.streamType)
        && Objects.equals(indexFileName, that.indexFileName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, orgId, streamType, minTs, maxTs, indexFileName);
  }

  @Override
  public String toString() {
    return "FileKey{"
        + "id="
        + id
        + ", orgId='"
        + orgId
        + '\''
        + ", streamType='"
        + streamType
        + '\''
        + ", minTs="
        + minTs
        + ", maxTs="
        + maxTs
        + ", indexFileName="
        + indexFileName
        + '}';
  }
}
