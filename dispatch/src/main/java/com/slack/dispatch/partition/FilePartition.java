package com.slack.dispatch.partition;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.dispatch.cluster.DispatchTarget;
import com.slack.dispatch.proto.service.DispatchSearch;
import java.util.List;
import java.util.Objects;

/** One entry of a partition assignment: the files a single worker scans for a query. */
public class FilePartition {
  public final int partition;
  public final DispatchTarget target;
  public final List<Long> fileIds;
  public final List<DispatchSearch.IdxFileName> idxFiles;

  public FilePartition(
      int partition,
      DispatchTarget target,
      List<Long> fileIds,
      List<DispatchSearch.IdxFileName> idxFiles) {
    checkArgument(partition >= 0, "partition can't be negative");
    checkArgument(target != null, "target can't be null");
    this.partition = partition;
    this.target = target;
    this.fileIds = List.copyOf(fileIds);
    this.idxFiles = List.copyOf(idxFiles);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FilePartition that)) return false;
    return partition == that.partition
        && target.equals(that.target)
        && fileIds.equals(that.fileIds)
        && idxFiles.equals(that.idxFiles);
  }

  @Override
  public int hashCode() {
    return Objects.hash(partition, target, fileIds, idxFiles);
  }

  @Override
  public String toString() {
    return "FilePartition{"
        + "partition="
        + partition
        + ", target="
        + target
        + ", fileIds="
        + fileIds
        + ", idxFiles="
        + idxFiles.size()
        + '}';
  }
}
