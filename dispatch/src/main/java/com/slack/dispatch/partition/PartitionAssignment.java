package com.slack.dispatch.partition;

import java.util.ArrayList;
import java.util.List;

/** Partitions of one query, ordered by partition id. Ids are dense and start at zero. */
public class PartitionAssignment {
  public final List<FilePartition> partitions;

  public PartitionAssignment(List<FilePartition> partitions) {
    for (int i = 0; i < partitions.size(); i++) {
      if (partitions.get(i).partition != i) {
        throw new IllegalArgumentException(
            "Partition at position " + i + " has id " + partitions.get(i).partition);
      }
    }
    this.partitions = List.copyOf(partitions);
  }

  public int size() {
    return partitions.size();
  }

  public boolean isEmpty() {
    return partitions.isEmpty();
  }

  public FilePartition get(int partition) {
    return partitions.get(partition);
  }

  public List<Long> allFileIds() {
    List<Long> fileIds = new ArrayList<>();
    partitions.forEach(partition -> fileIds.addAll(partition.fileIds));
    return fileIds;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PartitionAssignment that)) return false;
    return partitions.equals(that.partitions);
  }

  @Override
  public int hashCode() {
    return partitions.hashCode();
  }

  @Override
  public String toString() {
    return "PartitionAssignment{partitions=" + partitions + '}';
  }
}
