package com.slack.dispatch.partition;

import static com.google.common.base.Preconditions.checkArgument;

import brave.ScopedSpan;
import brave.Tracing;
import com.slack.dispatch.cluster.DispatchTarget;
import com.slack.dispatch.cluster.PlacementTopology;
import com.slack.dispatch.proto.service.DispatchSearch;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits the candidate files of a query into disjoint partitions, one or more per owning worker.
 *
 * <p>Owners are visited in url order and each owner's files in id order, so the same file set and
 * topology always produce the same partitions. This lets a caller re-dispatch a query and get the
 * partitioning it logged the first time.
 *
 * <p>With a target number of partitions per worker, a worker's files are first split into groups
 * without overlapping time ranges (see {@link TimeRangeGrouping}) and every group becomes its own
 * partition, before the per-partition file limit applies.
 */
public class PartitionAssigner {
  private static final Logger LOG = LoggerFactory.getLogger(PartitionAssigner.class);

  private final PlacementTopology topology;
  private final int maxFilesPerPartition;
  private final int targetPartitionsPerWorker;

  public PartitionAssigner(PlacementTopology topology) {
    this(topology, 0);
  }

  public PartitionAssigner(PlacementTopology topology, int maxFilesPerPartition) {
    this(topology, maxFilesPerPartition, 0);
  }

  /**
   * @param maxFilesPerPartition upper bound of files in one partition, 0 to put every file of a
   *     worker in a single partition
   * @param targetPartitionsPerWorker partitions to aim for per worker when grouping its files by
   *     time range, 0 to skip the grouping
   */
  public PartitionAssigner(
      PlacementTopology topology, int maxFilesPerPartition, int targetPartitionsPerWorker) {
    checkArgument(topology != null, "topology can't be null");
    checkArgument(maxFilesPerPartition >= 0, "maxFilesPerPartition can't be negative");
    checkArgument(targetPartitionsPerWorker >= 0, "targetPartitionsPerWorker can't be negative");
    this.topology = topology;
    this.maxFilesPerPartition = maxFilesPerPartition;
    this.targetPartitionsPerWorker = targetPartitionsPerWorker;
  }

  public PartitionAssignment assign(
      String orgId, String streamType, Collection<FileKey> files, boolean useInvertedIndex)
      throws LocalityException {
    ScopedSpan span = Tracing.currentTracer().startScopedSpan("PartitionAssigner.assign");
    try {
      Map<Long, FileKey> filesById = new TreeMap<>();
      for (FileKey file : files) {
        checkArgument(
            file.orgId.equals(orgId) && file.streamType.equals(streamType),
            "file %s belongs to %s/%s, not %s/%s",
            file.id,
            file.orgId,
            file.streamType,
            orgId,
            streamType);
        FileKey previous = filesById.putIfAbsent(file.id, file);
        checkArgument(
            previous == null || previous.equals(file),
            "file id %s is listed twice with different metadata",
            file.id);
      }

      Map<DispatchTarget, List<FileKey>> filesByOwner = new TreeMap<>();
      for (FileKey file : filesById.values()) {
        Optional<DispatchTarget> owner = topology.ownerOf(file.id);
        if (owner.isEmpty()) {
          throw new LocalityException("No worker holds file " + file.id);
        }
        filesByOwner.computeIfAbsent(owner.get(), (target) -> new ArrayList<>()).add(file);
      }

      List<FilePartition> partitions = new ArrayList<>();
      for (Map.Entry<DispatchTarget, List<FileKey>> ownerFiles : filesByOwner.entrySet()) {
        List<List<FileKey>> groups =
            targetPartitionsPerWorker == 0
                ? List.of(ownerFiles.getValue())
                : TimeRangeGrouping.group(ownerFiles.getValue(), targetPartitionsPerWorker);
        for (List<FileKey> group : groups) {
          int chunkSize = maxFilesPerPartition == 0 ? group.size() : maxFilesPerPartition;
          for (int start = 0; start < group.size(); start += chunkSize) {
            List<FileKey> chunk = group.subList(start, Math.min(start + chunkSize, group.size()));
            partitions.add(
                toPartition(partitions.size(), ownerFiles.getKey(), chunk, useInvertedIndex));
          }
        }
      }

      span.tag("files", String.valueOf(filesById.size()));
      span.tag("partitions", String.valueOf(partitions.size()));
      LOG.debug(
          "Assigned {} files of {}/{} to {} partitions across {} workers",
          filesById.size(),
          orgId,
          streamType,
          partitions.size(),
          filesByOwner.size());
      return new PartitionAssignment(partitions);
    } finally {
      span.finish();
    }
  }

  private static FilePartition toPartition(
      int partition, DispatchTarget target, List<FileKey> files, boolean useInvertedIndex) {
    List<Long> fileIds = new ArrayList<>(files.size());
    List<DispatchSearch.IdxFileName> idxFiles = new ArrayList<>();
    for (FileKey file : files) {
      fileIds.add(file.id);
      if (useInvertedIndex) {
        file.getIndexFileName()
            .ifPresent(
                name ->
                    idxFiles.add(
                        DispatchSearch.IdxFileName.newBuilder()
                            .setFileId(file.id)
                            .setName(name)
                            .build()));
      }
    }
    return new FilePartition(partition, target, fileIds, idxFiles);
  }
}
