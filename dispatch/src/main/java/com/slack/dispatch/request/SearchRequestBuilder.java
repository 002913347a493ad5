package com.slack.dispatch.request;

import com.google.protobuf.ByteString;
import com.slack.dispatch.partition.FilePartition;
import com.slack.dispatch.partition.PartitionAssignment;
import com.slack.dispatch.plan.ScanNode;
import com.slack.dispatch.plan.ScanPlanCodec;
import com.slack.dispatch.proto.service.DispatchSearch;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the immutable search request sent for one partition of a query. Requests that could never
 * be executed correctly are rejected with a {@link ValidationException} before anything is sent.
 */
public class SearchRequestBuilder {

  /** Builds one request per partition. The plan is encoded once and shared by every request. */
  public static List<DispatchSearch.SearchRequest> buildAll(
      ScanNode scanNode, PartitionAssignment assignment, QueryParams params)
      throws ValidationException {
    ByteString plan = ScanPlanCodec.encodeToByteString(scanNode);
    List<DispatchSearch.SearchRequest> requests = new ArrayList<>(assignment.size());
    for (FilePartition partition : assignment.partitions) {
      requests.add(build(plan, partition, params));
    }
    return requests;
  }

  public static DispatchSearch.SearchRequest build(
      ScanNode scanNode, FilePartition partition, QueryParams params) throws ValidationException {
    return build(ScanPlanCodec.encodeToByteString(scanNode), partition, params);
  }

  public static DispatchSearch.SearchRequest build(
      ByteString plan, FilePartition partition, QueryParams params) throws ValidationException {
    return build(plan, partition.partition, partition.fileIds, partition.idxFiles, params);
  }

  public static DispatchSearch.SearchRequest build(
      ByteString plan,
      int partition,
      List<Long> fileIds,
      List<DispatchSearch.IdxFileName> idxFiles,
      QueryParams params)
      throws ValidationException {
    validate(plan, partition, fileIds, idxFiles, params);

    DispatchSearch.SearchRequest.Builder builder =
        DispatchSearch.SearchRequest.newBuilder()
            .setTraceId(params.traceId)
            .setPartition(partition)
            .setOrgId(params.orgId)
            .setStreamType(params.streamType)
            .setPlan(plan)
            .addAllFileIdList(fileIds)
            .addAllIdxFileList(idxFiles)
            .addAllEqualKeys(params.equalKeys)
            .addAllMatchAllKeys(params.matchAllKeys)
            .setStartTime(params.startTime)
            .setEndTime(params.endTime)
            .setTimeout(params.timeoutSecs)
            .setIsSuperCluster(params.isSuperCluster)
            .setUseInvertedIndex(params.useInvertedIndex);
    params.workGroup.ifPresent(builder::setWorkGroup);
    params.indexType.ifPresent(builder::setIndexType);
    params.userId.ifPresent(builder::setUserId);
    params.searchEventType.ifPresent(builder::setSearchEventType);
    return builder.build();
  }

  private static void validate(
      ByteString plan,
      int partition,
      List<Long> fileIds,
      List<DispatchSearch.IdxFileName> idxFiles,
      QueryParams params)
      throws ValidationException {
    if (params.traceId == null || params.traceId.isBlank()) {
      throw new ValidationException("trace_id can't be empty");
    }
    if (params.orgId == null || params.orgId.isBlank()) {
      throw new ValidationException("org_id can't be empty for trace " + params.traceId);
    }
    if (params.streamType == null || params.streamType.isBlank()) {
      throw new ValidationException("stream_type can't be empty for trace " + params.traceId);
    }
    if (partition < 0) {
      throw new ValidationException(
          "partition can't be negative, got " + partition + " for trace " + params.traceId);
    }
    if (params.startTime > params.endTime) {
      throw new ValidationException(
          String.format(
              "start_time %d is after end_time %d for trace %s",
              params.startTime, params.endTime, params.traceId));
    }
    if (params.timeoutSecs <= 0) {
      throw new ValidationException(
          "timeout must be positive, got " + params.timeoutSecs + " for trace " + params.traceId);
    }
    if (plan == null || plan.isEmpty()) {
      throw new ValidationException("plan can't be empty for trace " + params.traceId);
    }
    if (fileIds.isEmpty() && !idxFiles.isEmpty()) {
      throw new ValidationException(
          "partition " + partition + " has index files but no data files");
    }
    Set<Long> dataFiles = new HashSet<>(fileIds);
    if (dataFiles.size() != fileIds.size()) {
      throw new ValidationException("partition " + partition + " lists a data file twice");
    }
    for (DispatchSearch.IdxFileName idxFile : idxFiles) {
      if (!dataFiles.contains(idxFile.getFileId())) {
        throw new ValidationException(
            "index file "
                + idxFile.getName()
                + " references file "
                + idxFile.getFileId()
                + " which is not part of partition "
                + partition);
      }
    }
  }
}
