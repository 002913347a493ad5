package com.slack.dispatch.request;

import com.slack.dispatch.proto.service.DispatchSearch;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per query parameters shared by every partition of a query: tenant scoping, the time window,
 * pushdown filters, behaviour flags and optional routing metadata.
 *
 * <p>The routing metadata fields are optional rather than empty strings: an absent work group and a
 * work group set to "" are different requests.
 */
public class QueryParams {
  public final String traceId;
  public final String orgId;
  public final String streamType;
  public final long startTime;
  public final long endTime;
  public final List<DispatchSearch.KvItem> equalKeys;
  public final List<String> matchAllKeys;
  public final long timeoutSecs;
  public final boolean isSuperCluster;
  public final boolean useInvertedIndex;
  public final Optional<String> workGroup;
  public final Optional<String> indexType;
  public final Optional<String> userId;
  public final Optional<String> searchEventType;

  private QueryParams(Builder builder) {
    this.traceId = builder.traceId;
    this.orgId = builder.orgId;
    this.streamType = builder.streamType;
    this.startTime = builder.startTime;
    this.endTime = builder.endTime;
    this.equalKeys = List.copyOf(builder.equalKeys);
    this.matchAllKeys = List.copyOf(builder.matchAllKeys);
    this.timeoutSecs = builder.timeoutSecs;
    this.isSuperCluster = builder.isSuperCluster;
    this.useInvertedIndex = builder.useInvertedIndex;
    this.workGroup = builder.workGroup;
    this.indexType = builder.indexType;
    this.userId = builder.userId;
    this.searchEventType = builder.searchEventType;
  }

  public static Builder builder(String traceId, String orgId, String streamType) {
    return new Builder(traceId, orgId, streamType);
  }

  /** A builder pre-filled with the query parameters a received request was built from. */
  public static Builder builderFrom(DispatchSearch.SearchRequest request) {
    Builder builder =
        new Builder(request.getTraceId(), request.getOrgId(), request.getStreamType())
            .timeRange(request.getStartTime(), request.getEndTime())
            .timeoutSecs(request.getTimeout())
            .superCluster(request.getIsSuperCluster())
            .useInvertedIndex(request.getUseInvertedIndex());
    builder.equalKeys.addAll(request.getEqualKeysList());
    builder.matchAllKeys.addAll(request.getMatchAllKeysList());
    if (request.hasWorkGroup()) {
      builder.workGroup(request.getWorkGroup());
    }
    if (request.hasIndexType()) {
      builder.indexType(request.getIndexType());
    }
    if (request.hasUserId()) {
      builder.userId(request.getUserId());
    }
    if (request.hasSearchEventType()) {
      builder.searchEventType(request.getSearchEventType());
    }
    return builder;
  }

  /** A builder pre-filled with these parameters. */
  public Builder toBuilder() {
    Builder builder =
        new Builder(traceId, orgId, streamType)
            .timeRange(startTime, endTime)
            .timeoutSecs(timeoutSecs)
            .superCluster(isSuperCluster)
            .useInvertedIndex(useInvertedIndex);
    builder.equalKeys.addAll(equalKeys);
    builder.matchAllKeys.addAll(matchAllKeys);
    builder.workGroup = workGroup;
    builder.indexType = indexType;
    builder.userId = userId;
    builder.searchEventType = searchEventType;
    return builder;
  }

  @Override
  public String toString() {
    return "QueryParams{"
        + "traceId='"
        + traceId
        + '\''
        + ", orgId='"
        + orgId
        + '\''
        + ", streamType='"
        + streamType
        + '\''
        + ", startTime="
        + startTime
        + ", endTime="
        + endTime
        + ", timeoutSecs="
        + timeoutSecs
        + ", isSuperCluster="
        + isSuperCluster
        + ", useInvertedIndex="
        + useInvertedIndex
        + '}';
  }

  public static class Builder {
    private final String traceId;
    private final String orgId;
    private final String streamType;
    private long startTime;
    private long endTime;
    private final List<DispatchSearch.KvItem> equalKeys = new ArrayList<>();
    private final List<String> matchAllKeys = new ArrayList<>();
    private long timeoutSecs;
    private boolean isSuperCluster;
    private boolean useInvertedIndex;
    private Optional<String> workGroup = Optional.empty();
    private Optional<String> indexType = Optional.empty();
    private Optional<String> userId = Optional.empty();
    private Optional<String> searchEventType = Optional.empty();

    private Builder(String traceId, String orgId, String streamType) {
      this.traceId = traceId;
      this.orgId = orgId;
      this.streamType = streamType;
    }

    public Builder timeRange(long startTime, long endTime) {
      this.startTime = startTime;
      this.endTime = endTime;
      return this;
    }

    public Builder equalKey(String key, String value) {
      equalKeys.add(DispatchSearch.KvItem.newBuilder().setKey(key).setValue(value).build());
      return this;
    }

    public Builder matchAllKey(String token) {
      matchAllKeys.add(token);
      return this;
    }

    public Builder timeoutSecs(long timeoutSecs) {
      this.timeoutSecs = timeoutSecs;
      return this;
    }

    public Builder superCluster(boolean isSuperCluster) {
      this.isSuperCluster = isSuperCluster;
      return this;
    }

    public Builder useInvertedIndex(boolean useInvertedIndex) {
      this.useInvertedIndex = useInvertedIndex;
      return this;
    }

    public Builder workGroup(String workGroup) {
      this.workGroup = Optional.of(workGroup);
      return this;
    }

    public Builder indexType(String indexType) {
      this.indexType = Optional.of(indexType);
      return this;
    }

    public Builder userId(String userId) {
      this.userId = Optional.of(userId);
      return this;
    }

    public Builder searchEventType(String searchEventType) {
      this.searchEventType = Optional.of(searchEventType);
      return this;
    }

    public QueryParams build() {
      return new QueryParams(this);
    }
  }
}
