package com.slack.dispatch.dispatcher;

import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.proto.service.DispatchSearch;
import com.slack.dispatch.util.ScanStatsUtil;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Summary of a query session, judged against a completion policy. */
public class QueryOutcome {
  public final String traceId;
  public final DispatchConfigs.CompletionPolicy policy;
  public final Map<Integer, PartitionStatus> statuses;
  public final Map<Integer, PartitionResult> failures;
  public final Map<Integer, DispatchSearch.ScanStats> stats;

  public QueryOutcome(
      String traceId,
      DispatchConfigs.CompletionPolicy policy,
      Map<Integer, PartitionStatus> statuses,
      Map<Integer, PartitionResult> failures,
      Map<Integer, DispatchSearch.ScanStats> stats) {
    this.traceId = traceId;
    this.policy = policy;
    this.statuses = Collections.unmodifiableMap(new TreeMap<>(statuses));
    this.failures = Collections.unmodifiableMap(new TreeMap<>(failures));
    this.stats = Collections.unmodifiableMap(new TreeMap<>(stats));
  }

  /** True once every partition reached a terminal state. */
  public boolean isComplete() {
    return statuses.values().stream().allMatch(PartitionStatus::isTerminal);
  }

  public long completedPartitions() {
    return statuses.values().stream().filter(s -> s == PartitionStatus.COMPLETED).count();
  }

  /**
   * With {@code REQUIRE_ALL_PARTITIONS} every partition has to complete. With {@code
   * ALLOW_PARTIAL_RESULTS} failed partitions are tolerated as long as at least one partition
   * completed, or the query had no partitions at all.
   */
  public boolean successful() {
    if (!isComplete()) {
      return false;
    }
    if (policy == DispatchConfigs.CompletionPolicy.ALLOW_PARTIAL_RESULTS) {
      return statuses.isEmpty() || completedPartitions() > 0;
    }
    return failures.isEmpty();
  }

  public DispatchSearch.ScanStats totalStats() {
    return ScanStatsUtil.sum(stats.values());
  }

  public void throwIfFailed() throws PartitionFailureException {
    if (!successful()) {
      throw new PartitionFailureException(traceId, failures);
    }
  }

  @Override
  public String toString() {
    return "QueryOutcome{"
        + "traceId='"
        + traceId
        + '\''
        + ", policy="
        + policy
        + ", statuses="
        + statuses
        + ", failures="
        + failures.values()
        + '}';
  }
}
