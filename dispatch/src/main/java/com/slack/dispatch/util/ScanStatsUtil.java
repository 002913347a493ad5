package com.slack.dispatch.util;

import com.slack.dispatch.proto.service.DispatchSearch;
import java.util.Collection;

public class ScanStatsUtil {

  public static DispatchSearch.ScanStats add(
      DispatchSearch.ScanStats left, DispatchSearch.ScanStats right) {
    return DispatchSearch.ScanStats.newBuilder()
        .setFiles(left.getFiles() + right.getFiles())
        .setFilesPruned(left.getFilesPruned() + right.getFilesPruned())
        .setIdxFiles(left.getIdxFiles() + right.getIdxFiles())
        .setRecords(left.getRecords() + right.getRecords())
        .setRows(left.getRows() + right.getRows())
        .setIdxTookMs(left.getIdxTookMs() + right.getIdxTookMs())
        // partitions run in parallel, so the slowest one bounds the total
        .setTookMs(Math.max(left.getTookMs(), right.getTookMs()))
        .build();
  }

  public static DispatchSearch.ScanStats sum(Collection<DispatchSearch.ScanStats> stats) {
    DispatchSearch.ScanStats total = DispatchSearch.ScanStats.getDefaultInstance();
    for (DispatchSearch.ScanStats partitionStats : stats) {
      total = add(total, partitionStats);
    }
    return total;
  }
}
