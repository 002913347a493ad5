package com.slack.dispatch.request;

import com.slack.dispatch.proto.service.DispatchSearch;
import java.util.LinkedHashMap;
import java.util.Map;

public class SearchRequests {

  /** Equality keys of a request, where a key listed more than once takes its last value. */
  public static Map<String, String> effectiveEqualKeys(DispatchSearch.SearchRequest request) {
    Map<String, String> equalKeys = new LinkedHashMap<>();
    for (DispatchSearch.KvItem item : request.getEqualKeysList()) {
      equalKeys.put(item.getKey(), item.getValue());
    }
    return equalKeys;
  }

  /** Short identity of a request for log lines. */
  public static String describe(DispatchSearch.SearchRequest request) {
    return "[trace_id " + request.getTraceId() + "] partition " + request.getPartition();
  }
}
