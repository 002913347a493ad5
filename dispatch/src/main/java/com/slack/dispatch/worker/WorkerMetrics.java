package com.slack.dispatch.worker;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

class WorkerMetrics {
  public static final String WORKER_REQUESTS = "worker_requests";
  public static final String WORKER_REQUESTS_REJECTED = "worker_requests_rejected";
  public static final String WORKER_ROWS_STREAMED = "worker_rows_streamed";
  public static final String WORKER_FILES_PRUNED_BY_INDEX = "worker_files_pruned_by_index";
  public static final String WORKER_REQUEST_DURATION_SECONDS = "worker_request_duration_seconds";
  public static final String STATE_TAG = "state";

  private final Map<RequestState, Counter> requestsByState = new EnumMap<>(RequestState.class);
  final Counter rejected;
  final Counter rowsStreamed;
  final Counter filesPruned;
  private final Timer requestDuration;

  WorkerMetrics(MeterRegistry meterRegistry) {
    for (RequestState state : RequestState.values()) {
      if (state.isTerminal()) {
        requestsByState.put(
            state,
            meterRegistry.counter(
                WORKER_REQUESTS, STATE_TAG, state.name().toLowerCase(Locale.ROOT)));
      }
    }
    this.rejected = meterRegistry.counter(WORKER_REQUESTS_REJECTED);
    this.rowsStreamed = meterRegistry.counter(WORKER_ROWS_STREAMED);
    this.filesPruned = meterRegistry.counter(WORKER_FILES_PRUNED_BY_INDEX);
    this.requestDuration = meterRegistry.timer(WORKER_REQUEST_DURATION_SECONDS);
  }

  void recordTerminal(RequestState state, long durationNanos) {
    requestsByState.get(state).increment();
    requestDuration.record(durationNanos, TimeUnit.NANOSECONDS);
  }
}
