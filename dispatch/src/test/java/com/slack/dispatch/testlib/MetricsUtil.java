package com.slack.dispatch.testlib;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.MeterNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Returns 0 for a meter that was not registered yet, so a test can await() a count without
// handling MeterNotFoundException while the code under test is still starting up.
public class MetricsUtil {

  private static final Logger LOG = LoggerFactory.getLogger(MetricsUtil.class);

  public static double getCount(String counterName, MeterRegistry metricsRegistry) {
    try {
      return metricsRegistry.get(counterName).counter().count();
    } catch (MeterNotFoundException e) {
      LOG.warn("Metric not found", e);
      return 0;
    }
  }

  public static double getCount(
      String counterName, String tagKey, String tagValue, MeterRegistry metricsRegistry) {
    try {
      return metricsRegistry.get(counterName).tag(tagKey, tagValue).counter().count();
    } catch (MeterNotFoundException e) {
      LOG.warn("Metric not found", e);
      return 0;
    }
  }

  public static double getTimerCount(String timerName, MeterRegistry metricsRegistry) {
    try {
      return metricsRegistry.get(timerName).timer().count();
    } catch (MeterNotFoundException e) {
      LOG.warn("Metric not found", e);
      return 0;
    }
  }
}
