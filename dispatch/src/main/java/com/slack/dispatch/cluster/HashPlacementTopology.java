package com.slack.dispatch.cluster;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.dispatch.proto.config.DispatchConfigs;
import java.util.List;
import java.util.Optional;

/**
 * Places file ids on a fixed, ordered list of workers by taking the file id modulo the number of
 * workers. Every node configured with the same worker list computes the same placement.
 */
public class HashPlacementTopology implements PlacementTopology {
  private final List<DispatchTarget> workers;

  public HashPlacementTopology(List<DispatchTarget> workers) {
    checkArgument(workers != null && !workers.isEmpty(), "at least one worker is required");
    this.workers = List.copyOf(workers);
  }

  public static HashPlacementTopology fromConfig(DispatchConfigs.TopologyConfig topologyConfig) {
    return new HashPlacementTopology(
        topologyConfig.getWorkerUrlsList().stream().map(DispatchTarget::worker).toList());
  }

  @Override
  public Optional<DispatchTarget> ownerOf(long fileId) {
    return Optional.of(workers.get((int) Math.floorMod(fileId, (long) workers.size())));
  }
}
