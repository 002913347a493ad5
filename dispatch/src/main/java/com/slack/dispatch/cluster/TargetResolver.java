package com.slack.dispatch.cluster;

import com.slack.dispatch.partition.LocalityException;
import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.proto.service.DispatchSearch;
import java.util.Optional;

/**
 * Picks the endpoint a search request is sent to. Super cluster requests go to the regional
 * gateway, everything else to the worker that owns the partition's files.
 */
public class TargetResolver {
  private final PlacementTopology topology;
  private final DispatchTarget regionalGateway;

  public TargetResolver(PlacementTopology topology) {
    this(topology, null);
  }

  public TargetResolver(PlacementTopology topology, DispatchTarget regionalGateway) {
    this.topology = topology;
    this.regionalGateway = regionalGateway;
  }

  /**
   * Resolver over the hash placement of the configured workers. The regional gateway is the
   * gateway configured for the node's own region, if there is one.
   */
  public static TargetResolver fromConfig(
      DispatchConfigs.TopologyConfig topologyConfig,
      DispatchConfigs.SuperClusterConfig superClusterConfig) {
    String gatewayUrl =
        superClusterConfig.getRegionGatewaysOrDefault(superClusterConfig.getRegion(), "");
    return new TargetResolver(
        HashPlacementTopology.fromConfig(topologyConfig),
        gatewayUrl.isEmpty() ? null : DispatchTarget.gateway(gatewayUrl));
  }

  public PlacementTopology getTopology() {
    return topology;
  }

  public Optional<DispatchTarget> getRegionalGateway() {
    return Optional.ofNullable(regionalGateway);
  }

  public DispatchTarget resolve(DispatchSearch.SearchRequest request) throws LocalityException {
    if (request.getIsSuperCluster()) {
      if (regionalGateway == null) {
        throw new IllegalStateException(
            "Super cluster request " + request.getTraceId() + " but no regional gateway is set");
      }
      return regionalGateway;
    }
    if (request.getFileIdListCount() == 0) {
      throw new LocalityException(
          "Partition " + request.getPartition() + " of " + request.getTraceId() + " has no files");
    }
    long fileId = request.getFileIdList(0);
    return topology
        .ownerOf(fileId)
        .orElseThrow(
            () ->
                new LocalityException(
                    "No worker holds file " + fileId + " of trace " + request.getTraceId()));
  }
}
