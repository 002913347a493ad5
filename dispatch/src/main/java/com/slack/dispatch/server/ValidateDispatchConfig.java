package com.slack.dispatch.server;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.dispatch.cluster.DispatchTarget;
import com.slack.dispatch.proto.config.DispatchConfigs;
import java.util.Arrays;
import java.util.List;

public class ValidateDispatchConfig {

  /**
   * ValidateConfig ensures that the config values each node role depends on are present and
   * consistent. The class using a config is still expected to ensure its own values are valid.
   */
  public static void validateConfig(DispatchConfigs.DispatchConfig dispatchConfig) {
    validateNodeRoles(dispatchConfig.getNodeRolesList());
    if (dispatchConfig.getNodeRolesList().contains(DispatchConfigs.NodeRole.WORKER)) {
      validateWorkerConfig(dispatchConfig.getWorkerConfig());
    }
    if (dispatchConfig.getNodeRolesList().contains(DispatchConfigs.NodeRole.GATEWAY)) {
      validateGatewayConfig(dispatchConfig.getGatewayConfig());
      validateTopologyConfig(dispatchConfig.getTopologyConfig());
    }
    validateQueryConfig(dispatchConfig.getQueryConfig());
    validateSuperClusterConfig(dispatchConfig.getSuperClusterConfig());
  }

  private static void validateServerConfig(String section, DispatchConfigs.ServerConfig config) {
    checkArgument(
        config.getServerPort() > 0 && config.getServerPort() <= 65535,
        "%s serverPort must be between 1 and 65535",
        section);
    checkArgument(
        !config.getServerAddress().isBlank(), "%s serverAddress can't be empty", section);
    checkArgument(
        config.getRequestTimeoutMs() >= 3000,
        "%s requestTimeoutMs cannot less than 3000ms",
        section);
  }

  private static void validateWorkerConfig(DispatchConfigs.WorkerConfig workerConfig) {
    validateServerConfig("WorkerConfig", workerConfig.getServerConfig());
    checkArgument(
        !workerConfig.getDataDirectory().isBlank(), "WorkerConfig dataDirectory can't be empty");
    checkArgument(workerConfig.getBatchSize() > 0, "WorkerConfig batchSize must be positive");
    checkArgument(
        workerConfig.getHandlerThreads() > 0, "WorkerConfig handlerThreads must be positive");
  }

  private static void validateGatewayConfig(DispatchConfigs.GatewayConfig gatewayConfig) {
    validateServerConfig("GatewayConfig", gatewayConfig.getServerConfig());
    checkArgument(
        gatewayConfig.getRelayThreads() > 0, "GatewayConfig relayThreads must be positive");
  }

  private static void validateTopologyConfig(DispatchConfigs.TopologyConfig topologyConfig) {
    checkArgument(
        topologyConfig.getWorkerUrlsCount() > 0, "TopologyConfig needs at least one worker url");
    for (String url : topologyConfig.getWorkerUrlsList()) {
      checkArgument(
          url.startsWith(DispatchTarget.GRPC_PROTOCOL),
          "TopologyConfig worker url %s must start with %s",
          url,
          DispatchTarget.GRPC_PROTOCOL);
    }
  }

  private static void validateQueryConfig(DispatchConfigs.QueryConfig queryConfig) {
    checkArgument(
        queryConfig.getMaxFilesPerPartition() >= 0,
        "QueryConfig maxFilesPerPartition can't be negative");
    checkArgument(
        queryConfig.getDefaultTimeoutSecs() >= 0,
        "QueryConfig defaultTimeoutSecs can't be negative");
    checkArgument(
        queryConfig.getTargetPartitionsPerWorker() >= 0,
        "QueryConfig targetPartitionsPerWorker can't be negative");
  }

  private static void validateSuperClusterConfig(
      DispatchConfigs.SuperClusterConfig superClusterConfig) {
    superClusterConfig
        .getRegionGatewaysMap()
        .forEach(
            (region, url) ->
                checkArgument(
                    url.startsWith(DispatchTarget.GRPC_PROTOCOL),
                    "SuperClusterConfig gateway url %s of region %s must start with %s",
                    url,
                    region,
                    DispatchTarget.GRPC_PROTOCOL));
    if (!superClusterConfig.getRegion().isEmpty()
        && superClusterConfig.getRegionGatewaysCount() > 0) {
      checkArgument(
          superClusterConfig.containsRegionGateways(superClusterConfig.getRegion()),
          "SuperClusterConfig has no gateway for its own region %s",
          superClusterConfig.getRegion());
    }
  }

  public static void validateNodeRoles(List<DispatchConfigs.NodeRole> nodeRoleList) {
    // We don't need further checks for node roles since JSON parsing will throw away roles not part
    // of the enum
    checkArgument(
        !nodeRoleList.isEmpty(),
        "Dispatch must start with at least 1 node role. Accepted roles are "
            + Arrays.toString(DispatchConfigs.NodeRole.values()));
  }
}
