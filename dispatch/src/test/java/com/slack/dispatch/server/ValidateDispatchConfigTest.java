package com.slack.dispatch.server;

import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatNoException;

import com.slack.dispatch.proto.config.DispatchConfigs;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ValidateDispatchConfigTest {

  @Test
  public void testNodeRolesAreRequired() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> ValidateDispatchConfig.validateNodeRoles(List.of()));
    assertThatIllegalArgumentException()
        .isThrownBy(
            () ->
                ValidateDispatchConfig.validateConfig(
                    DispatchConfigs.DispatchConfig.newBuilder().build()));
  }

  @Test
  public void testValidWorkerConfig() {
    assertThatNoException()
        .isThrownBy(() -> ValidateDispatchConfig.validateConfig(workerConfig().build()));
  }

  @Test
  public void testWorkerServerConfigIsChecked() {
    assertInvalid(workerConfig().setWorkerConfig(worker().setServerConfig(server(0, 3000))));
    assertInvalid(workerConfig().setWorkerConfig(worker().setServerConfig(server(70000, 3000))));
    assertInvalid(workerConfig().setWorkerConfig(worker().setServerConfig(server(8080, 2999))));
    assertInvalid(
        workerConfig()
            .setWorkerConfig(
                worker().setServerConfig(server(8080, 3000).toBuilder().setServerAddress(" "))));
  }

  @Test
  public void testWorkerSettingsAreChecked() {
    assertInvalid(workerConfig().setWorkerConfig(worker().setDataDirectory("")));
    assertInvalid(workerConfig().setWorkerConfig(worker().setBatchSize(0)));
    assertInvalid(workerConfig().setWorkerConfig(worker().setHandlerThreads(0)));
  }

  @Test
  public void testGatewayNeedsTopology() {
    DispatchConfigs.DispatchConfig.Builder gateway =
        DispatchConfigs.DispatchConfig.newBuilder()
            .addNodeRoles(DispatchConfigs.NodeRole.GATEWAY)
            .setGatewayConfig(
                DispatchConfigs.GatewayConfig.newBuilder()
                    .setServerConfig(server(8081, 3000))
                    .setRelayThreads(2));

    assertInvalid(gateway.clone());
    assertInvalid(
        gateway
            .clone()
            .setTopologyConfig(
                DispatchConfigs.TopologyConfig.newBuilder().addWorkerUrls("http://w1:8080")));
    assertThatNoException()
        .isThrownBy(
            () ->
                ValidateDispatchConfig.validateConfig(
                    gateway
                        .clone()
                        .setTopologyConfig(
                            DispatchConfigs.TopologyConfig.newBuilder()
                                .addWorkerUrls("gproto+http://w1:8080"))
                        .build()));
    assertInvalid(
        gateway
            .clone()
            .setGatewayConfig(
                DispatchConfigs.GatewayConfig.newBuilder().setServerConfig(server(8081, 3000)))
            .setTopologyConfig(
                DispatchConfigs.TopologyConfig.newBuilder()
                    .addWorkerUrls("gproto+http://w1:8080")));
  }

  @Test
  public void testQueryConfigIsChecked() {
    assertInvalid(
        workerConfig()
            .setQueryConfig(DispatchConfigs.QueryConfig.newBuilder().setMaxFilesPerPartition(-1)));
    assertInvalid(
        workerConfig()
            .setQueryConfig(DispatchConfigs.QueryConfig.newBuilder().setDefaultTimeoutSecs(-1)));
    assertInvalid(
        workerConfig()
            .setQueryConfig(
                DispatchConfigs.QueryConfig.newBuilder().setTargetPartitionsPerWorker(-1)));
  }

  @Test
  public void testSuperClusterConfigIsChecked() {
    assertInvalid(
        workerConfig()
            .setSuperClusterConfig(
                DispatchConfigs.SuperClusterConfig.newBuilder()
                    .setRegion("us-east-1")
                    .putRegionGateways("eu-west-1", "gproto+http://eu:8081")));
    assertInvalid(
        workerConfig()
            .setSuperClusterConfig(
                DispatchConfigs.SuperClusterConfig.newBuilder()
                    .putRegionGateways("eu-west-1", "eu:8081")));
    assertThatNoException()
        .isThrownBy(
            () ->
                ValidateDispatchConfig.validateConfig(
                    workerConfig()
                        .setSuperClusterConfig(
                            DispatchConfigs.SuperClusterConfig.newBuilder()
                                .setRegion("us-east-1")
                                .putRegionGateways("us-east-1", "gproto+http://us:8081")
                                .putRegionGateways("eu-west-1", "gproto+http://eu:8081"))
                        .build()));
  }

  private static void assertInvalid(DispatchConfigs.DispatchConfig.Builder config) {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> ValidateDispatchConfig.validateConfig(config.build()));
  }

  private static DispatchConfigs.DispatchConfig.Builder workerConfig() {
    return DispatchConfigs.DispatchConfig.newBuilder()
        .addNodeRoles(DispatchConfigs.NodeRole.WORKER)
        .setWorkerConfig(worker());
  }

  private static DispatchConfigs.WorkerConfig.Builder worker() {
    return DispatchConfigs.WorkerConfig.newBuilder()
        .setServerConfig(server(8080, 3000))
        .setDataDirectory("/tmp/data")
        .setBatchSize(10)
        .setHandlerThreads(1);
  }

  private static DispatchConfigs.ServerConfig server(int port, int requestTimeoutMs) {
    return DispatchConfigs.ServerConfig.newBuilder()
        .setServerPort(port)
        .setServerAddress("localhost")
        .setRequestTimeoutMs(requestTimeoutMs)
        .build();
  }
}
