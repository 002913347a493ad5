package com.slack.dispatch.cluster;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import com.slack.dispatch.partition.LocalityException;
import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.proto.service.DispatchSearch;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TargetResolverTest {
  private static final DispatchTarget WORKER = DispatchTarget.worker("gproto+http://w1:8080");
  private static final DispatchTarget GATEWAY = DispatchTarget.gateway("gproto+http://gw:8081");

  private final PlacementTopology topology =
      StaticPlacementTopology.builder().place(WORKER, 10, 11).build();

  @Test
  public void testNormalRequestGoesToFileOwner() throws LocalityException {
    TargetResolver resolver = new TargetResolver(topology, GATEWAY);

    assertThat(resolver.resolve(request(false, 10, 11))).isEqualTo(WORKER);
  }

  @Test
  public void testSuperClusterRequestGoesToGateway() throws LocalityException {
    TargetResolver resolver = new TargetResolver(topology, GATEWAY);

    DispatchTarget target = resolver.resolve(request(true, 99));

    assertThat(target).isEqualTo(GATEWAY);
    assertThat(target.kind).isEqualTo(DispatchTarget.Kind.GATEWAY);
  }

  @Test
  public void testSuperClusterRequestWithoutGatewayFails() {
    TargetResolver resolver = new TargetResolver(topology);

    assertThat(resolver.getRegionalGateway()).isEmpty();
    assertThatIllegalStateException().isThrownBy(() -> resolver.resolve(request(true, 10)));
  }

  @Test
  public void testUnplacedFilesAreLocalityErrors() {
    TargetResolver resolver = new TargetResolver(topology);

    assertThatExceptionOfType(LocalityException.class)
        .isThrownBy(() -> resolver.resolve(request(false, 12)));
    assertThatExceptionOfType(LocalityException.class)
        .isThrownBy(() -> resolver.resolve(request(false)));
  }

  @Test
  public void testHashPlacementFromConfig() {
    HashPlacementTopology hashTopology =
        HashPlacementTopology.fromConfig(
            DispatchConfigs.TopologyConfig.newBuilder()
                .addWorkerUrls("gproto+http://w0:8080")
                .addWorkerUrls("gproto+http://w1:8080")
                .build());

    assertThat(hashTopology.ownerOf(4)).contains(DispatchTarget.worker("gproto+http://w0:8080"));
    assertThat(hashTopology.ownerOf(-3)).contains(DispatchTarget.worker("gproto+http://w1:8080"));
  }

  @Test
  public void testRegionalGatewayFromConfig() throws LocalityException {
    DispatchConfigs.TopologyConfig topologyConfig =
        DispatchConfigs.TopologyConfig.newBuilder().addWorkerUrls("gproto+http://w0:8080").build();
    DispatchConfigs.SuperClusterConfig superClusterConfig =
        DispatchConfigs.SuperClusterConfig.newBuilder()
            .setRegion("us-east-1")
            .putRegionGateways("us-east-1", "gproto+http://us-gw:8081")
            .putRegionGateways("eu-west-1", "gproto+http://eu-gw:8081")
            .build();

    TargetResolver resolver = TargetResolver.fromConfig(topologyConfig, superClusterConfig);

    assertThat(resolver.getRegionalGateway())
        .contains(DispatchTarget.gateway("gproto+http://us-gw:8081"));
    assertThat(resolver.resolve(request(false, 7)))
        .isEqualTo(DispatchTarget.worker("gproto+http://w0:8080"));
    assertThat(
            TargetResolver.fromConfig(
                    topologyConfig, DispatchConfigs.SuperClusterConfig.getDefaultInstance())
                .getRegionalGateway())
        .isEmpty();
  }

  @Test
  public void testTargetFromServerConfig() {
    DispatchTarget target =
        DispatchTarget.fromConfig(
            DispatchConfigs.ServerConfig.newBuilder()
                .setServerAddress("localhost")
                .setServerPort(8080)
                .build(),
            DispatchTarget.Kind.WORKER);

    assertThat(target.url).isEqualTo("gproto+http://localhost:8080");
    assertThat(target.kind).isEqualTo(DispatchTarget.Kind.WORKER);
    assertThat(List.of(target, WORKER, GATEWAY)).isSorted();
  }

  private static DispatchSearch.SearchRequest request(boolean superCluster, long... fileIds) {
    DispatchSearch.SearchRequest.Builder builder =
        DispatchSearch.SearchRequest.newBuilder().setTraceId("t1").setIsSuperCluster(superCluster);
    for (long fileId : fileIds) {
      builder.addFileIdList(fileId);
    }
    return builder.build();
  }
}
