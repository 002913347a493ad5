package com.slack.dispatch.testlib;

import com.slack.dispatch.cluster.DispatchTarget;
import com.slack.dispatch.dispatcher.StubProvider;
import com.slack.dispatch.proto.service.SearchDispatchServiceGrpc;
import io.grpc.BindableService;
import io.grpc.ManagedChannel;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves search services over the in-process transport and hands out stubs by target url. A url
 * without a registered service resolves to a channel with no server behind it.
 */
public class InProcessStubProvider implements StubProvider {
  private final GrpcCleanupExtension grpcCleanup;
  private final Map<String, ManagedChannel> channels = new ConcurrentHashMap<>();

  public InProcessStubProvider(GrpcCleanupExtension grpcCleanup) {
    this.grpcCleanup = grpcCleanup;
  }

  public DispatchTarget serve(DispatchTarget target, BindableService service) throws IOException {
    String serverName = InProcessServerBuilder.generateName();
    grpcCleanup.register(
        InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(service)
            .build()
            .start());
    channels.put(
        target.url,
        grpcCleanup.register(InProcessChannelBuilder.forName(serverName).directExecutor().build()));
    return target;
  }

  @Override
  public SearchDispatchServiceGrpc.SearchDispatchServiceStub stubFor(DispatchTarget target) {
    ManagedChannel channel =
        channels.computeIfAbsent(
            target.url,
            (url) ->
                grpcCleanup.register(
                    InProcessChannelBuilder.forName(InProcessServerBuilder.generateName())
                        .directExecutor()
                        .build()));
    return SearchDispatchServiceGrpc.newStub(channel);
  }
}
