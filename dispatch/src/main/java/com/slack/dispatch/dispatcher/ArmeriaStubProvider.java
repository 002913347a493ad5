package com.slack.dispatch.dispatcher;

import com.linecorp.armeria.client.grpc.GrpcClients;
import com.slack.dispatch.cluster.DispatchTarget;
import com.slack.dispatch.proto.service.SearchDispatchServiceGrpc;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Caches one Armeria gRPC client per target url. */
public class ArmeriaStubProvider implements StubProvider {
  private static final Logger LOG = LoggerFactory.getLogger(ArmeriaStubProvider.class);

  private final Map<String, SearchDispatchServiceGrpc.SearchDispatchServiceStub> stubs =
      new ConcurrentHashMap<>();

  @Override
  public SearchDispatchServiceGrpc.SearchDispatchServiceStub stubFor(DispatchTarget target) {
    return stubs.computeIfAbsent(target.url, this::newStub);
  }

  private SearchDispatchServiceGrpc.SearchDispatchServiceStub newStub(String url) {
    LOG.info("Creating search stub for {}", url);
    return GrpcClients.builder(url)
        .build(SearchDispatchServiceGrpc.SearchDispatchServiceStub.class)
        // This enables compression for requests
        // Independent of this setting, servers choose whether to compress responses
        .withCompression("gzip");
  }
}
