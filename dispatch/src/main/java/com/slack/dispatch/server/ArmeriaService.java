package com.slack.dispatch.server;

import brave.Tracing;
import brave.context.log4j2.ThreadContextScopeDecorator;
import brave.handler.MutableSpan;
import brave.handler.SpanHandler;
import brave.propagation.TraceContext;
import com.google.common.util.concurrent.AbstractIdleService;
import com.linecorp.armeria.common.HttpResponse;
import com.linecorp.armeria.common.brave.RequestContextCurrentTraceContext;
import com.linecorp.armeria.common.grpc.GrpcMeterIdPrefixFunction;
import com.linecorp.armeria.common.logging.LogLevel;
import com.linecorp.armeria.server.Server;
import com.linecorp.armeria.server.ServerBuilder;
import com.linecorp.armeria.server.brave.BraveService;
import com.linecorp.armeria.server.encoding.EncodingService;
import com.linecorp.armeria.server.grpc.GrpcService;
import com.linecorp.armeria.server.healthcheck.HealthCheckService;
import com.linecorp.armeria.server.logging.LoggingService;
import com.linecorp.armeria.server.metric.MetricCollectingService;
import com.slack.dispatch.proto.config.DispatchConfigs;
import io.grpc.BindableService;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import zipkin2.reporter.Sender;
import zipkin2.reporter.brave.AsyncZipkinSpanHandler;
import zipkin2.reporter.urlconnection.URLConnectionSender;

/** Armeria server hosting one search service plus health and metrics endpoints. */
public class ArmeriaService extends AbstractIdleService {
  private static final Logger LOG = LoggerFactory.getLogger(ArmeriaService.class);

  private final String serviceName;
  private final Server server;
  private final List<Closeable> closeables;

  private ArmeriaService(Server server, String serviceName, List<Closeable> closeables) {
    this.server = server;
    this.serviceName = serviceName;
    this.closeables = closeables;
  }

  public static class Builder {
    private final String serviceName;
    private final ServerBuilder serverBuilder;
    private final List<SpanHandler> spanHandlers = new ArrayList<>();
    private final List<Closeable> closeables = new ArrayList<>();

    public Builder(int port, String serviceName, PrometheusMeterRegistry prometheusMeterRegistry) {
      this.serviceName = serviceName;
      this.serverBuilder = Server.builder().http(port);

      initializeCompression();
      initializeLogging();
      initializeManagementEndpoints(prometheusMeterRegistry);
    }

    private void initializeCompression() {
      serverBuilder.decorator(EncodingService.builder().newDecorator());
    }

    private void initializeLogging() {
      serverBuilder.decorator(
          LoggingService.builder()
              // Not logging any successful response, say prom scraping /metrics every 30 seconds at
              // INFO
              .successfulResponseLogLevel(LogLevel.DEBUG)
              .failureResponseLogLevel(LogLevel.ERROR)
              // Remove the content to prevent blowing up the logs
              .responseContentSanitizer((ctx, content) -> "truncated")
              // Remove all headers to be sure we aren't leaking any auth/cookie info
              .requestHeadersSanitizer((ctx, headers) -> DefaultHttpHeaders.EMPTY_HEADERS)
              .newDecorator());
    }

    private void initializeManagementEndpoints(PrometheusMeterRegistry prometheusMeterRegistry) {
      serverBuilder
          .service("/health", HealthCheckService.builder().build())
          .service("/metrics", (ctx, req) -> HttpResponse.of(prometheusMeterRegistry.scrape()));
    }

    public Builder withRequestTimeout(Duration requestTimeout) {
      serverBuilder.requestTimeout(requestTimeout);
      return this;
    }

    public Builder withTracing(DispatchConfigs.TracingConfig tracingConfig) {
      // span handlers is an ordered list, so we need to be careful with ordering
      if (tracingConfig.getCommonTagsCount() > 0) {
        spanHandlers.add(
            new SpanHandler() {
              @Override
              public boolean begin(TraceContext context, MutableSpan span, TraceContext parent) {
                tracingConfig.getCommonTagsMap().forEach(span::tag);
                return true;
              }
            });
      }

      if (!tracingConfig.getZipkinEndpoint().isBlank()) {
        LOG.info("Trace reporting enabled: {}", tracingConfig.getZipkinEndpoint());
        Sender sender = URLConnectionSender.create(tracingConfig.getZipkinEndpoint());
        spanHandlers.add(AsyncZipkinSpanHandler.create(sender));
      }

      return this;
    }

    /**
     * Serves a search service. Service calls run on the blocking executor since a gateway call
     * starts its child partitions before it returns.
     */
    public <T extends BindableService & Closeable> Builder withSearchService(T searchService) {
      GrpcService grpcService =
          GrpcService.builder()
              .addService(searchService)
              // the client deadline bounds every partition, so it has to reach the handler
              .useClientTimeoutHeader(true)
              .useBlockingTaskExecutor(true)
              .intercept(
                  new ServerInterceptor() {
                    // enables compressed server responses for all RPCs
                    @Override
                    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
                        ServerCall<ReqT, RespT> call,
                        Metadata headers,
                        ServerCallHandler<ReqT, RespT> next) {
                      call.setCompression("gzip");
                      return next.startCall(call, headers);
                    }
                  })
              .build();
      serverBuilder.decorator(
          MetricCollectingService.newDecorator(GrpcMeterIdPrefixFunction.of("grpc.service")));
      serverBuilder.service(grpcService);
      closeables.add(searchService);
      return this;
    }

    public ArmeriaService build() {
      Tracing.Builder tracingBuilder =
          Tracing.newBuilder()
              .localServiceName(serviceName)
              .currentTraceContext(
                  RequestContextCurrentTraceContext.builder()
                      .addScopeDecorator(ThreadContextScopeDecorator.get())
                      .build());
      spanHandlers.forEach(tracingBuilder::addSpanHandler);
      serverBuilder.decorator(BraveService.newDecorator(tracingBuilder.build()));

      return new ArmeriaService(serverBuilder.build(), serviceName, List.copyOf(closeables));
    }
  }

  @Override
  protected void startUp() throws Exception {
    LOG.info("Starting {} on ports {}", serviceName, server.config().ports());
    CompletableFuture<Void> serverFuture = server.start();
    serverFuture.get(15, TimeUnit.SECONDS);
  }

  @Override
  protected void shutDown() throws Exception {
    LOG.info("Shutting down {}", serviceName);
    // stops accepting calls first, so no handler starts once the search services close
    server.close();
    for (Closeable closeable : closeables) {
      closeable.close();
    }
  }

  @Override
  protected String serviceName() {
    if (this.serviceName != null) {
      return this.serviceName;
    }
    return super.serviceName();
  }

  @Override
  public String toString() {
    return "ArmeriaService{" + "serviceName='" + serviceName() + '\'' + '}';
  }
}
