package com.slack.dispatch.server;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;
import com.slack.dispatch.cluster.HashPlacementTopology;
import com.slack.dispatch.cluster.TargetResolver;
import com.slack.dispatch.dispatcher.ArmeriaStubProvider;
import com.slack.dispatch.dispatcher.SearchDispatcher;
import com.slack.dispatch.gateway.SuperClusterGatewayService;
import com.slack.dispatch.partition.PartitionAssigner;
import com.slack.dispatch.proto.config.DispatchConfigs;
import com.slack.dispatch.worker.WorkerSearchService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main class of a dispatch node. Starts the services of every configured role: a worker that
 * scans its local files, and/or a regional gateway that fans super cluster queries out to the
 * workers of its cluster.
 */
public class Dispatch {
  private static final Logger LOG = LoggerFactory.getLogger(Dispatch.class);

  private final PrometheusMeterRegistry prometheusMeterRegistry;
  private final DispatchConfigs.DispatchConfig dispatchConfig;
  protected ServiceManager serviceManager;

  Dispatch(
      DispatchConfigs.DispatchConfig dispatchConfig,
      PrometheusMeterRegistry prometheusMeterRegistry) {
    this.prometheusMeterRegistry = prometheusMeterRegistry;
    this.dispatchConfig = dispatchConfig;
    Metrics.addRegistry(prometheusMeterRegistry);
    LOG.info("Started Dispatch process with config: {}", dispatchConfig);
  }

  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      LOG.error("Config file is needed a first argument");
      System.exit(1);
    }
    Path configFilePath = Path.of(args[0]);

    DispatchConfig.initFromFile(configFilePath);
    DispatchConfigs.DispatchConfig config = DispatchConfig.get();
    Dispatch dispatch = new Dispatch(config, initPrometheusMeterRegistry(config));
    dispatch.start();
  }

  static PrometheusMeterRegistry initPrometheusMeterRegistry(
      DispatchConfigs.DispatchConfig config) {
    PrometheusMeterRegistry prometheusMeterRegistry =
        new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    prometheusMeterRegistry
        .config()
        .commonTags(
            "dispatch_cluster_name",
            config.getClusterConfig().getClusterName(),
            "dispatch_env",
            config.getClusterConfig().getEnv(),
            "dispatch_component",
            getComponentTag(config));
    return prometheusMeterRegistry;
  }

  private static String getComponentTag(DispatchConfigs.DispatchConfig config) {
    String component;
    if (config.getNodeRolesList().size() == 1) {
      component = config.getNodeRolesList().get(0).toString();
    } else {
      component = Strings.join(config.getNodeRolesList(), '-');
    }
    return Strings.toRootLowerCase(component);
  }

  public void start() {
    setupSystemMetrics(prometheusMeterRegistry);
    addShutdownHook();

    serviceManager = new ServiceManager(getServices(dispatchConfig, prometheusMeterRegistry));
    serviceManager.addListener(getServiceManagerListener(), MoreExecutors.directExecutor());

    serviceManager.startAsync();
  }

  static Set<Service> getServices(
      DispatchConfigs.DispatchConfig dispatchConfig, PrometheusMeterRegistry meterRegistry) {
    Set<Service> services = new HashSet<>();

    HashSet<DispatchConfigs.NodeRole> roles = new HashSet<>(dispatchConfig.getNodeRolesList());

    if (roles.contains(DispatchConfigs.NodeRole.WORKER)) {
      DispatchConfigs.WorkerConfig workerConfig = dispatchConfig.getWorkerConfig();
      WorkerSearchService workerSearchService =
          WorkerSearchService.fromConfig(workerConfig, meterRegistry);
      services.add(
          new ArmeriaService.Builder(
                  workerConfig.getServerConfig().getServerPort(), "dispatchWorker", meterRegistry)
              .withRequestTimeout(
                  Duration.ofMillis(workerConfig.getServerConfig().getRequestTimeoutMs()))
              .withTracing(dispatchConfig.getTracingConfig())
              .withSearchService(workerSearchService)
              .build());
    }

    if (roles.contains(DispatchConfigs.NodeRole.GATEWAY)) {
      DispatchConfigs.GatewayConfig gatewayConfig = dispatchConfig.getGatewayConfig();
      HashPlacementTopology topology =
          HashPlacementTopology.fromConfig(dispatchConfig.getTopologyConfig());
      SearchDispatcher childDispatcher =
          new SearchDispatcher(
              new TargetResolver(topology),
              new ArmeriaStubProvider(),
              meterRegistry,
              dispatchConfig.getQueryConfig().getCompletionPolicy());
      SuperClusterGatewayService gatewayService =
          new SuperClusterGatewayService(
              new PartitionAssigner(
                  topology,
                  dispatchConfig.getQueryConfig().getMaxFilesPerPartition(),
                  dispatchConfig.getQueryConfig().getTargetPartitionsPerWorker()),
              childDispatcher,
              gatewayConfig.getRelayThreads(),
              meterRegistry);
      services.add(
          new ArmeriaService.Builder(
                  gatewayConfig.getServerConfig().getServerPort(),
                  "dispatchGateway",
                  meterRegistry)
              .withRequestTimeout(
                  Duration.ofMillis(gatewayConfig.getServerConfig().getRequestTimeoutMs()))
              .withTracing(dispatchConfig.getTracingConfig())
              .withSearchService(gatewayService)
              .build());
    }

    return services;
  }

  private static ServiceManager.Listener getServiceManagerListener() {
    return new ServiceManager.Listener() {
      @Override
      public void failure(Service service) {
        LOG.error(
            String.format("Service %s failed with cause ", service.getClass().toString()),
            service.failureCause());
        // shutdown if any services enters failure state
        LogManager.shutdown();
        Runtime.getRuntime().halt(1);
      }
    };
  }

  void shutdown() {
    LOG.info("Running shutdown hook.");
    try {
      serviceManager
          .stopAsync()
          .awaitStopped(DispatchConfig.DEFAULT_START_STOP_DURATION.toSeconds(), TimeUnit.SECONDS);
    } catch (Exception e) {
      // stopping timed out
      LOG.error("ServiceManager shutdown timed out", e);
    }
    LOG.info("Shutting down LogManager");
    LogManager.shutdown();
  }

  private void addShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown));
  }

  private static void setupSystemMetrics(MeterRegistry prometheusMeterRegistry) {
    // Expose JVM metrics.
    new ClassLoaderMetrics().bindTo(prometheusMeterRegistry);
    new JvmMemoryMetrics().bindTo(prometheusMeterRegistry);
    new JvmGcMetrics().bindTo(prometheusMeterRegistry);
    new ProcessorMetrics().bindTo(prometheusMeterRegistry);
    new JvmThreadMetrics().bindTo(prometheusMeterRegistry);
  }
}
