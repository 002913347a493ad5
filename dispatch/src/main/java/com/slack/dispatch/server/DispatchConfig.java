package com.slack.dispatch.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import com.slack.dispatch.proto.config.DispatchConfigs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/**
 * Holds the node configuration, loaded once from a yaml or json file and validated. Yaml values may
 * reference environment variables as ${NAME} or ${NAME:-default}.
 */
public class DispatchConfig {

  // How long guava services get to start or stop.
  public static final Duration DEFAULT_START_STOP_DURATION = Duration.ofSeconds(15);

  private static final ObjectMapper YAML_READER = new ObjectMapper(new YAMLFactory());
  private static final ObjectMapper JSON_WRITER = new ObjectMapper();

  private static volatile DispatchConfigs.DispatchConfig loaded = null;

  private DispatchConfig() {}

  public static synchronized void initFromFile(Path cfgFilePath) throws IOException {
    if (loaded != null) {
      return;
    }
    if (Files.notExists(cfgFilePath)) {
      throw new IllegalArgumentException(
          "Missing config file at: " + cfgFilePath.toAbsolutePath());
    }
    loaded = load(cfgFilePath, Files.readString(cfgFilePath));
  }

  public static DispatchConfigs.DispatchConfig get() {
    DispatchConfigs.DispatchConfig config = loaded;
    if (config == null) {
      throw new IllegalStateException("DispatchConfig not initialized");
    }
    return config;
  }

  @VisibleForTesting
  static synchronized void reset() {
    loaded = null;
  }

  private static DispatchConfigs.DispatchConfig load(Path cfgFilePath, String contents)
      throws IOException {
    String filename = cfgFilePath.getFileName().toString();
    if (filename.endsWith(".yaml") || filename.endsWith(".yml")) {
      return fromYamlConfig(contents, System::getenv);
    }
    if (filename.endsWith(".json")) {
      return fromJsonConfig(contents);
    }
    throw new IllegalArgumentException(
        "Invalid config file format provided - must be either .json or .yaml");
  }

  /** Parses and validates a json document as a DispatchConfig. */
  @VisibleForTesting
  static DispatchConfigs.DispatchConfig fromJsonConfig(String jsonStr)
      throws InvalidProtocolBufferException {
    DispatchConfigs.DispatchConfig.Builder builder = DispatchConfigs.DispatchConfig.newBuilder();
    JsonFormat.parser().ignoringUnknownFields().merge(jsonStr, builder);
    DispatchConfigs.DispatchConfig dispatchConfig = builder.build();
    ValidateDispatchConfig.validateConfig(dispatchConfig);
    return dispatchConfig;
  }

  /** Substitutes variables from {@code variableResolver}, then parses the yaml as json. */
  @VisibleForTesting
  static DispatchConfigs.DispatchConfig fromYamlConfig(
      String yamlStr, StringLookup variableResolver)
      throws InvalidProtocolBufferException, JsonProcessingException {
    String substituted = new StringSubstitutor(variableResolver).replace(yamlStr);
    Object tree = YAML_READER.readValue(substituted, Object.class);
    return fromJsonConfig(JSON_WRITER.writeValueAsString(tree));
  }
}
