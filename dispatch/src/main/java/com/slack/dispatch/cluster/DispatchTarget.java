package com.slack.dispatch.cluster;

import static com.google.common.base.Preconditions.checkArgument;

import com.slack.dispatch.proto.config.DispatchConfigs;
import java.util.Objects;

/**
 * An endpoint that accepts search requests: either a worker that scans its own files, or a
 * regional gateway that fans the request out to the workers of another cluster. Both speak the same
 * protocol, so the dispatcher only needs the url.
 */
public class DispatchTarget implements Comparable<DispatchTarget> {

  // If we want to make this configurable in the future expose this within the server config
  public static final String GRPC_PROTOCOL = "gproto+http://";

  public enum Kind {
    WORKER,
    GATEWAY
  }

  public final String url;
  public final Kind kind;

  public DispatchTarget(String url, Kind kind) {
    checkArgument(url != null && !url.isEmpty(), "url can't be null or empty");
    checkArgument(kind != null, "kind can't be null");
    this.url = url;
    this.kind = kind;
  }

  public static DispatchTarget worker(String url) {
    return new DispatchTarget(url, Kind.WORKER);
  }

  public static DispatchTarget gateway(String url) {
    return new DispatchTarget(url, Kind.GATEWAY);
  }

  public static DispatchTarget fromHostPort(String hostname, int port, Kind kind) {
    checkArgument(hostname != null && !hostname.isEmpty(), "hostname can't be null or empty");
    checkArgument(port > 0, "port value has to be a positive number.");
    return new DispatchTarget(GRPC_PROTOCOL + hostname + ":" + port, kind);
  }

  public static DispatchTarget fromConfig(DispatchConfigs.ServerConfig serverConfig, Kind kind) {
    return fromHostPort(serverConfig.getServerAddress(), serverConfig.getServerPort(), kind);
  }

  @Override
  public int compareTo(DispatchTarget other) {
    int cmp = url.compareTo(other.url);
    return cmp != 0 ? cmp : kind.compareTo(other.kind);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DispatchTarget that)) return false;
    return url.equals(that.url) && kind == that.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(url, kind);
  }

  @Override
  public String toString() {
    return kind == Kind.WORKER ? url : kind + ":" + url;
  }
}
