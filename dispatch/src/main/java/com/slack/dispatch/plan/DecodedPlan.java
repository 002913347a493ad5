package com.slack.dispatch.plan;

import java.util.Objects;

/**
 * Result of decoding plan bytes. Either a plan of a version this node understands, or a plan of an
 * unknown version that is reported as such rather than parsed on a best effort basis.
 */
public abstract class DecodedPlan {

  public abstract int version();

  public abstract boolean isKnown();

  /**
   * @throws PlanDecodeException if the plan was written in a version this node can't execute
   */
  public abstract ScanNode scanNode() throws PlanDecodeException;

  public static final class Known extends DecodedPlan {
    private final int version;
    private final ScanNode scanNode;

    Known(int version, ScanNode scanNode) {
      this.version = version;
      this.scanNode = scanNode;
    }

    @Override
    public int version() {
      return version;
    }

    @Override
    public boolean isKnown() {
      return true;
    }

    @Override
    public ScanNode scanNode() {
      return scanNode;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Known that)) return false;
      return version == that.version && scanNode.equals(that.scanNode);
    }

    @Override
    public int hashCode() {
      return Objects.hash(version, scanNode);
    }

    @Override
    public String toString() {
      return "Known{version=" + version + ", scanNode=" + scanNode + '}';
    }
  }

  public static final class UnknownVersion extends DecodedPlan {
    private final int version;

    UnknownVersion(int version) {
      this.version = version;
    }

    @Override
    public int version() {
      return version;
    }

    @Override
    public boolean isKnown() {
      return false;
    }

    @Override
    public ScanNode scanNode() throws PlanDecodeException {
      throw new PlanDecodeException(
          "Plan version "
              + version
              + " is not supported, highest supported version is "
              + ScanPlanCodec.CURRENT_VERSION);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof UnknownVersion that)) return false;
      return version == that.version;
    }

    @Override
    public int hashCode() {
      return Integer.hashCode(version);
    }

    @Override
    public String toString() {
      return "UnknownVersion{version=" + version + '}';
    }
  }
}
