package com.slack.dispatch.cluster;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** A fixed file to worker placement. */
public class StaticPlacementTopology implements PlacementTopology {
  private final Map<Long, DispatchTarget> owners;

  public StaticPlacementTopology(Map<Long, DispatchTarget> owners) {
    this.owners = Map.copyOf(owners);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Optional<DispatchTarget> ownerOf(long fileId) {
    return Optional.ofNullable(owners.get(fileId));
  }

  public static class Builder {
    private final Map<Long, DispatchTarget> owners = new HashMap<>();

    public Builder place(DispatchTarget owner, long... fileIds) {
      for (long fileId : fileIds) {
        owners.put(fileId, owner);
      }
      return this;
    }

    public StaticPlacementTopology build() {
      return new StaticPlacementTopology(owners);
    }
  }
}
