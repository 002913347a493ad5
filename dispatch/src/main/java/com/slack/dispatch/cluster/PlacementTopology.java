package com.slack.dispatch.cluster;

import java.util.Optional;

/** Supplies the worker that currently holds each data file. */
public interface PlacementTopology {

  /** Returns the owning worker, or empty if no worker currently holds the file. */
  Optional<DispatchTarget> ownerOf(long fileId);
}
