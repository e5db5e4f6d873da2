package io.authflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Jackson mixin for the `GraphNode` record.
///
/// Flow editors store layout data such as `position` next to the node payload; it has no
/// meaning for compilation and is dropped on read.
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class GraphNodeMixin {}
