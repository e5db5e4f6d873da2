package io.authflow.core.graph;

import java.time.Instant;

/// Authoring metadata of a graph definition.
public record GraphMetadata(Instant createdAt, Instant updatedAt, String createdBy) {}
