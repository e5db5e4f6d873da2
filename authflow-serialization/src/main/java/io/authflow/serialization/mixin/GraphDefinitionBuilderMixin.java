package io.authflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `GraphDefinition.Builder` that configures POJO builder deserialization.
///
/// Sets `withPrefix = ""` so JSON field names map directly to builder method names. Editor
/// fields the builder does not know (node positions, viewport) are ignored.
///
/// @see GraphDefinitionMixin
@JsonPOJOBuilder(withPrefix = "")
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class GraphDefinitionBuilderMixin {}
