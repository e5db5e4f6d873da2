package io.authflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.authflow.core.graph.GraphDefinition;

/// Jackson mixin that binds `GraphDefinition` deserialization to its builder.
///
/// Applied to `GraphDefinition.class` via `AuthFlowJacksonModule.setupModule()`. Absent
/// optional fields (`description`, `profileId`, `metadata`) are omitted on output.
///
/// @apiNote The companion mixin {@link GraphDefinitionBuilderMixin} must also be registered
/// so Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see GraphDefinitionBuilderMixin
/// @see io.authflow.serialization.AuthFlowJacksonModule
@JsonDeserialize(builder = GraphDefinition.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class GraphDefinitionMixin {}
