package io.authflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin for the `CapabilityTemplate` record. Empty hints and rules are omitted on
/// output.
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public abstract class CapabilityTemplateMixin {}
