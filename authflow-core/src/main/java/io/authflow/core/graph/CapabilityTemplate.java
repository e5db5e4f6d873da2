package io.authflow.core.graph;

import io.authflow.core.context.ContextValues;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Authentication action requested by a node, as authored.
///
/// The full capability id is `nodeId + "_" + idSuffix` and is resolved at compile time. Hints
/// and validation rules are opaque to the core and passed through to the capability layer.
///
/// @param type capability type such as `collect_identifier` or `verify_possession`, not null
/// @param idSuffix suffix of the resolved capability id, not null
/// @param required whether the capability must be completed
/// @param hintsTemplate presentation hints, never null after construction
/// @param validationRules input validation rules, never null after construction
public record CapabilityTemplate(
        String type,
        String idSuffix,
        boolean required,
        Map<String, Object> hintsTemplate,
        List<Map<String, Object>> validationRules) {

    public CapabilityTemplate {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(idSuffix, "idSuffix must not be null");
        hintsTemplate = ContextValues.freezeMap(hintsTemplate);
        List<Map<String, Object>> rules = new ArrayList<>();
        if (validationRules != null) {
            for (Map<String, Object> rule : validationRules) {
                rules.add(ContextValues.freezeMap(rule));
            }
        }
        validationRules = List.copyOf(rules);
    }

    public static CapabilityTemplate of(String type, String idSuffix, boolean required) {
        return new CapabilityTemplate(type, idSuffix, required, Map.of(), List.of());
    }
}
