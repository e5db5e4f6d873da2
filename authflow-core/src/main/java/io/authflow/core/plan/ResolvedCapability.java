package io.authflow.core.plan;

import io.authflow.core.context.ContextValues;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Capability of a compiled node with its full id resolved.
///
/// @param type capability type, not null
/// @param id full capability id, `nodeId + "_" + idSuffix`
/// @param required whether the capability must be completed
/// @param hints presentation hints, never null after construction
/// @param validationRules validation rules, never null after construction
public record ResolvedCapability(
        String type,
        String id,
        boolean required,
        Map<String, Object> hints,
        List<Map<String, Object>> validationRules) {

    public ResolvedCapability {
        hints = ContextValues.freezeMap(hints);
        List<Map<String, Object>> rules = new ArrayList<>();
        if (validationRules != null) {
            for (Map<String, Object> rule : validationRules) {
                rules.add(ContextValues.freezeMap(rule));
            }
        }
        validationRules = List.copyOf(rules);
    }
}
