package io.authflow.core.plan;

import io.authflow.core.context.ContextValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// One case of a switch node.
///
/// @param id case id, matched against transition source handles, not null
/// @param label display label, may be null
/// @param values scalar values selecting this case, never null after construction
public record SwitchCase(String id, String label, List<Object> values) {

    public SwitchCase {
        Objects.requireNonNull(id, "id must not be null");
        List<Object> frozen = new ArrayList<>();
        if (values != null) {
            for (Object value : values) {
                frozen.add(ContextValues.freeze(value));
            }
        }
        values = Collections.unmodifiableList(frozen);
    }
}
