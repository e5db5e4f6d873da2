package io.authflow.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.authflow.core.graph.GraphDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Loads the flows shipped with the engine from the classpath.
///
/// Built-in flows live under `flows/<flowId>.json` and work without any tenant
/// configuration:
/// - `human-basic-login`: identifier, then passkey or email code
/// - `risk-based-login`: identifier, then a risk decision and a per-country method switch
///
/// {@snippet :
/// var env = AuthFlowFactory.builder()
///     .builtinFlows(BuiltinFlows.loadAll())
///     .build();
/// }
public final class BuiltinFlows {

    private static final Logger logger = Logger.getLogger(BuiltinFlows.class.getName());

    public static final String HUMAN_BASIC_LOGIN = "human-basic-login";
    public static final String RISK_BASED_LOGIN = "risk-based-login";

    /// Ids of all flows shipped as resources.
    public static final List<String> FLOW_IDS = List.of(HUMAN_BASIC_LOGIN, RISK_BASED_LOGIN);

    private static final String RESOURCE_DIR = "flows/";

    private BuiltinFlows() {}

    /// Loads every shipped flow.
    ///
    /// @return flows in {@link #FLOW_IDS} order, never null
    /// @throws IllegalStateException if a resource is missing or unreadable
    public static List<GraphDefinition> loadAll() {
        ObjectMapper mapper = FlowSerializer.createMapper();
        List<GraphDefinition> flows = new ArrayList<>();
        for (String flowId : FLOW_IDS) {
            flows.add(load(flowId, mapper));
        }
        return List.copyOf(flows);
    }

    /// Loads one shipped flow.
    ///
    /// @param flowId flow id, not null
    /// @return the flow definition, never null
    /// @throws IllegalStateException if no such resource exists or it cannot be parsed
    public static GraphDefinition load(String flowId) {
        return load(flowId, FlowSerializer.createMapper());
    }

    private static GraphDefinition load(String flowId, ObjectMapper mapper) {
        String resource = RESOURCE_DIR + flowId + ".json";
        try (InputStream in = BuiltinFlows.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Built-in flow resource not found: " + resource);
            }
            GraphDefinition flow = mapper.readValue(in, GraphDefinition.class);
            if (!flowId.equals(flow.getId())) {
                throw new IllegalStateException(
                        "Built-in flow " + resource + " declares id " + flow.getId());
            }
            logger.info(
                    "Loaded built-in flow: id="
                            + flow.getId()
                            + ", version="
                            + flow.getFlowVersion()
                            + ", nodes="
                            + flow.getNodes().size());
            return flow;
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Failed to load built-in flow " + resource + ": " + e.getMessage(), e);
        }
    }
}
