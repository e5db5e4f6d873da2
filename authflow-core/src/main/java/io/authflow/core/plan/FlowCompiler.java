package io.authflow.core.plan;

import io.authflow.core.exception.InvalidFlowConfigurationException;
import io.authflow.core.graph.CapabilityTemplate;
import io.authflow.core.graph.EdgeType;
import io.authflow.core.graph.GraphDefinition;
import io.authflow.core.graph.GraphEdge;
import io.authflow.core.graph.GraphNode;
import io.authflow.core.util.LogSanitizer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Compiles graph definitions into executable plans.
///
/// ### Validation
/// Compilation fails with {@link InvalidFlowConfigurationException} for:
/// - an empty node set or duplicate node ids
/// - more than {@link #MAX_CAPABILITIES_PER_NODE} capabilities on a node
/// - more than {@link #MAX_DECISION_BRANCHES} branches on a decision node
/// - more than {@link #MAX_SWITCH_CASES} cases on a switch node, or more than
///   {@link #MAX_VALUES_PER_CASE} values in one case
/// - malformed decision or switch configuration (non-list branches or cases, missing ids,
///   missing conditions, missing switch key, condition trees nested too deeply)
///
/// Compilation is all-or-nothing. Conditions are parsed but never evaluated here.
///
/// ### Algorithm
/// 1. Each node becomes a {@link CompiledNode}. Only `decision` and `switch` nodes receive a
///    {@link BranchingConfig}; every other type, known or not, compiles as a plain node.
/// 2. Each edge becomes a {@link Transition} under its source node. A transition without its
///    own priority inherits the priority of the decision branch named by its source handle.
/// 3. Transition lists are sorted by ascending priority (stable), unprioritized last.
/// 4. `nextOnSuccess` / `nextOnError` are the first success / error transition targets.
/// 5. The entry node is the first `start` node, or the first node if there is none.
///
/// Branches and cases whose id matches no transition handle are not an error. They behave as a
/// non-match at runtime; the compiler logs one warning per such handle.
///
/// @implNote Stateless apart from its limits and clock. Thread-safe.
/// @see io.authflow.core.execution.FlowExecutor for how plans are executed
public final class FlowCompiler {

    private static final Logger logger = Logger.getLogger(FlowCompiler.class.getName());

    public static final String PLAN_FORMAT_VERSION = "1.0.0";

    public static final int MAX_CAPABILITIES_PER_NODE = 20;
    public static final int MAX_DECISION_BRANCHES = 50;
    public static final int MAX_SWITCH_CASES = 100;
    public static final int MAX_VALUES_PER_CASE = 100;

    private static final Comparator<Transition> TRANSITION_ORDER =
            Comparator.comparing(Transition::priority, DecisionConfig.PRIORITY_ORDER);

    private final NodeConfigReader configReader;
    private final int maxCapabilitiesPerNode;
    private final Clock clock;

    public FlowCompiler() {
        this(Clock.systemUTC());
    }

    public FlowCompiler(Clock clock) {
        this(
                clock,
                MAX_CAPABILITIES_PER_NODE,
                MAX_DECISION_BRANCHES,
                MAX_SWITCH_CASES,
                MAX_VALUES_PER_CASE);
    }

    /// Creates a compiler with custom limits.
    ///
    /// @param clock source of `compiledAt` timestamps, not null
    /// @param maxCapabilitiesPerNode capability limit per node
    /// @param maxDecisionBranches branch limit per decision node
    /// @param maxSwitchCases case limit per switch node
    /// @param maxValuesPerCase value limit per switch case
    public FlowCompiler(
            Clock clock,
            int maxCapabilitiesPerNode,
            int maxDecisionBranches,
            int maxSwitchCases,
            int maxValuesPerCase) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxCapabilitiesPerNode = maxCapabilitiesPerNode;
        this.configReader =
                new NodeConfigReader(maxDecisionBranches, maxSwitchCases, maxValuesPerCase);
    }

    /// Compiles a graph definition.
    ///
    /// @param graph the definition to compile, not null
    /// @return immutable plan, never null
    /// @throws InvalidFlowConfigurationException if the definition violates a structural rule
    ///     or a size limit
    public CompiledPlan compile(GraphDefinition graph) throws InvalidFlowConfigurationException {
        Objects.requireNonNull(graph, "graph must not be null");

        List<GraphNode> graphNodes = graph.getNodes();
        if (graphNodes.isEmpty()) {
            throw new InvalidFlowConfigurationException(
                    "flow '" + graph.getId() + "' has no nodes");
        }

        Set<String> nodeIds = new HashSet<>();
        Map<String, BranchingConfig> branching = new LinkedHashMap<>();
        for (GraphNode node : graphNodes) {
            if (!nodeIds.add(node.id())) {
                throw new InvalidFlowConfigurationException(
                        "duplicate node id '" + node.id() + "'");
            }
            int capabilities = node.data().capabilities().size();
            if (capabilities > maxCapabilitiesPerNode) {
                throw new InvalidFlowConfigurationException(
                        "node '"
                                + node.id()
                                + "' has "
                                + capabilities
                                + " capabilities (max "
                                + maxCapabilitiesPerNode
                                + ")");
            }
            BranchingConfig config = readBranching(node);
            if (config != null) {
                branching.put(node.id(), config);
            }
        }

        Map<String, List<Transition>> transitions = buildTransitions(graph, branching, nodeIds);

        Map<String, CompiledNode> nodes = new LinkedHashMap<>();
        for (GraphNode node : graphNodes) {
            List<Transition> outgoing = transitions.getOrDefault(node.id(), List.of());
            nodes.put(
                    node.id(),
                    new CompiledNode(
                            node.id(),
                            node.type(),
                            node.data().intent(),
                            resolveCapabilities(node),
                            firstTarget(outgoing, EdgeType.SUCCESS),
                            firstTarget(outgoing, EdgeType.ERROR),
                            branching.get(node.id())));
        }

        branching.forEach((nodeId, config) -> warnDanglingHandles(nodeId, config, transitions));

        CompiledPlan plan =
                CompiledPlan.builder()
                        .id(graph.getId())
                        .version(PLAN_FORMAT_VERSION)
                        .sourceVersion(graph.getFlowVersion())
                        .profileId(graph.getProfileId())
                        .entryNodeId(findEntryNode(graphNodes))
                        .nodes(nodes)
                        .transitions(transitions)
                        .compiledAt(clock.instant())
                        .build();

        logger.info(
                "Compiled flow "
                        + LogSanitizer.sanitize(graph.getId())
                        + " v"
                        + LogSanitizer.sanitize(graph.getFlowVersion())
                        + ": "
                        + nodes.size()
                        + " nodes, entry="
                        + LogSanitizer.sanitize(plan.getEntryNodeId()));
        return plan;
    }

    private BranchingConfig readBranching(GraphNode node) throws InvalidFlowConfigurationException {
        if (GraphNode.TYPE_DECISION.equals(node.type())) {
            return configReader.readDecision(node.id(), node.data().config());
        }
        if (GraphNode.TYPE_SWITCH.equals(node.type())) {
            return configReader.readSwitch(node.id(), node.data().config());
        }
        return null;
    }

    private Map<String, List<Transition>> buildTransitions(
            GraphDefinition graph, Map<String, BranchingConfig> branching, Set<String> nodeIds) {
        Map<String, List<Transition>> transitions = new LinkedHashMap<>();
        for (GraphEdge edge : graph.getEdges()) {
            if (!nodeIds.contains(edge.source()) || !nodeIds.contains(edge.target())) {
                logger.warning(
                        "Edge "
                                + LogSanitizer.sanitize(edge.id())
                                + " references a node outside flow "
                                + LogSanitizer.sanitize(graph.getId()));
            }
            Integer priority = edge.priority();
            if (priority == null) {
                priority = branchPriority(branching.get(edge.source()), edge.sourceHandle());
            }
            transitions
                    .computeIfAbsent(edge.source(), source -> new ArrayList<>())
                    .add(new Transition(edge.target(), edge.type(), edge.sourceHandle(), priority));
        }
        transitions.values().forEach(list -> list.sort(TRANSITION_ORDER));
        return transitions;
    }

    private static Integer branchPriority(BranchingConfig config, String sourceHandle) {
        if (!(config instanceof DecisionConfig decision) || sourceHandle == null) {
            return null;
        }
        for (DecisionBranch branch : decision.branches()) {
            if (branch.id().equals(sourceHandle)) {
                return branch.priority();
            }
        }
        return null;
    }

    private static List<ResolvedCapability> resolveCapabilities(GraphNode node) {
        List<ResolvedCapability> resolved = new ArrayList<>();
        for (CapabilityTemplate template : node.data().capabilities()) {
            resolved.add(
                    new ResolvedCapability(
                            template.type(),
                            node.id() + "_" + template.idSuffix(),
                            template.required(),
                            template.hintsTemplate(),
                            template.validationRules()));
        }
        return resolved;
    }

    private static String firstTarget(List<Transition> transitions, EdgeType type) {
        for (Transition transition : transitions) {
            if (transition.type() == type) {
                return transition.targetNodeId();
            }
        }
        return null;
    }

    private static String findEntryNode(List<GraphNode> nodes) {
        for (GraphNode node : nodes) {
            if (GraphNode.TYPE_START.equals(node.type())) {
                return node.id();
            }
        }
        return nodes.get(0).id();
    }

    private static void warnDanglingHandles(
            String nodeId, BranchingConfig config, Map<String, List<Transition>> transitions) {
        Set<String> handles = new HashSet<>();
        for (Transition transition : transitions.getOrDefault(nodeId, List.of())) {
            if (transition.sourceHandle() != null) {
                handles.add(transition.sourceHandle());
            }
        }

        List<String> referenced = new ArrayList<>();
        if (config instanceof DecisionConfig decision) {
            decision.branches().forEach(branch -> referenced.add(branch.id()));
            if (decision.defaultBranch() != null) {
                referenced.add(decision.defaultBranch());
            }
        } else if (config instanceof SwitchConfig switchConfig) {
            switchConfig.cases().forEach(switchCase -> referenced.add(switchCase.id()));
            if (switchConfig.defaultCase() != null) {
                referenced.add(switchConfig.defaultCase());
            }
        }

        for (String handle : referenced) {
            if (!handles.contains(handle)) {
                logger.warning(
                        "Node "
                                + LogSanitizer.sanitize(nodeId)
                                + " references handle "
                                + LogSanitizer.sanitize(handle)
                                + " with no outgoing transition; it will never be selected");
            }
        }
    }
}
