package io.weaver.core.generator;

import io.weaver.core.builder.SourceUnit;
import io.weaver.core.model.Connection;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.NodeVariant;
import io.weaver.core.model.Parameter;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortDirection;
import io.weaver.core.model.PortRef;
import io.weaver.core.model.ReservedNames;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.model.WorkflowOptions;
import io.weaver.core.plan.ExecutionPlan;
import io.weaver.core.plan.NodeStep;
import io.weaver.core.plan.ScopeLayer;
import io.weaver.core.plan.StepGuard;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/// Emits the entry points of one planned workflow into the companion class.
///
/// Generated code keeps one `ExecutionContext` per layer: `ctx` for the workflow body and
/// `ctx1`, `ctx2`, ... for scope activations by nesting depth. Node locals are prefixed with
/// the node id, so they never clash across nested lambdas.
final class WorkflowEmitter {

    private static final String ROOT_CONTEXT = "ctx";
    private static final Set<String> RESERVED_PREFIXES = Set.of("entry", "workflow");

    private final SourceUnit unit;
    private final ExecutionPlan plan;
    private final WorkflowGraph graph;
    private final boolean traced;
    private final JavaSourceWriter out;

    private final Map<String, NodeInstance> instances = new LinkedHashMap<>();
    private final Map<String, List<Connection>> incoming = new HashMap<>();
    private final Map<String, String> prefixes = new HashMap<>();
    private final Map<String, String> contexts = new HashMap<>();
    private int scopeDepth;

    WorkflowEmitter(SourceUnit unit, ExecutionPlan plan, boolean production, JavaSourceWriter out) {
        this.unit = unit;
        this.plan = plan;
        this.graph = plan.graph();
        this.traced = !production;
        this.out = out;

        Set<String> used = new HashSet<>(RESERVED_PREFIXES);
        for (NodeInstance instance : graph.getInstances()) {
            if (instances.putIfAbsent(instance.id(), instance) != null) {
                continue;
            }
            String prefix = JavaLiterals.identifier(instance.id());
            String unique = prefix;
            for (int n = 2; !used.add(unique); n++) {
                unique = prefix + "_" + n;
            }
            prefixes.put(instance.id(), unique);
        }
        for (Connection connection : graph.getConnections()) {
            incoming.computeIfAbsent(connection.to().node(), k -> new ArrayList<>())
                    .add(connection);
        }
    }

    void emit() {
        String function = graph.getFunctionName();
        String resultType = plan.async() ? "CompletableFuture<WorkflowResult>" : "WorkflowResult";

        out.line("/** Scheduling directives of workflow {@code " + graph.getName() + "}. */");
        out.line(
                "public static final WorkflowDirectives "
                        + directivesConstant()
                        + " = "
                        + directives()
                        + ";");
        out.blank();

        out.line("/** Runs workflow {@code " + graph.getName() + "} with a default context. */");
        out.open(
                "public static "
                        + resultType
                        + " "
                        + function
                        + "(boolean execute, Map<String, Object> params)");
        out.line("return " + function + "(execute, params, WorkflowContext.create());");
        out.close();
        out.blank();

        out.line("/** Runs workflow {@code " + graph.getName() + "}. */");
        out.open(
                "public static "
                        + resultType
                        + " "
                        + function
                        + "(boolean execute, Map<String, Object> params, WorkflowContext context)");
        if (plan.async()) {
            out.line(
                    "return Async.run(context, () -> "
                            + bodyName()
                            + "(execute, params, context));");
            out.close();
            out.blank();
            out.open(
                    "private static WorkflowResult "
                            + bodyName()
                            + "(boolean execute, Map<String, Object> params,"
                            + " WorkflowContext context)");
        }
        body();
        out.close();
    }

    private String bodyName() {
        return graph.getFunctionName() + "Body";
    }

    private String directivesConstant() {
        return JavaLiterals.constantName(graph.getFunctionName()) + "_DIRECTIVES";
    }

    private String directives() {
        WorkflowOptions options = graph.getOptions();
        if (options.trigger() == null
                && options.cancelOn() == null
                && options.retries() == null
                && options.timeout() == null
                && options.throttle() == null) {
            return "WorkflowDirectives.NONE";
        }
        List<String> args = new ArrayList<>();
        WorkflowOptions.Trigger trigger = options.trigger();
        args.add(JavaLiterals.string(trigger != null ? trigger.event() : null));
        args.add(JavaLiterals.string(trigger != null ? trigger.cron() : null));
        WorkflowOptions.CancelOn cancel = options.cancelOn();
        args.add(JavaLiterals.string(cancel != null ? cancel.event() : null));
        args.add(JavaLiterals.string(cancel != null ? cancel.match() : null));
        args.add(JavaLiterals.duration(cancel != null ? cancel.timeout() : null));
        args.add(JavaLiterals.integer(options.retries()));
        args.add(JavaLiterals.duration(options.timeout()));
        WorkflowOptions.Throttle throttle = options.throttle();
        args.add(throttle != null ? Integer.toString(throttle.limit()) : "null");
        args.add(JavaLiterals.duration(throttle != null ? throttle.period() : null));
        return "new WorkflowDirectives(" + String.join(", ", args) + ")";
    }

    // ---------------- Body ----------------

    private void body() {
        out.line(
                "ExecutionContext "
                        + ROOT_CONTEXT
                        + " = new ExecutionContext(context, "
                        + traced
                        + ");");
        out.line("Map<String, Object> in = params != null ? params : Map.of();");
        out.line(
                "int entryIdx = "
                        + ROOT_CONTEXT
                        + ".addExecution("
                        + JavaLiterals.string(ReservedNames.START)
                        + ");");
        for (Port port : graph.getStartPorts()) {
            if (!plan.isMaterialized(ReservedNames.START, port.getName(), null)) {
                continue;
            }
            String value;
            if (port.getName().equals(ReservedNames.EXECUTE)) {
                value = "execute";
            } else {
                value = "in.get(" + JavaLiterals.string(port.getName()) + ")";
                if (port.hasDefault()) {
                    String fallback = JavaLiterals.value(port.getDefaultValue());
                    value = "Coercions.orDefault(" + value + ", " + fallback + ")";
                }
            }
            String name = port.getName();
            out.line(setVariable(ROOT_CONTEXT, ReservedNames.START, name, "entryIdx", value));
        }

        layer(plan.root(), ROOT_CONTEXT);

        out.blank();
        List<String> builder = new ArrayList<>();
        for (Port port : graph.getExitPorts()) {
            String value = exitValue(port);
            if (port.getName().equals(ReservedNames.ON_SUCCESS)) {
                builder.add(".onSuccess(" + value + ")");
            } else if (port.getName().equals(ReservedNames.ON_FAILURE)) {
                builder.add(".onFailure(" + value + ")");
            } else {
                builder.add(".output(" + JavaLiterals.string(port.getName()) + ", " + value + ")");
            }
        }
        builder.add(".build();");
        out.wrapped("WorkflowResult workflowResult = WorkflowResult.builder()", builder);
        if (traced) {
            out.line(
                    "context.listener().onWorkflowComplete("
                            + JavaLiterals.string(graph.getName())
                            + ", workflowResult);");
        }
        out.line("return workflowResult;");
    }

    private String exitValue(Port port) {
        List<PortRef> sources =
                incoming.getOrDefault(ReservedNames.EXIT, List.of()).stream()
                        .filter(c -> c.to().port().equals(port.getName()))
                        .map(Connection::from)
                        .toList();
        if (port.isStep()) {
            if (sources.isEmpty()) {
                return Boolean.toString(port.getName().equals(ReservedNames.ON_SUCCESS));
            }
            return anyStep(sources);
        }
        return firstValue(sources);
    }

    // ---------------- Layers ----------------

    private void layer(ScopeLayer layer, String ctx) {
        contexts.put(layer.key(), ctx);
        for (String pull : layer.pullNodes()) {
            out.blank();
            out.line("// " + pull + ": " + typeOf(pull).getName() + " (on demand)");
            out.open(ctx + ".registerPullExecutor(" + JavaLiterals.string(pull) + ", () ->");
            node(pull, ctx);
            out.close(");");
        }
        for (String nodeId : layer.order()) {
            out.blank();
            guarded(nodeId, ctx);
        }
    }

    private void guarded(String nodeId, String ctx) {
        NodeStep step = plan.step(nodeId);
        StepGuard guard = step.guard();
        String prefix = prefixes.get(nodeId);
        out.line("// " + nodeId + ": " + typeOf(nodeId).getName());

        String condition = null;
        if (guard.needsJoin()) {
            String join = prefix + "Join";
            String ports =
                    guard.sources().keySet().stream()
                            .map(JavaLiterals::string)
                            .collect(Collectors.joining(", "));
            out.line(
                    "ConjunctionJoin "
                            + join
                            + " = new ConjunctionJoin("
                            + JavaLiterals.string(nodeId)
                            + ", List.of("
                            + ports
                            + "));");
            for (Map.Entry<String, List<PortRef>> entry : guard.sources().entrySet()) {
                String port = JavaLiterals.string(entry.getKey());
                for (PortRef ref : entry.getValue()) {
                    String source = JavaLiterals.string(ref.toString());
                    String value = readValue(ref);
                    out.line(join + ".report(" + port + ", " + source + ", " + value + ");");
                }
            }
            condition = join + ".tryFire()";
        } else if (!guard.isEmpty()) {
            condition =
                    guard.sources().values().stream()
                            .flatMap(List::stream)
                            .map(this::readStep)
                            .collect(Collectors.joining(" || "));
        } else if (!step.dataGuard().isEmpty()) {
            condition =
                    step.dataGuard().stream()
                            .map(source -> ctx + ".hasExecuted(" + JavaLiterals.string(source))
                            .map(check -> check + ")")
                            .collect(Collectors.joining(" && "));
        }

        if (condition != null) {
            out.open("if (" + condition + ")");
            node(nodeId, ctx);
            out.close();
        } else {
            node(nodeId, ctx);
        }
    }

    // ---------------- Nodes ----------------

    private void node(String nodeId, String ctx) {
        NodeInstance instance = instances.get(nodeId);
        NodeType type = typeOf(nodeId);
        NodeStep step = plan.step(nodeId);
        String prefix = prefixes.get(nodeId);
        String idx = prefix + "Idx";
        String result = prefix + "Result";
        String failed = prefix + "Failed";
        String execute = executeArgument(nodeId, type, step);
        String typeName = JavaLiterals.string(type.getName());
        String id = JavaLiterals.string(nodeId);

        Map<String, String> closures = new LinkedHashMap<>();
        for (Parameter parameter : type.getParameters()) {
            if (parameter.kind() == Parameter.Kind.SCOPE) {
                closures.put(parameter.name(), scopeClosure(nodeId, type, parameter.name(), ctx));
            }
        }

        out.line("int " + idx + " = " + ctx + ".addExecution(" + id + ");");
        if (traced) {
            out.line(nodeStatus(ctx, typeName, id, idx, "RUNNING"));
        }

        boolean expression = type.isExpression();
        boolean routed = expression && isWired(nodeId, ReservedNames.ON_FAILURE);
        boolean skippable =
                expression
                        && !execute.equals("true")
                        && type.getParameters().stream()
                                .noneMatch(p -> p.kind() == Parameter.Kind.EXECUTE);
        if (skippable) {
            out.open("if (" + execute + ")");
        }

        out.line("Object " + result + " = null;");
        if (routed) {
            out.line("boolean " + failed + " = false;");
        }
        out.open("try");
        out.line(call(instance, type, step, execute, closures, ctx, result));
        out.reopen("catch (RecursionDepthExceededException e)");
        out.line("throw e;");
        out.reopen("catch (Exception e)");
        if (traced) {
            out.line(ctx + ".nodeFailed(" + typeName + ", " + id + ", " + idx + ", e);");
        }
        if (routed) {
            out.line(failed + " = true;");
        } else {
            out.line("throw NodeExecutionException.propagate(" + id + ", e);");
        }
        out.close();

        String success;
        String failure;
        if (routed) {
            success = "!" + failed;
            failure = failed;
        } else if (expression) {
            success = "true";
            failure = "false";
        } else {
            success = "Ports.readFlag(" + result + ", \"" + ReservedNames.ON_SUCCESS + "\", true)";
            failure = "Ports.readFlag(" + result + ", \"" + ReservedNames.ON_FAILURE + "\", false)";
        }
        setOutput(ctx, nodeId, ReservedNames.ON_SUCCESS, idx, success);
        setOutput(ctx, nodeId, ReservedNames.ON_FAILURE, idx, failure);

        List<Port> data =
                type.getOutputs().stream().filter(p -> !p.isScoped() && !p.isStep()).toList();
        boolean single = expression && data.size() == 1;
        for (Port port : data) {
            String reader = single ? "Ports.readSingle(" : "Ports.read(";
            String value = reader + result + ", " + JavaLiterals.string(port.getName()) + ")";
            if (type.getVariant() == NodeVariant.COERCION) {
                // a parsed object may itself carry a "result" key
                value = result;
            }
            setOutput(ctx, nodeId, port.getName(), idx, value);
        }
        if (traced) {
            String succeeded = nodeStatus(ctx, typeName, id, idx, "SUCCEEDED");
            if (routed) {
                out.open("if (!" + failed + ")");
                out.line(succeeded);
                out.close();
            } else {
                out.line(succeeded);
            }
        }

        if (skippable) {
            out.reopen("else");
            setOutput(ctx, nodeId, ReservedNames.ON_SUCCESS, idx, "false");
            setOutput(ctx, nodeId, ReservedNames.ON_FAILURE, idx, "false");
            if (traced) {
                out.line(nodeStatus(ctx, typeName, id, idx, "CANCELLED"));
            }
            out.close();
        }
    }

    private static String nodeStatus(
            String ctx, String typeName, String id, String idx, String status) {
        return ctx
                + ".nodeStatus("
                + String.join(", ", typeName, id, idx, "NodeStatus." + status)
                + ");";
    }

    private String call(
            NodeInstance instance,
            NodeType type,
            NodeStep step,
            String execute,
            Map<String, String> closures,
            String ctx,
            String result) {
        if (type.getVariant() == NodeVariant.STUB) {
            return result
                    + " = NodeExecutionException.unimplemented("
                    + JavaLiterals.string(type.getName())
                    + ");";
        }
        if (type.getVariant() == NodeVariant.IMPORTED_WORKFLOW) {
            return result + " = " + await(step, workflowCall(instance, type, execute, ctx)) + ";";
        }

        List<String> args = new ArrayList<>();
        for (Parameter parameter : type.getParameters()) {
            switch (parameter.kind()) {
                case EXECUTE -> args.add(execute);
                case SCOPE -> args.add(closures.get(parameter.name()));
                case CONTEXT -> args.add(ctx + ".workflowContext()");
                case PORT -> {
                    Port port = type.findInput(parameter.name(), null).orElse(null);
                    String value = port != null ? inputValue(instance, port) : "null";
                    args.add(TypeConversions.convert(value, parameter.javaType()));
                }
            }
        }
        String invocation = target(type) + "(" + String.join(", ", args) + ")";
        if (type.returnsVoid() && !step.async()) {
            return invocation + ";";
        }
        return result + " = " + await(step, invocation) + ";";
    }

    private String workflowCall(NodeInstance instance, NodeType type, String execute, String ctx) {
        String workflow = ((ImplementationRef.SameFile) type.getImplementation()).workflowName();
        String function =
                unit.findWorkflow(workflow).map(WorkflowGraph::getFunctionName).orElse(workflow);
        List<String> pairs = new ArrayList<>();
        for (Port port : type.getInputs()) {
            if (port.isStep() || port.isScoped()) {
                continue;
            }
            pairs.add(JavaLiterals.string(port.getName()));
            pairs.add(inputValue(instance, port));
        }
        return function
                + "("
                + execute
                + ", Ports.mapOf("
                + String.join(", ", pairs)
                + "), "
                + ctx
                + ".workflowContext().descend("
                + JavaLiterals.string(workflow)
                + "))";
    }

    private static String await(NodeStep step, String invocation) {
        return step.async() ? "Async.await(" + invocation + ")" : invocation;
    }

    private String target(NodeType type) {
        ImplementationRef implementation = type.getImplementation();
        if (implementation instanceof ImplementationRef.Local local) {
            return local.className() + "." + local.methodName();
        }
        if (implementation instanceof ImplementationRef.External external) {
            return external.className() + "." + external.exportName();
        }
        throw new IllegalStateException(
                "Node type '" + type.getName() + "' has no callable implementation");
    }

    /// Value of an input port: its connections, else the instance expression, else the type's
    /// expression, else its default, else null.
    private String inputValue(NodeInstance instance, Port port) {
        List<PortRef> sources =
                incoming.getOrDefault(instance.id(), List.of()).stream()
                        .filter(c -> c.to().port().equals(port.getName()))
                        .filter(c -> scopeOf(c.to()) == null)
                        .map(Connection::from)
                        .toList();
        String fallback = null;
        String instanceExpression = instance.config().getPortExpressions().get(port.getName());
        if (instanceExpression != null) {
            fallback = instanceExpression;
        } else if (port.getExpression() != null) {
            fallback = port.getExpression();
        } else if (port.hasDefault()) {
            fallback = JavaLiterals.value(port.getDefaultValue());
        }

        if (sources.isEmpty()) {
            return fallback != null ? fallback : "null";
        }
        String value;
        if (port.getMergeStrategy() != null) {
            value =
                    sources.stream()
                            .map(this::readValue)
                            .collect(
                                    Collectors.joining(
                                            ", ",
                                            "Ports.merge(" + mergeName(port) + ", ",
                                            ")"));
        } else {
            value = firstValue(sources);
        }
        return fallback != null ? "Coercions.orDefault(" + value + ", " + fallback + ")" : value;
    }

    /// `execute` argument of an unguarded node: the STEP sources of `execute` that the guard
    /// does not cover, such as `Start.execute`.
    private String executeArgument(String nodeId, NodeType type, NodeStep step) {
        if (!step.guard().isEmpty()) {
            return "true";
        }
        List<String> sources =
                incoming.getOrDefault(nodeId, List.of()).stream()
                        .filter(c -> c.to().port().equals(ReservedNames.EXECUTE))
                        .filter(c -> scopeOf(c.to()) == null)
                        .map(Connection::from)
                        .filter(ref -> contextOf(ref) != null)
                        .map(this::readStep)
                        .toList();
        return sources.isEmpty() ? "true" : String.join(" || ", sources);
    }

    // ---------------- Scopes ----------------

    private String scopeClosure(String ownerId, NodeType type, String scope, String outerCtx) {
        String name =
                prefixes.get(ownerId)
                        + JavaLiterals.capitalize(JavaLiterals.identifier(scope))
                        + "Scope";
        ScopeLayer layer =
                plan.scope(ownerId, scope)
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No planned scope "
                                                        + ScopeLayer.keyOf(ownerId, scope)));
        scopeDepth++;
        int depth = scopeDepth;
        String ctx = ROOT_CONTEXT + depth;
        String start = "start" + depth;
        String args = "args" + depth;
        String idx = name + "Idx";

        out.open("ScopeFunction " + name + " = (" + start + ", " + args + ") ->");
        out.line(
                "ExecutionContext "
                        + ctx
                        + " = "
                        + outerCtx
                        + ".createScope("
                        + JavaLiterals.string(ownerId)
                        + ", "
                        + JavaLiterals.string(scope)
                        + ");");
        out.line(
                "int " + idx + " = " + ctx + ".addExecution(" + JavaLiterals.string(ownerId)
                        + ");");
        int position = 0;
        for (Port port : type.scopedPorts(scope, PortDirection.OUTPUT)) {
            String value;
            if (port.isStep()) {
                value = start;
            } else {
                value = args + ".length > " + position + " ? " + args + "[" + position + "] : null";
                position++;
            }
            if (plan.isMaterialized(ownerId, port.getName(), scope)) {
                out.line(setVariable(ctx, ownerId, port.getName() + ":" + scope, idx, value));
            }
        }

        layer(layer, ctx);

        out.blank();
        String success = "true";
        String failure = "false";
        List<String> values = new ArrayList<>();
        for (Port port : type.scopedPorts(scope, PortDirection.INPUT)) {
            List<PortRef> sources =
                    incoming.getOrDefault(ownerId, List.of()).stream()
                            .filter(c -> c.to().port().equals(port.getName()))
                            .filter(c -> scope.equals(scopeOf(c.to())))
                            .map(Connection::from)
                            .toList();
            if (port.getName().equals(ReservedNames.SCOPE_SUCCESS) && port.isStep()) {
                if (!sources.isEmpty()) {
                    success = anyStep(sources);
                }
            } else if (port.getName().equals(ReservedNames.SCOPE_FAILURE) && port.isStep()) {
                if (!sources.isEmpty()) {
                    failure = anyStep(sources);
                }
            } else if (!port.isStep()) {
                values.add(JavaLiterals.string(port.getName()));
                values.add(firstValue(sources));
            }
        }
        out.line(
                "return new ScopeResult("
                        + success
                        + ", "
                        + failure
                        + ", Ports.mapOf("
                        + String.join(", ", values)
                        + "));");
        out.close(";");

        contexts.remove(layer.key());
        scopeDepth--;
        return name;
    }

    // ---------------- Reads ----------------

    private String firstValue(List<PortRef> sources) {
        if (sources.isEmpty()) {
            return "null";
        }
        if (sources.size() == 1) {
            return readValue(sources.get(0));
        }
        return sources.stream()
                .map(this::readValue)
                .collect(Collectors.joining(", ", "Coercions.firstNonNull(", ")"));
    }

    private static String mergeName(Port port) {
        return JavaLiterals.string(port.getMergeStrategy().name());
    }

    private String anyStep(List<PortRef> sources) {
        return sources.stream().map(this::readStep).collect(Collectors.joining(" || "));
    }

    private String readValue(PortRef from) {
        String ctx = contextOf(from);
        if (ctx == null) {
            return "null";
        }
        return ctx + ".get(" + slotArguments(from) + ")";
    }

    private String readStep(PortRef from) {
        String ctx = contextOf(from);
        if (ctx == null) {
            return "false";
        }
        return ctx + ".isTrue(" + slotArguments(from) + ")";
    }

    /// Context variable holding a source's values, null when the source runs in a layer
    /// the current code cannot see.
    private String contextOf(PortRef from) {
        if (from.node().equals(ReservedNames.START)) {
            return ROOT_CONTEXT;
        }
        if (!instances.containsKey(from.node())) {
            return null;
        }
        String scope = scopeOf(from);
        if (scope != null) {
            return contexts.get(ScopeLayer.keyOf(from.node(), scope));
        }
        return contexts.get(plan.step(from.node()).layer());
    }

    private String slotArguments(PortRef ref) {
        String scope = scopeOf(ref);
        String slot = scope != null ? ref.port() + ":" + scope : ref.port();
        return JavaLiterals.string(ref.node()) + ", " + JavaLiterals.string(slot);
    }

    /// Scope of an endpoint, null unless the node's type declares it.
    private String scopeOf(PortRef ref) {
        if (!ref.isScoped() || !instances.containsKey(ref.node())) {
            return null;
        }
        return typeOf(ref.node()).getScopes().contains(ref.scope()) ? ref.scope() : null;
    }

    private boolean isWired(String nodeId, String port) {
        return graph.getConnections().stream()
                .map(Connection::from)
                .anyMatch(
                        from ->
                                from.node().equals(nodeId)
                                        && from.port().equals(port)
                                        && scopeOf(from) == null);
    }

    private NodeType typeOf(String nodeId) {
        return graph.typeOf(instances.get(nodeId))
                .orElseThrow(() -> new IllegalStateException("Unbound instance '" + nodeId + "'"));
    }

    // ---------------- Writes ----------------

    private void setOutput(String ctx, String nodeId, String port, String idx, String value) {
        if (plan.isMaterialized(nodeId, port, null)) {
            out.line(setVariable(ctx, nodeId, port, idx, value));
        }
    }

    private static String setVariable(
            String ctx, String node, String port, String idx, String value) {
        return ctx
                + ".setVariable("
                + JavaLiterals.string(node)
                + ", "
                + JavaLiterals.string(port)
                + ", "
                + idx
                + ", "
                + value
                + ");";
    }
}
