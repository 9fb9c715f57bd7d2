package io.weaver.core.builder;

import io.weaver.core.grammar.AnnotationBlock;
import io.weaver.core.grammar.PortDeclaration;
import io.weaver.core.grammar.TagDeclaration;
import io.weaver.core.model.Connection;
import io.weaver.core.model.DataType;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.InstanceParent;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.NodeVariant;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortDirection;
import io.weaver.core.model.PortRef;
import io.weaver.core.model.Position;
import io.weaver.core.model.ReservedNames;
import io.weaver.core.model.Scope;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.model.WorkflowOptions;
import io.weaver.core.parser.AnnotatedFunction;
import io.weaver.core.parser.JavaTypes;
import io.weaver.core.parser.MethodParameter;
import io.weaver.core.parser.ParsedSource;
import io.weaver.core.parser.RecordShape;
import io.weaver.core.validation.DiagnosticCode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Builds a {@link WorkflowGraph} from a method tagged `@flowWeaver workflow`.
///
/// ### Boundary
/// Start ports are `execute` followed by the method's parameters and `@param` tags. Exit ports
/// are `onSuccess`, `onFailure` followed by the components of the returned record and the
/// `@returns` tags.
///
/// ### Edges
/// `@connect` adds one edge. `@path` chains control edges and wires same-named data ports of
/// consecutive hops when the target port is still unconnected. `@fanOut` and `@fanIn` expand
/// to one edge per listed endpoint. `@autoConnect` chains all top-level instances in
/// declaration order when the workflow declares no edges at all. `@map` and `@coerce` expand
/// through {@link MacroExpander}.
///
/// Instance types are bound through the {@link TypeTable}; unknown names stay on the instance
/// for the validator to report.
final class WorkflowGraphBuilder {

    /// Start and exit ports of a workflow.
    record Boundary(List<Port> startPorts, List<Port> exitPorts) {}

    Boundary boundary(AnnotatedFunction function, ParsedSource source, BuildDiagnostics diagnostics) {
        Map<String, Port.Builder> start = new LinkedHashMap<>();
        start.put(ReservedNames.EXECUTE, ReservedPorts.startExecute());
        List<MethodParameter> parameters = function.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            MethodParameter parameter = parameters.get(i);
            boolean leadingExecute =
                    i == 0
                            && parameter.name().equals(ReservedNames.EXECUTE)
                            && JavaTypes.infer(parameter.type()) == DataType.BOOLEAN;
            if (leadingExecute || JavaTypes.isWorkflowContext(parameter.type())) {
                continue;
            }
            start.put(
                    parameter.name(),
                    Port.output(parameter.name())
                            .dataType(JavaTypes.infer(parameter.type()))
                            .javaType(parameter.type()));
        }

        Map<String, Port.Builder> exit = new LinkedHashMap<>();
        exit.put(ReservedNames.ON_SUCCESS, ReservedPorts.exitOnSuccess());
        exit.put(ReservedNames.ON_FAILURE, ReservedPorts.exitOnFailure());
        String valueType =
                function.isAsync() ? JavaTypes.unwrapAsync(function.returnType()) : function.returnType();
        Optional<RecordShape> record = source.record(valueType);
        record.ifPresent(
                shape ->
                        shape.components().stream()
                                .filter(c -> !ReservedNames.isControlSignal(c.name()))
                                .forEach(
                                        c ->
                                                exit.put(
                                                        c.name(),
                                                        Port.input(c.name())
                                                                .dataType(JavaTypes.infer(c.type()))
                                                                .javaType(c.type()))));

        for (AnnotationBlock.Entry entry : function.annotations().entries()) {
            if (!(entry.declaration() instanceof TagDeclaration.PortTag tag)) {
                continue;
            }
            PortDeclaration port = tag.port();
            if (tag.tag().equals("param")) {
                if (ReservedNames.EXECUTE.equals(port.name())) {
                    PortDeclarations.applyDocumentation(start.get(ReservedNames.EXECUTE), port);
                    continue;
                }
                Port.Builder existing = start.computeIfAbsent(port.name(), Port::output);
                PortDeclarations.apply(existing, port, diagnostics, entry.line());
            } else if (tag.tag().equals("returns")) {
                if (ReservedNames.isControlSignal(port.name())) {
                    PortDeclarations.applyDocumentation(exit.get(port.name()), port);
                    continue;
                }
                Port.Builder existing = exit.computeIfAbsent(port.name(), Port::input);
                PortDeclarations.apply(existing, port, diagnostics, entry.line());
            }
        }

        return new Boundary(
                start.values().stream().map(Port.Builder::build).toList(),
                exit.values().stream().map(Port.Builder::build).toList());
    }

    /// The interface other workflows of the unit see when they place this one as a node.
    NodeType asNodeType(String name, AnnotatedFunction function, Boundary boundary) {
        NodeType.Builder type =
                NodeType.builder(name)
                        .functionName(function.name())
                        .description(function.annotations().summary())
                        .implementation(new ImplementationRef.SameFile(name))
                        .variant(NodeVariant.IMPORTED_WORKFLOW)
                        .async(function.isAsync());
        function.annotations()
                .last(TagDeclaration.LabelTag.class)
                .ifPresent(t -> type.label(t.label()));
        boundary.startPorts().forEach(p -> type.input(PortDeclarations.redirect(p, PortDirection.INPUT)));
        boundary.exitPorts().forEach(p -> type.output(PortDeclarations.redirect(p, PortDirection.OUTPUT)));
        return type.build();
    }

    WorkflowGraph build(
            String name,
            AnnotatedFunction function,
            ParsedSource source,
            Boundary boundary,
            TypeTable types,
            BuildDiagnostics diagnostics) {
        AnnotationBlock block = function.annotations();
        block.all(TagDeclaration.ImportTag.class).forEach(types::addImport);

        WorkflowGraph.Builder graph =
                WorkflowGraph.builder()
                        .name(name)
                        .functionName(function.name())
                        .description(
                                block.last(TagDeclaration.DescriptionTag.class)
                                        .map(TagDeclaration.DescriptionTag::text)
                                        .orElse(block.summary()))
                        .sourceFile(source.fileName())
                        .startPorts(boundary.startPorts())
                        .exitPorts(boundary.exitPorts())
                        .declaredAsync(function.isAsync())
                        .options(options(block));

        // instances
        Map<String, NodeInstance> instances = new LinkedHashMap<>();
        List<NodeInstance> ordered = new ArrayList<>();
        Map<String, NodeType> bound = new LinkedHashMap<>(types.nodeTypes());
        for (AnnotationBlock.Entry entry : block.entries()) {
            if (!(entry.declaration() instanceof TagDeclaration.NodeTag tag)) {
                continue;
            }
            NodeInstance instance = new NodeInstance(tag.id(), tag.type(), tag.parent(), tag.config());
            ordered.add(instance);
            instances.putIfAbsent(tag.id(), instance);
            types.resolve(tag.type(), diagnostics, entry.line())
                    .ifPresent(type -> bound.putIfAbsent(type.getName(), type));
        }

        // @map and @coerce
        MacroExpander macros = new MacroExpander(instances, ordered, bound, diagnostics);
        for (AnnotationBlock.Entry entry : block.entries()) {
            if (entry.declaration() instanceof TagDeclaration.MapTag tag) {
                macros.map(tag, entry.line());
            } else if (entry.declaration() instanceof TagDeclaration.CoerceTag tag) {
                macros.coerce(tag, entry.line());
            }
        }

        // scopes
        Map<String, Scope> scopes = new LinkedHashMap<>();
        for (NodeInstance instance : ordered) {
            NodeType type = bound.get(instance.nodeType());
            if (type != null) {
                for (String scope : type.getScopes()) {
                    scopes.putIfAbsent(
                            instance.id() + "." + scope, new Scope(instance.id(), scope, List.of()));
                }
            }
        }
        for (NodeInstance instance : ordered) {
            if (instance.parent() != null) {
                addChild(scopes, instance.parent(), instance.id());
            }
        }
        for (AnnotationBlock.Entry entry : block.entries()) {
            if (!(entry.declaration() instanceof TagDeclaration.ScopeTag tag)) {
                continue;
            }
            String owner = tag.owner() != null ? tag.owner() : ownerOf(tag.name(), ordered, bound);
            if (owner == null) {
                diagnostics.warning(
                        DiagnosticCode.PARSE_WARNING,
                        "Scope '" + tag.name() + "' has no owner: no instance's type declares it",
                        entry.line());
                continue;
            }
            InstanceParent parent = new InstanceParent(owner, tag.name());
            scopes.putIfAbsent(parent.toString(), new Scope(owner, tag.name(), List.of()));
            for (String child : tag.children()) {
                NodeInstance instance = instances.get(child);
                if (instance != null && instance.parent() == null) {
                    NodeInstance nested = instance.withParent(parent);
                    instances.put(child, nested);
                    ordered.replaceAll(i -> i.id().equals(child) && i.parent() == null ? nested : i);
                }
                addChild(scopes, parent, child);
            }
        }

        // positions
        Map<String, Position> positions = new LinkedHashMap<>();
        for (AnnotationBlock.Entry entry : block.entries()) {
            if (!(entry.declaration() instanceof TagDeclaration.PositionTag tag)) {
                continue;
            }
            Position position = new Position(tag.x(), tag.y());
            if (ReservedNames.isReservedNode(tag.node())) {
                positions.put(tag.node(), position);
                continue;
            }
            diagnostics.warning(
                    DiagnosticCode.DEPRECATED_POSITION,
                    "@position for instance '"
                            + tag.node()
                            + "' is deprecated; use [position: x y] on its @node line",
                    entry.line());
            ordered.replaceAll(
                    i ->
                            i.id().equals(tag.node())
                                    ? i.withConfig(i.config().toBuilder().position(position).build())
                                    : i);
        }

        // connections
        Endpoints endpoints = new Endpoints(boundary, ordered, bound);
        List<Connection> connections = new ArrayList<>();
        List<Hop> hops = new ArrayList<>();
        for (AnnotationBlock.Entry entry : block.entries()) {
            TagDeclaration declaration = entry.declaration();
            if (declaration instanceof TagDeclaration.ConnectTag tag) {
                connections.add(new Connection(tag.from(), tag.to()));
            } else if (declaration instanceof TagDeclaration.PathTag tag) {
                expandPath(tag.steps(), connections, hops);
            } else if (declaration instanceof TagDeclaration.FanOutTag tag) {
                for (TagDeclaration.Endpoint target : tag.targets()) {
                    addUnique(
                            connections,
                            new Connection(
                                    portRef(tag.source()),
                                    new PortRef(
                                            target.node(),
                                            target.port() != null ? target.port() : tag.source().port(),
                                            target.scope())));
                }
            } else if (declaration instanceof TagDeclaration.FanInTag tag) {
                for (TagDeclaration.Endpoint from : tag.sources()) {
                    addUnique(
                            connections,
                            new Connection(
                                    new PortRef(
                                            from.node(),
                                            from.port() != null ? from.port() : tag.target().port(),
                                            from.scope()),
                                    portRef(tag.target())));
                }
            }
        }

        if (connections.isEmpty() && block.has(TagDeclaration.AutoConnectTag.class)) {
            List<TagDeclaration.PathStep> chain = new ArrayList<>();
            chain.add(new TagDeclaration.PathStep(ReservedNames.START, null));
            ordered.stream()
                    .filter(i -> i.parent() == null)
                    .forEach(i -> chain.add(new TagDeclaration.PathStep(i.id(), null)));
            chain.add(new TagDeclaration.PathStep(ReservedNames.EXIT, null));
            expandPath(chain, connections, hops);
        }

        macros.connections().forEach(c -> addUnique(connections, c));
        for (Hop hop : hops) {
            wireDataPorts(hop.from(), hop.to(), endpoints, connections);
        }

        return graph.nodeTypes(bound)
                .instances(ordered)
                .scopes(new ArrayList<>(scopes.values()))
                .connections(connections)
                .positions(positions)
                .build();
    }

    private static WorkflowOptions options(AnnotationBlock block) {
        WorkflowOptions options = WorkflowOptions.DEFAULTS;
        Optional<TagDeclaration.StrictTypesTag> strict = block.last(TagDeclaration.StrictTypesTag.class);
        if (strict.isPresent()) {
            options = options.withStrictTypes(strict.get().enabled());
        }
        if (block.has(TagDeclaration.AutoConnectTag.class)) {
            options = options.withAutoConnect(true);
        }
        Optional<TagDeclaration.TriggerTag> trigger = block.last(TagDeclaration.TriggerTag.class);
        if (trigger.isPresent()) {
            options =
                    options.withTrigger(
                            new WorkflowOptions.Trigger(trigger.get().event(), trigger.get().cron()));
        }
        Optional<TagDeclaration.CancelOnTag> cancel = block.last(TagDeclaration.CancelOnTag.class);
        if (cancel.isPresent()) {
            options =
                    options.withCancelOn(
                            new WorkflowOptions.CancelOn(
                                    cancel.get().event(), cancel.get().match(), cancel.get().timeout()));
        }
        Optional<TagDeclaration.RetriesTag> retries = block.last(TagDeclaration.RetriesTag.class);
        if (retries.isPresent()) {
            options = options.withRetries(retries.get().retries());
        }
        Optional<TagDeclaration.TimeoutTag> timeout = block.last(TagDeclaration.TimeoutTag.class);
        if (timeout.isPresent()) {
            options = options.withTimeout(timeout.get().timeout());
        }
        Optional<TagDeclaration.ThrottleTag> throttle = block.last(TagDeclaration.ThrottleTag.class);
        if (throttle.isPresent()) {
            options =
                    options.withThrottle(
                            new WorkflowOptions.Throttle(throttle.get().limit(), throttle.get().period()));
        }
        return options;
    }

    /// Expands a path into control edges and records its hops for data wiring.
    private static void expandPath(
            List<TagDeclaration.PathStep> steps,
            List<Connection> connections,
            List<Hop> hops) {
        for (int i = 0; i + 1 < steps.size(); i++) {
            TagDeclaration.PathStep from = steps.get(i);
            TagDeclaration.PathStep to = steps.get(i + 1);
            boolean failing = "fail".equals(from.route());

            String fromPort;
            if (from.node().equals(ReservedNames.START)) {
                fromPort = ReservedNames.EXECUTE;
            } else {
                fromPort = failing ? ReservedNames.ON_FAILURE : ReservedNames.ON_SUCCESS;
            }
            String toPort;
            if (to.node().equals(ReservedNames.EXIT)) {
                toPort = failing ? ReservedNames.ON_FAILURE : ReservedNames.ON_SUCCESS;
            } else {
                toPort = ReservedNames.EXECUTE;
            }
            addUnique(connections, Connection.of(from.node(), fromPort, to.node(), toPort));
            hops.add(new Hop(from.node(), to.node()));
        }
    }

    private static void wireDataPorts(
            String from, String to, Endpoints endpoints, List<Connection> connections) {
        for (Port output : endpoints.outputs(from)) {
            if (output.isStep() || output.isScoped()) {
                continue;
            }
            boolean matches =
                    endpoints.inputs(to).stream()
                            .anyMatch(
                                    input ->
                                            !input.isStep()
                                                    && !input.isScoped()
                                                    && input.getName().equals(output.getName()));
            boolean connected =
                    connections.stream()
                            .anyMatch(
                                    c ->
                                            c.to().node().equals(to)
                                                    && c.to().port().equals(output.getName())
                                                    && !c.to().isScoped());
            if (matches && !connected) {
                connections.add(Connection.of(from, output.getName(), to, output.getName()));
            }
        }
    }

    private static void addUnique(List<Connection> connections, Connection connection) {
        if (!connections.contains(connection)) {
            connections.add(connection);
        }
    }

    private static void addChild(Map<String, Scope> scopes, InstanceParent parent, String child) {
        Scope existing = scopes.get(parent.toString());
        List<String> children = new ArrayList<>(existing != null ? existing.children() : List.of());
        if (!children.contains(child)) {
            children.add(child);
        }
        scopes.put(parent.toString(), new Scope(parent.ownerId(), parent.scopeName(), children));
    }

    private static PortRef portRef(TagDeclaration.Endpoint endpoint) {
        return new PortRef(endpoint.node(), endpoint.port(), endpoint.scope());
    }

    private static String ownerOf(
            String scope, List<NodeInstance> instances, Map<String, NodeType> types) {
        for (NodeInstance instance : instances) {
            NodeType type = types.get(instance.nodeType());
            if (type != null && type.getScopes().contains(scope)) {
                return instance.id();
            }
        }
        return null;
    }

    private record Hop(String from, String to) {}

    /// Port lists of instances and the two pseudo nodes, for path data wiring.
    private record Endpoints(
            Boundary boundary, List<NodeInstance> instances, Map<String, NodeType> types) {

        List<Port> outputs(String node) {
            if (node.equals(ReservedNames.START)) {
                return boundary.startPorts();
            }
            return type(node).map(NodeType::getOutputs).orElse(List.of());
        }

        List<Port> inputs(String node) {
            if (node.equals(ReservedNames.EXIT)) {
                return boundary.exitPorts();
            }
            return type(node).map(NodeType::getInputs).orElse(List.of());
        }

        private Optional<NodeType> type(String node) {
            return instances.stream()
                    .filter(i -> i.id().equals(node))
                    .findFirst()
                    .map(i -> types.get(i.nodeType()));
        }
    }
}
