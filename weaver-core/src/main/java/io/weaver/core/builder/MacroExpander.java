package io.weaver.core.builder;

import io.weaver.core.grammar.TagDeclaration;
import io.weaver.core.model.BranchingStrategy;
import io.weaver.core.model.Connection;
import io.weaver.core.model.DataType;
import io.weaver.core.model.ExecuteWhen;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.InstanceParent;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.NodeVariant;
import io.weaver.core.model.Parameter;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortRef;
import io.weaver.core.model.ReservedNames;
import io.weaver.core.util.Suggestions;
import io.weaver.core.validation.DiagnosticCode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Expands `@map` and `@coerce` lines of one workflow into instances, node types and edges.
///
/// ### `@map loop child over source.port`
/// Places `loop`, an instance of the synthetic type `__map_loop__` that owns the scope
/// `iterate`, and moves the already declared `child` into that scope. The scope hands each
/// element of `items` to the child's first data input and collects its first data output
/// into `results`; a parenthesized `(in -> out)` picks other ports. Edges:
///
/// | From                   | To                         |
/// |------------------------|----------------------------|
/// | `source.port`          | `loop.items`               |
/// | `loop.start:iterate`   | `child.execute`            |
/// | `loop.item:iterate`    | `child.in`                 |
/// | `child.out`            | `loop.processed:iterate`   |
/// | `child.onSuccess`      | `loop.success:iterate`     |
/// | `child.onFailure`      | `loop.failure:iterate`     |
///
/// ### `@coerce id source.port -> target.port as type`
/// Places `id`, an expression node converting `value` to `result`, between the two ports.
/// One node type per target type is added to the graph, shared by all coercions to it.
///
/// Malformed lines are reported as errors and leave the graph untouched.
final class MacroExpander {

    static final String MAP_SCOPE = "iterate";

    /// Target type of a coercion and the runtime method implementing it.
    private record Coercion(
            String typeName, String className, String method, DataType dataType, String javaType) {}

    private static final Map<String, Coercion> COERCIONS = coercions();

    private final Map<String, NodeInstance> instances;
    private final List<NodeInstance> ordered;
    private final Map<String, NodeType> bound;
    private final BuildDiagnostics diagnostics;
    private final List<Connection> connections = new ArrayList<>();

    /// @param instances instances by id, updated in place
    /// @param ordered instances in declaration order, updated in place
    /// @param bound node types by name, updated in place
    MacroExpander(
            Map<String, NodeInstance> instances,
            List<NodeInstance> ordered,
            Map<String, NodeType> bound,
            BuildDiagnostics diagnostics) {
        this.instances = instances;
        this.ordered = ordered;
        this.bound = bound;
        this.diagnostics = diagnostics;
    }

    /// Edges added by the expanded lines, in line order.
    List<Connection> connections() {
        return connections;
    }

    void map(TagDeclaration.MapTag tag, int line) {
        String id = tag.id();
        String prefix = "@map \"" + id + "\": ";
        if (instances.containsKey(id)) {
            diagnostics.error(
                    DiagnosticCode.INVALID_MAP,
                    prefix + "instance ID \"" + id + "\" already exists",
                    line);
            return;
        }
        NodeInstance child = instances.get(tag.child());
        if (child == null) {
            diagnostics.error(
                    DiagnosticCode.INVALID_MAP,
                    prefix
                            + "child node \""
                            + tag.child()
                            + "\" not found. Declare it with @node before using @map."
                            + Suggestions.hint(tag.child(), instances.keySet()),
                    line);
            return;
        }
        NodeType childType = bound.get(child.nodeType());
        if (childType == null) {
            diagnostics.error(
                    DiagnosticCode.INVALID_MAP,
                    prefix
                            + "node type \""
                            + child.nodeType()
                            + "\" for child \""
                            + child.id()
                            + "\" not found.",
                    line);
            return;
        }

        Optional<Port> input =
                tag.inputPort() != null
                        ? childType.findInput(tag.inputPort(), null)
                        : childType.getInputs().stream().filter(MacroExpander::isData).findFirst();
        if (input.isEmpty()) {
            diagnostics.error(
                    DiagnosticCode.INVALID_MAP,
                    prefix + missing(child.id(), tag.inputPort(), "data input ports to receive items"),
                    line);
            return;
        }
        Optional<Port> output =
                tag.outputPort() != null
                        ? childType.findOutput(tag.outputPort(), null)
                        : childType.getOutputs().stream()
                                .filter(p -> isData(p) && !p.isControlFlow() && !p.isFailure())
                                .findFirst();
        if (output.isEmpty()) {
            diagnostics.error(
                    DiagnosticCode.INVALID_MAP,
                    prefix + missing(child.id(), tag.outputPort(), "data output ports for results"),
                    line);
            return;
        }

        NodeType type = iterationType("__map_" + id + "__", input.get(), output.get());
        bound.put(type.getName(), type);
        NodeInstance owner = NodeInstance.of(id, type.getName());
        instances.put(id, owner);
        ordered.add(owner);

        NodeInstance nested = child.withParent(new InstanceParent(id, MAP_SCOPE));
        instances.put(child.id(), nested);
        ordered.replaceAll(i -> i.id().equals(child.id()) ? nested : i);

        String childId = child.id();
        String in = input.get().getName();
        String out = output.get().getName();
        connections.add(new Connection(tag.source(), PortRef.of(id, "items")));
        connections.add(
                new Connection(
                        new PortRef(id, ReservedNames.SCOPE_START, MAP_SCOPE),
                        PortRef.of(childId, ReservedNames.EXECUTE)));
        connections.add(
                new Connection(new PortRef(id, "item", MAP_SCOPE), PortRef.of(childId, in)));
        connections.add(
                new Connection(PortRef.of(childId, out), new PortRef(id, "processed", MAP_SCOPE)));
        connections.add(
                new Connection(
                        PortRef.of(childId, ReservedNames.ON_SUCCESS),
                        new PortRef(id, ReservedNames.SCOPE_SUCCESS, MAP_SCOPE)));
        connections.add(
                new Connection(
                        PortRef.of(childId, ReservedNames.ON_FAILURE),
                        new PortRef(id, ReservedNames.SCOPE_FAILURE, MAP_SCOPE)));
    }

    void coerce(TagDeclaration.CoerceTag tag, int line) {
        String id = tag.id();
        if (instances.containsKey(id)) {
            diagnostics.error(
                    DiagnosticCode.INVALID_COERCE,
                    "@coerce: instance ID \"" + id + "\" already exists",
                    line);
            return;
        }
        String source = tag.from().node();
        if (!source.equals(ReservedNames.START) && !instances.containsKey(source)) {
            diagnostics.error(
                    DiagnosticCode.INVALID_COERCE,
                    "@coerce: source node \"" + source + "\" does not exist",
                    line);
            return;
        }
        String target = tag.to().node();
        if (!target.equals(ReservedNames.EXIT) && !instances.containsKey(target)) {
            diagnostics.error(
                    DiagnosticCode.INVALID_COERCE,
                    "@coerce: target node \"" + target + "\" does not exist",
                    line);
            return;
        }
        Coercion coercion = COERCIONS.get(tag.targetType());
        if (coercion == null) {
            diagnostics.error(
                    DiagnosticCode.INVALID_COERCE,
                    "@coerce: unknown target type \""
                            + tag.targetType()
                            + "\"."
                            + Suggestions.hint(tag.targetType(), COERCIONS.keySet())
                            + " Valid types: "
                            + String.join(", ", COERCIONS.keySet())
                            + ".",
                    line);
            return;
        }

        bound.computeIfAbsent(coercion.typeName(), name -> coercionType(coercion));
        NodeInstance instance = NodeInstance.of(id, coercion.typeName());
        instances.put(id, instance);
        ordered.add(instance);
        connections.add(new Connection(tag.from(), PortRef.of(id, "value")));
        connections.add(new Connection(PortRef.of(id, "result"), tag.to()));
    }

    /// Synthetic type of a `@map` owner; the scoped `item` and `processed` ports take their
    /// types from the child ports they feed and read.
    static NodeType iterationType(String name, Port childInput, Port childOutput) {
        return NodeType.builder(name)
                .functionName("map")
                .label("Map")
                .implementation(new ImplementationRef.External("Iteration", "map"))
                .variant(NodeVariant.MAP_ITERATOR)
                .returnType("Map<String, Object>")
                .executeWhen(ExecuteWhen.CONJUNCTION)
                .parameters(
                        List.of(
                                new Parameter(
                                        ReservedNames.EXECUTE, "boolean", Parameter.Kind.EXECUTE),
                                new Parameter("items", "List<Object>", Parameter.Kind.PORT),
                                new Parameter(MAP_SCOPE, "ScopeFunction", Parameter.Kind.SCOPE)))
                .input(ReservedPorts.execute().build())
                .input(
                        Port.input("items")
                                .dataType(DataType.ARRAY)
                                .javaType("List<Object>")
                                .label("Items")
                                .build())
                .output(ReservedPorts.onSuccess().build())
                .output(ReservedPorts.onFailure().build())
                .output(Port.output("results").dataType(DataType.ARRAY).label("Results").build())
                .scope(MAP_SCOPE)
                .input(ReservedPorts.scopeSuccess(MAP_SCOPE).build())
                .input(ReservedPorts.scopeFailure(MAP_SCOPE).build())
                .input(
                        Port.input("processed")
                                .dataType(childOutput.getDataType())
                                .javaType(childOutput.getJavaType())
                                .scope(MAP_SCOPE)
                                .build())
                .output(ReservedPorts.scopeStart(MAP_SCOPE).build())
                .output(
                        Port.output("item")
                                .dataType(childInput.getDataType())
                                .javaType(childInput.getJavaType())
                                .scope(MAP_SCOPE)
                                .build())
                .build();
    }

    private static NodeType coercionType(Coercion coercion) {
        return NodeType.builder(coercion.typeName())
                .functionName(coercion.method())
                .implementation(
                        new ImplementationRef.External(coercion.className(), coercion.method()))
                .variant(NodeVariant.COERCION)
                .returnType(coercion.javaType())
                .branchingStrategy(BranchingStrategy.EXCEPTION_BASED)
                .parameters(List.of(new Parameter("value", "Object", Parameter.Kind.PORT)))
                .input(ReservedPorts.execute().build())
                .input(Port.input("value").dataType(DataType.ANY).javaType("Object").build())
                .output(ReservedPorts.onSuccess().build())
                .output(ReservedPorts.onFailure().build())
                .output(
                        Port.output("result")
                                .dataType(coercion.dataType())
                                .javaType(coercion.javaType())
                                .build())
                .build();
    }

    private static boolean isData(Port port) {
        return !port.isStep() && !port.isScoped();
    }

    private static String missing(String child, String port, String what) {
        if (port != null) {
            return "child node \"" + child + "\" has no port \"" + port + "\".";
        }
        return "child node \"" + child + "\" has no " + what + ".";
    }

    private static Map<String, Coercion> coercions() {
        Map<String, Coercion> coercions = new LinkedHashMap<>();
        coercions.put(
                "string",
                new Coercion(
                        "__fw_toString", "Coercions", "toStringValue", DataType.STRING, "String"));
        coercions.put(
                "number",
                new Coercion("__fw_toNumber", "Coercions", "toDouble", DataType.NUMBER, "double"));
        coercions.put(
                "boolean",
                new Coercion(
                        "__fw_toBoolean", "Coercions", "toBoolean", DataType.BOOLEAN, "boolean"));
        coercions.put(
                "json",
                new Coercion("__fw_toJSON", "JsonValues", "stringify", DataType.STRING, "String"));
        coercions.put(
                "object",
                new Coercion("__fw_parseJSON", "JsonValues", "parse", DataType.OBJECT, "Object"));
        return Collections.unmodifiableMap(coercions);
    }
}
