package io.weaver.core;

import io.weaver.core.model.Connection;
import io.weaver.core.model.DataType;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.Port;
import io.weaver.core.model.WorkflowGraph;

/// Hand-built graphs shared by the validator and planner tests.
public final class TestGraphs {

    private TestGraphs() {}

    /// A node type with `execute`, one data input `value` and one data output `result`.
    public static NodeType.Builder unary(String name, DataType in, DataType out) {
        return NodeType.builder(name)
                .functionName(name)
                .implementation(new ImplementationRef.Local("Flows", name))
                .input(Port.input("execute").dataType(DataType.STEP).build())
                .input(Port.input("value").dataType(in).build())
                .output(Port.output("onSuccess").dataType(DataType.STEP).controlFlow(true).build())
                .output(
                        Port.output("onFailure")
                                .dataType(DataType.STEP)
                                .controlFlow(true)
                                .failure(true)
                                .build())
                .output(Port.output("result").dataType(out).build());
    }

    /// A workflow shell with `Start.execute`, `Start.x` and the exits `onSuccess`, `onFailure`
    /// and `result`.
    public static WorkflowGraph.Builder workflow(String name) {
        return WorkflowGraph.builder()
                .name(name)
                .functionName(name)
                .sourceFile("Flows.java")
                .startPort(Port.output("execute").dataType(DataType.STEP).build())
                .startPort(Port.output("x").dataType(DataType.ANY).build())
                .exitPort(
                        Port.input("onSuccess")
                                .dataType(DataType.STEP)
                                .controlFlow(true)
                                .optional(true)
                                .build())
                .exitPort(
                        Port.input("onFailure")
                                .dataType(DataType.STEP)
                                .controlFlow(true)
                                .failure(true)
                                .optional(true)
                                .build())
                .exitPort(Port.input("result").dataType(DataType.ANY).build());
    }

    public static Connection edge(String from, String to) {
        String[] source = from.split("\\.");
        String[] target = to.split("\\.");
        return Connection.of(source[0], source[1], target[0], target[1]);
    }
}
