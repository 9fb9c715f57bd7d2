package io.weaver.core.plan;

import static io.weaver.core.TestGraphs.edge;
import static io.weaver.core.TestGraphs.unary;
import static io.weaver.core.TestGraphs.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weaver.core.builder.SourceUnit;
import io.weaver.core.model.DataType;
import io.weaver.core.model.ExecuteWhen;
import io.weaver.core.model.ImplementationRef;
import io.weaver.core.model.InstanceConfig;
import io.weaver.core.model.InstanceParent;
import io.weaver.core.model.NodeInstance;
import io.weaver.core.model.NodeType;
import io.weaver.core.model.NodeVariant;
import io.weaver.core.model.Port;
import io.weaver.core.model.PortRef;
import io.weaver.core.model.WorkflowGraph;
import io.weaver.core.validation.Diagnostic;
import io.weaver.core.validation.DiagnosticCode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutionPlannerTest {

    private final ExecutionPlanner planner = new ExecutionPlanner();

    private static final NodeType STEP = unary("Step", DataType.ANY, DataType.NUMBER).build();

    private static WorkflowGraph.Builder steps(String... ids) {
        WorkflowGraph.Builder graph = workflow("flow").nodeType(STEP);
        for (String id : ids) {
            graph.instance(NodeInstance.of(id, "Step"));
        }
        return graph;
    }

    @Nested
    class Ordering {

        @Test
        void shouldKeepDeclarationOrderForIndependentNodes() throws Exception {
            ExecutionPlan plan = planner.plan(steps("c", "a", "b").build());

            assertThat(plan.root().order()).containsExactly("c", "a", "b");
        }

        @Test
        void shouldRunSourcesBeforeTargets() throws Exception {
            WorkflowGraph graph =
                    steps("b", "a", "c")
                            .connection(edge("Start.execute", "a.execute"))
                            .connection(edge("a.onSuccess", "b.execute"))
                            .connection(edge("b.result", "c.value"))
                            .build();

            ExecutionPlan plan = planner.plan(graph);

            assertThat(plan.root().order()).containsExactly("a", "b", "c");
        }

        @Test
        void shouldNameNodesOfCycle() {
            WorkflowGraph graph =
                    steps("a", "b", "c")
                            .connection(edge("a.onSuccess", "b.execute"))
                            .connection(edge("b.onSuccess", "a.execute"))
                            .build();

            assertThatThrownBy(() -> planner.plan(graph))
                    .isInstanceOf(PlanCreationException.class)
                    .hasMessage(
                            "Circular dependency detected in workflow 'flow'."
                                    + " Nodes in cycle: a, b");
        }

        @Test
        void shouldOrderScopeFeederBeforeOwner() throws Exception {
            NodeType forEach =
                    NodeType.builder("ForEach")
                            .input(Port.input("execute").dataType(DataType.STEP).build())
                            .output(
                                    Port.output("start")
                                            .dataType(DataType.STEP)
                                            .scope("each")
                                            .build())
                            .input(
                                    Port.input("success")
                                            .dataType(DataType.STEP)
                                            .scope("each")
                                            .build())
                            .scope("each")
                            .build();
            WorkflowGraph graph =
                    steps()
                            .nodeType(forEach)
                            .instance(NodeInstance.of("loop", "ForEach"))
                            .instance(
                                    NodeInstance.of("body", "Step")
                                            .withParent(new InstanceParent("loop", "each")))
                            .instance(NodeInstance.of("prep", "Step"))
                            .connection(edge("prep.result", "body.value"))
                            .build();

            ExecutionPlan plan = planner.plan(graph);

            assertThat(plan.root().order()).containsExactly("prep", "loop");
            assertThat(plan.scope("loop", "each").orElseThrow().order()).containsExactly("body");
            assertThat(plan.step("body").layer()).isEqualTo("loop.each");
        }
    }

    @Nested
    class Guards {

        @Test
        void shouldLeaveStartTriggeredNodeUnguarded() throws Exception {
            ExecutionPlan plan =
                    planner.plan(steps("a").connection(edge("Start.execute", "a.execute")).build());

            assertThat(plan.step("a").guard()).isEqualTo(StepGuard.NONE);
            assertThat(plan.step("a").isGuarded()).isFalse();
        }

        @Test
        void shouldJoinSeveralStepSourcesUnderConjunction() throws Exception {
            WorkflowGraph graph =
                    steps("x", "y", "a")
                            .connection(edge("x.onSuccess", "a.execute"))
                            .connection(edge("y.onSuccess", "a.execute"))
                            .build();

            StepGuard guard = planner.plan(graph).step("a").guard();

            assertThat(guard.when()).isEqualTo(ExecuteWhen.CONJUNCTION);
            assertThat(guard.sources())
                    .containsExactly(
                            Map.entry(
                                    "execute",
                                    List.of(
                                            PortRef.of("x", "onSuccess"),
                                            PortRef.of("y", "onSuccess"))));
            assertThat(guard.needsJoin()).isTrue();
        }

        @Test
        void shouldNotJoinUnderDisjunction() throws Exception {
            NodeType either =
                    unary("Either", DataType.ANY, DataType.ANY)
                            .executeWhen(ExecuteWhen.DISJUNCTION)
                            .build();
            WorkflowGraph graph =
                    steps("x", "y")
                            .nodeType(either)
                            .instance(NodeInstance.of("a", "Either"))
                            .connection(edge("x.onSuccess", "a.execute"))
                            .connection(edge("y.onFailure", "a.execute"))
                            .build();

            StepGuard guard = planner.plan(graph).step("a").guard();

            assertThat(guard.sourceCount()).isEqualTo(2);
            assertThat(guard.needsJoin()).isFalse();
        }

        @Test
        void shouldGuardDataConsumerOfGuardedNode() throws Exception {
            WorkflowGraph graph =
                    steps("x", "a", "b")
                            .connection(edge("x.onSuccess", "a.execute"))
                            .connection(edge("a.result", "b.value"))
                            .build();

            ExecutionPlan plan = planner.plan(graph);

            assertThat(plan.step("b").guard().isEmpty()).isTrue();
            assertThat(plan.step("b").dataGuard()).containsExactly("a");
        }

        @Test
        void shouldMaterializeOnlyConnectedOutputs() throws Exception {
            WorkflowGraph graph =
                    steps("a", "b")
                            .connection(edge("Start.x", "a.value"))
                            .connection(edge("a.result", "b.value"))
                            .build();

            ExecutionPlan plan = planner.plan(graph);

            assertThat(plan.isMaterialized("Start", "x", null)).isTrue();
            assertThat(plan.isMaterialized("a", "result", null)).isTrue();
            assertThat(plan.isMaterialized("b", "result", null)).isFalse();
        }
    }

    @Test
    void shouldScheduleNothingForPullNode() throws Exception {
        WorkflowGraph graph =
                steps("a")
                        .instance(
                                NodeInstance.of("lazy", "Step")
                                        .withConfig(
                                                InstanceConfig.builder()
                                                        .pullExecution("execute")
                                                        .build()))
                        .build();

        ExecutionPlan plan = planner.plan(graph);

        assertThat(plan.step("lazy").pull()).isTrue();
        assertThat(plan.root().order()).containsExactly("a");
        assertThat(plan.root().pullNodes()).containsExactly("lazy");
    }

    @Nested
    class Synchronicity {

        private final NodeType fetch =
                unary("Fetch", DataType.ANY, DataType.ANY).async(true).build();

        @Test
        void shouldWarnWhenSyncWorkflowNeedsAsync() throws Exception {
            WorkflowGraph graph =
                    steps().nodeType(fetch).instance(NodeInstance.of("f", "Fetch")).build();

            ExecutionPlan plan = planner.plan(graph);

            assertThat(plan.async()).isTrue();
            assertThat(plan.step("f").async()).isTrue();
            assertThat(plan.warnings())
                    .extracting(Diagnostic::code)
                    .containsExactly(DiagnosticCode.SYNC_DECLARED_ASYNC_REQUIRED);
        }

        @Test
        void shouldNotWarnWhenDeclaredAsync() throws Exception {
            WorkflowGraph graph =
                    steps()
                            .nodeType(fetch)
                            .instance(NodeInstance.of("f", "Fetch"))
                            .declaredAsync(true)
                            .build();

            assertThat(planner.plan(graph).warnings()).isEmpty();
        }

        @Test
        void shouldPropagateAsyncThroughWorkflowsOfUnit() throws Exception {
            WorkflowGraph inner =
                    workflow("inner")
                            .nodeType(fetch)
                            .instance(NodeInstance.of("f", "Fetch"))
                            .build();
            NodeType innerType =
                    NodeType.builder("inner")
                            .implementation(new ImplementationRef.SameFile("inner"))
                            .variant(NodeVariant.IMPORTED_WORKFLOW)
                            .input(Port.input("execute").dataType(DataType.STEP).build())
                            .build();
            WorkflowGraph outer =
                    workflow("outer")
                            .nodeType(innerType)
                            .instance(NodeInstance.of("call", "inner"))
                            .build();
            SourceUnit unit =
                    new SourceUnit(
                            "Flows.java",
                            "",
                            "Flows",
                            List.of(),
                            Map.of(),
                            List.of(outer, inner),
                            List.of(),
                            List.of());

            Map<String, ExecutionPlan> plans = planner.planUnit(unit);

            assertThat(plans).containsOnlyKeys("outer", "inner");
            assertThat(plans.get("outer").async()).isTrue();
            assertThat(plans.get("outer").step("call").async()).isTrue();
            assertThat(plans.get("outer").step("call").recursive()).isTrue();
        }
    }
}
