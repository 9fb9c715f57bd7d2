package io.weaver.core;

/// Annotated source units shared by the generator, facade and end-to-end tests.
public final class Fixtures {

    private Fixtures() {
        // Utility class - prevent instantiation
    }

    /// `flows.Adder`: a join, a lazy node and two workflows that place each other.
    public static final String ADDER =
            """
            package flows;

            import java.util.concurrent.atomic.AtomicInteger;

            public class Adder {

                public static final AtomicInteger ADDS = new AtomicInteger();
                public static final AtomicInteger TICKS = new AtomicInteger();
                public static final AtomicInteger LAZY = new AtomicInteger();

                public record Result(double sum) {}

                /**
                 * Adds two numbers.
                 *
                 * @flowWeaver nodeType
                 * @executeWhen CONJUNCTION
                 */
                public static double add(double x, double y) {
                    ADDS.incrementAndGet();
                    return x + y;
                }

                /**
                 * Counts its activations.
                 *
                 * @flowWeaver nodeType
                 */
                public static boolean tick(boolean execute) {
                    TICKS.incrementAndGet();
                    return execute;
                }

                /**
                 * Runs only when someone reads its output.
                 *
                 * @flowWeaver nodeType
                 * @pullExecution execute
                 * @input [seed=0]
                 */
                public static double expensive(double seed) {
                    LAZY.incrementAndGet();
                    return seed * 2;
                }

                /**
                 * Sums two numbers once both are known.
                 *
                 * @flowWeaver workflow
                 * @node a add
                 * @connect Start.execute -> a.execute
                 * @connect Start.x -> a.x
                 * @connect Start.y -> a.y
                 * @connect a.onSuccess -> Exit.onSuccess
                 * @connect a.result -> Exit.sum
                 */
                public static Result calculate(boolean execute, double x, double y) {
                    return null;
                }

                /**
                 * Waits for two branches.
                 *
                 * @flowWeaver workflow
                 * @node left tick
                 * @node right tick
                 * @node both tick
                 * @connect Start.execute -> left.execute
                 * @connect Start.execute -> right.execute
                 * @connect left.onSuccess -> both.execute
                 * @connect right.onSuccess -> both.execute
                 * @connect both.onSuccess -> Exit.onSuccess
                 */
                public static Result fork(boolean execute) {
                    return null;
                }

                /**
                 * Never reads its lazy node.
                 *
                 * @flowWeaver workflow
                 * @node lazy expensive
                 * @connect Start.execute -> Exit.onSuccess
                 */
                public static Result idle(boolean execute) {
                    return null;
                }

                /**
                 * @flowWeaver workflow
                 * @node other pong
                 * @path Start -> other -> Exit
                 */
                public static Result ping(boolean execute, double sum) {
                    return null;
                }

                /**
                 * @flowWeaver workflow
                 * @node back ping
                 * @path Start -> back -> Exit
                 */
                public static Result pong(boolean execute, double sum) {
                    return null;
                }
            }
            """;

    /// `flows.Lists`: a scope-owning node, `@map` and `@coerce` lines, and an asynchronous
    /// node inside an asynchronous workflow.
    public static final String LISTS =
            """
            package flows;

            import io.weaver.runtime.ScopeFunction;
            import io.weaver.runtime.ScopeResult;
            import java.util.ArrayList;
            import java.util.List;
            import java.util.Map;
            import java.util.concurrent.CompletableFuture;
            import java.util.concurrent.atomic.AtomicInteger;

            public class Lists {

                public static final AtomicInteger DOUBLINGS = new AtomicInteger();

                public record Doubled(List<Object> results) {}

                public record Encoded(List<Object> results, String json) {}

                public record Text(String text) {}

                public record Total(double total) {}

                /**
                 * Doubles a number.
                 *
                 * @flowWeaver nodeType
                 */
                public static double twice(double value) {
                    DOUBLINGS.incrementAndGet();
                    return value * 2;
                }

                /**
                 * Runs the body once per element.
                 *
                 * @flowWeaver nodeType
                 * @output results
                 * @output item scope:each
                 * @input processed scope:each
                 */
                public static Map<String, Object> forEach(
                        boolean execute, List<Object> items, ScopeFunction each) {
                    List<Object> results = new ArrayList<>();
                    for (Object item : items) {
                        ScopeResult run = each.call(true, item);
                        results.add(run.get("processed"));
                    }
                    return Map.of("onSuccess", true, "onFailure", false, "results", results);
                }

                /**
                 * Adds one later.
                 *
                 * @flowWeaver nodeType
                 */
                public static CompletableFuture<Double> later(double value) {
                    return CompletableFuture.supplyAsync(() -> value + 1);
                }

                /**
                 * Doubles every element inside a hand-wired scope.
                 *
                 * @flowWeaver workflow
                 * @node loop forEach
                 * @node dbl twice loop.each
                 * @connect Start.execute -> loop.execute
                 * @connect Start.items -> loop.items
                 * @connect loop.start:each -> dbl.execute
                 * @connect loop.item:each -> dbl.value
                 * @connect dbl.result -> loop.processed:each
                 * @connect dbl.onSuccess -> loop.success:each
                 * @connect loop.onSuccess -> Exit.onSuccess
                 * @connect loop.results -> Exit.results
                 */
                public static Doubled iterate(boolean execute, List<Object> items) {
                    return null;
                }

                /**
                 * Doubles every element through a map line and renders the results as JSON.
                 *
                 * @flowWeaver workflow
                 * @node dbl twice
                 * @map loop dbl over Start.items
                 * @coerce asJson loop.results -> Exit.json as json
                 * @connect Start.execute -> loop.execute
                 * @connect loop.onSuccess -> Exit.onSuccess
                 * @connect loop.results -> Exit.results
                 */
                public static Encoded mapped(boolean execute, List<Object> items) {
                    return null;
                }

                /**
                 * Doubles a number and reports it as text.
                 *
                 * @flowWeaver workflow
                 * @node dbl twice
                 * @coerce asText dbl.result -> Exit.text as string
                 * @connect Start.execute -> dbl.execute
                 * @connect Start.value -> dbl.value
                 * @connect dbl.onSuccess -> Exit.onSuccess
                 */
                public static Text describe(boolean execute, double value) {
                    return null;
                }

                /**
                 * Waits for an asynchronous node.
                 *
                 * @flowWeaver workflow
                 * @node inc later
                 * @connect Start.execute -> inc.execute
                 * @connect Start.value -> inc.value
                 * @connect inc.onSuccess -> Exit.onSuccess
                 * @connect inc.result -> Exit.total
                 */
                public static CompletableFuture<Total> deferred(boolean execute, double value) {
                    return null;
                }
            }
            """;

    /// `flows.Broken`: input `y` of node `a` is required and never connected.
    public static final String BROKEN =
            """
            package flows;

            public class Broken {

                /**
                 * @flowWeaver nodeType
                 */
                public static double add(double x, double y) {
                    return x + y;
                }

                /**
                 * @flowWeaver workflow
                 * @node a add
                 * @connect Start.execute -> a.execute
                 * @connect Start.x -> a.x
                 * @connect a.onSuccess -> Exit.onSuccess
                 */
                public static void calculate(boolean execute, double x) {}
            }
            """;
}
