package io.weaver.runtime;

/// Closure handed to a node that owns a scope.
///
/// The owning node calls it once per activation it wants: an iteration node calls it once per
/// element, a retry node until it succeeds. Each call runs the scope's children against fresh
/// scoped inputs and returns fresh scoped outputs; nothing persists between calls.
///
/// The positional `args` are the owning node's scoped output ports in declaration order.
///
/// {@snippet :
/// public static Map<String, Object> forEach(boolean execute, List<Object> items, ScopeFunction iteration) {
///     List<Object> results = new ArrayList<>();
///     for (Object item : items) {
///         results.add(iteration.call(true, item).get("processed"));
///     }
///     return Map.of("onSuccess", true, "onFailure", false, "results", results);
/// }
/// }
@FunctionalInterface
public interface ScopeFunction {

    /// Runs the scope's children once.
    ///
    /// @param start the scope's start trigger
    /// @param args scoped output values of the owning node, positional
    /// @return the scope's signals and scoped input values, never null
    ScopeResult call(boolean start, Object... args);
}
