package io.weaver.core.model;

import java.util.Objects;

/// Where the implementation of a node type lives.
///
/// Resolved once while the graph is built and never re-dispatched afterwards. The code
/// generator emits a different call shape per variant.
///
/// - {@link Local}: a static method of the source unit's class
/// - {@link SameFile}: another workflow of the same source unit
/// - {@link External}: a static method of a class outside the source unit
public sealed interface ImplementationRef {

    /// Static method declared in the source unit.
    ///
    /// @param className simple name of the declaring class, not null
    /// @param methodName method name, not null
    record Local(String className, String methodName) implements ImplementationRef {
        public Local {
            Objects.requireNonNull(className, "className");
            Objects.requireNonNull(methodName, "methodName");
        }
    }

    /// Workflow declared in the same source unit.
    ///
    /// @param workflowName name of the workflow, not null
    record SameFile(String workflowName) implements ImplementationRef {
        public SameFile {
            Objects.requireNonNull(workflowName, "workflowName");
        }
    }

    /// Static method resolved from outside the source unit.
    ///
    /// @param className fully qualified name of the declaring class, not null
    /// @param exportName method name, not null
    record External(String className, String exportName) implements ImplementationRef {
        public External {
            Objects.requireNonNull(className, "className");
            Objects.requireNonNull(exportName, "exportName");
        }
    }
}
