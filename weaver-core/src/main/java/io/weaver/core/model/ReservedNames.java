package io.weaver.core.model;

import java.util.Set;

/// Reserved node ids and port names.
public final class ReservedNames {

    private ReservedNames() {}

    public static final String START = "Start";
    public static final String EXIT = "Exit";

    public static final String EXECUTE = "execute";
    public static final String ON_SUCCESS = "onSuccess";
    public static final String ON_FAILURE = "onFailure";

    /// Scoped STEP output that starts a scope activation.
    public static final String SCOPE_START = "start";

    /// Scoped STEP inputs that end a scope activation.
    public static final String SCOPE_SUCCESS = "success";

    public static final String SCOPE_FAILURE = "failure";

    private static final Set<String> RESERVED_NODES = Set.of(START, EXIT);
    private static final Set<String> MANDATORY_PORTS = Set.of(EXECUTE, ON_SUCCESS, ON_FAILURE);
    private static final Set<String> SCOPED_MANDATORY_PORTS =
            Set.of(SCOPE_START, SCOPE_SUCCESS, SCOPE_FAILURE);

    public static boolean isReservedNode(String id) {
        return RESERVED_NODES.contains(id);
    }

    public static boolean isMandatoryPort(String port) {
        return MANDATORY_PORTS.contains(port);
    }

    public static boolean isScopedMandatoryPort(String port) {
        return SCOPED_MANDATORY_PORTS.contains(port);
    }

    public static boolean isControlSignal(String port) {
        return ON_SUCCESS.equals(port) || ON_FAILURE.equals(port);
    }
}
