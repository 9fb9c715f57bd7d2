package io.weaver.core.model;

/// Side of a node a port is drawn on. Presentation only.
public enum Placement {
    TOP,
    BOTTOM
}
