package io.weaver.core.model;

public enum PortDirection {
    INPUT,
    OUTPUT
}
