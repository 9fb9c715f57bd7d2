package io.weaver.core.model;

/// Canvas coordinates. Presentation only.
public record Position(double x, double y) {}
