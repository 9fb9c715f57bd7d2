package io.weaver.core.parser;

/// A declared method parameter.
///
/// @param name parameter name, not null
/// @param type type text as written in source, not null
public record MethodParameter(String name, String type) {}
