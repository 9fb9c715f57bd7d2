package io.weaver.core.parser;

import java.util.List;

/// A record type declared in the source unit, used to read multi-output return shapes.
///
/// @param name simple record name, not null
/// @param components components in declaration order, not null
public record RecordShape(String name, List<MethodParameter> components) {

    public RecordShape {
        components = List.copyOf(components);
    }
}
