package io.weaver.core.grammar;

import io.weaver.core.model.Placement;

/// A parsed port line (`@input`, `@output`, `@step`, `@param`, `@returns`, `@port`).
///
/// @param name port name, not null
/// @param optional whether the name was bracketed
/// @param defaultText raw default text after `=`, null when none was given
/// @param scope scope name from `scope:X`, may be null
/// @param order `order:N`, may be null
/// @param placement `placement:TOP|BOTTOM`, may be null
/// @param type raw `type:T` text, may be null
/// @param mergeStrategy raw `mergeStrategy:M` text, may be null
/// @param description text after ` - `, may be null
/// @param expression constant expression from an `Expression:` description, may be null
public record PortDeclaration(
        String name,
        boolean optional,
        String defaultText,
        String scope,
        Integer order,
        Placement placement,
        String type,
        String mergeStrategy,
        String description,
        String expression) {

    public boolean hasDefault() {
        return defaultText != null;
    }
}
