package io.weaver.core.builder;

import io.weaver.core.model.NodeType;
import java.util.Optional;

/// Resolves node types imported with `@fwImport name exportName from "package.Class"`.
///
/// Implementations return the shape of the exported method with an
/// {@link io.weaver.core.model.ImplementationRef.External} implementation. The builder renames
/// the result to the import's local name.
///
/// @see SourceRootTypeResolver for the implementation reading source trees
@FunctionalInterface
public interface ExternalTypeResolver {

    /// Resolver that knows no external types.
    ExternalTypeResolver NONE = (source, exportName) -> Optional.empty();

    /// Looks up an exported node type.
    ///
    /// @param source the `from` part: a fully qualified class name, not null
    /// @param exportName name of the static method, not null
    /// @return the node type, or empty when nothing discoverable is exported under that name
    Optional<NodeType> resolve(String source, String exportName);
}
