package io.weaver.core.grammar;

import io.weaver.core.validation.Diagnostic;
import java.util.List;
import java.util.Optional;

/// Result of parsing one documentation comment.
///
/// @param summary leading prose before the first tag, may be null
/// @param entries parsed tag lines in comment order, not null
/// @param warnings one `PARSE_WARNING` per malformed line, not null
public record AnnotationBlock(String summary, List<Entry> entries, List<Diagnostic> warnings) {

    /// A parsed tag line with its 1-based source line.
    public record Entry(TagDeclaration declaration, int line) {}

    public AnnotationBlock {
        entries = List.copyOf(entries);
        warnings = List.copyOf(warnings);
    }

    /// Returns the declared kind from `@flowWeaver`, if the comment has the marker.
    public Optional<String> kind() {
        return entries.stream()
                .map(Entry::declaration)
                .filter(TagDeclaration.Marker.class::isInstance)
                .map(declaration -> ((TagDeclaration.Marker) declaration).kind())
                .findFirst();
    }

    /// Returns every declaration of the given variant, in comment order.
    public <T extends TagDeclaration> List<T> all(Class<T> variant) {
        return entries.stream()
                .map(Entry::declaration)
                .filter(variant::isInstance)
                .map(variant::cast)
                .toList();
    }

    /// Returns the last declaration of the given variant.
    public <T extends TagDeclaration> Optional<T> last(Class<T> variant) {
        List<T> matches = all(variant);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(matches.size() - 1));
    }

    public boolean has(Class<? extends TagDeclaration> variant) {
        return entries.stream().map(Entry::declaration).anyMatch(variant::isInstance);
    }
}
