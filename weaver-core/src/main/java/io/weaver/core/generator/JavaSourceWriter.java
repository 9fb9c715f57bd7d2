package io.weaver.core.generator;

/// Line-oriented writer for generated Java source.
///
/// Indents by four spaces per open block and always ends lines with `\n`, so output does not
/// depend on the platform.
final class JavaSourceWriter {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth;

    JavaSourceWriter line(String text) {
        if (!text.isEmpty()) {
            out.append(INDENT.repeat(depth)).append(text);
        }
        out.append('\n');
        return this;
    }

    JavaSourceWriter blank() {
        return line("");
    }

    /// Writes `header {` and indents.
    JavaSourceWriter open(String header) {
        line(header + " {");
        depth++;
        return this;
    }

    /// Dedents and writes `}`.
    JavaSourceWriter close() {
        return close("");
    }

    /// Dedents and writes `}` followed by `suffix`, as in `});`.
    JavaSourceWriter close(String suffix) {
        if (depth == 0) {
            throw new IllegalStateException("No open block to close");
        }
        depth--;
        return line("}" + suffix);
    }

    /// Closes the current block and opens a continuation, as in `} else {`.
    JavaSourceWriter reopen(String header) {
        close(" " + header + " {");
        depth++;
        return this;
    }

    /// Writes a statement continued over several lines, each continuation indented twice.
    JavaSourceWriter wrapped(String first, Iterable<String> continuations) {
        line(first);
        depth += 2;
        continuations.forEach(this::line);
        depth -= 2;
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
