package io.weaver.core.grammar;

import io.weaver.core.model.InstanceConfig;
import io.weaver.core.model.InstanceParent;
import io.weaver.core.model.PortRef;
import java.time.Duration;
import java.util.List;

/// One successfully parsed annotation line.
///
/// Each variant mirrors one tag of the annotation language; {@link AnnotationParser}
/// produces them in comment order and the builders interpret them.
public sealed interface TagDeclaration {

    /// `@flowWeaver nodeType|workflow|pattern`
    record Marker(String kind) implements TagDeclaration {}

    /// `@input`, `@output`, `@step`, `@param` or `@returns`. `tag` is the tag name without `@`.
    record PortTag(String tag, PortDeclaration port) implements TagDeclaration {}

    /// `@port IN.x` or `@port OUT.y` on a pattern.
    record PatternPortTag(boolean input, PortDeclaration port) implements TagDeclaration {}

    /// `@node id Type [parent.scope] [attributes]`
    record NodeTag(String id, String type, InstanceParent parent, InstanceConfig config)
            implements TagDeclaration {}

    /// `@connect a.p -> b.q`
    record ConnectTag(PortRef from, PortRef to) implements TagDeclaration {}

    /// `@path A -> B:ok -> C`
    record PathTag(List<PathStep> steps) implements TagDeclaration {
        public PathTag {
            steps = List.copyOf(steps);
        }
    }

    /// One hop of a path. `route` is `ok`, `success`, `fail` or null.
    record PathStep(String node, String route) {}

    /// A connection endpoint whose port may be left out, used by fan declarations.
    record Endpoint(String node, String port, String scope) {}

    /// `@fanOut src.port -> t1, t2.port`
    record FanOutTag(Endpoint source, List<Endpoint> targets) implements TagDeclaration {
        public FanOutTag {
            targets = List.copyOf(targets);
        }
    }

    /// `@fanIn s1, s2.port -> target.port`
    record FanInTag(List<Endpoint> sources, Endpoint target) implements TagDeclaration {
        public FanInTag {
            sources = List.copyOf(sources);
        }
    }

    /// `@scope name [children]` or `@scope owner.name [children]`. `owner` is null for the
    /// short form; `children` is empty on node types.
    record ScopeTag(String owner, String name, List<String> children) implements TagDeclaration {
        public ScopeTag {
            children = List.copyOf(children);
        }
    }

    /// `@map id child[(in -> out)] over source.port`. The ports are null when the child's first
    /// data input and output are meant.
    record MapTag(String id, String child, String inputPort, String outputPort, PortRef source)
            implements TagDeclaration {}

    /// `@coerce id source.port -> target.port as type`, the type kept raw so an unknown one can
    /// be reported.
    record CoerceTag(String id, PortRef from, PortRef to, String targetType)
            implements TagDeclaration {}

    /// `@position id x y`
    record PositionTag(String node, double x, double y) implements TagDeclaration {}

    record TriggerTag(String event, String cron) implements TagDeclaration {}

    record CancelOnTag(String event, String match, Duration timeout) implements TagDeclaration {}

    record RetriesTag(int retries) implements TagDeclaration {}

    record TimeoutTag(Duration timeout) implements TagDeclaration {}

    record ThrottleTag(int limit, Duration period) implements TagDeclaration {}

    record StrictTypesTag(boolean enabled) implements TagDeclaration {}

    record AutoConnectTag() implements TagDeclaration {}

    /// `@fwImport name exportName from "package.Class"`
    record ImportTag(String name, String exportName, String from) implements TagDeclaration {}

    /// `@executeWhen STRATEGY`, kept raw so an unknown strategy can be reported.
    record ExecuteWhenTag(String strategy) implements TagDeclaration {}

    record ExpressionTag() implements TagDeclaration {}

    record PullExecutionTag(String port) implements TagDeclaration {}

    record NameTag(String name) implements TagDeclaration {}

    record LabelTag(String label) implements TagDeclaration {}

    record DescriptionTag(String text) implements TagDeclaration {}

    record ColorTag(String color) implements TagDeclaration {}

    record IconTag(String icon) implements TagDeclaration {}
}
