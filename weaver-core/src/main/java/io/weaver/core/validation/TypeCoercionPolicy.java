package io.weaver.core.validation;

import io.weaver.core.model.DataType;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/// Classifies a data connection between two port types.
///
/// Identical types and `ANY` on either side are always accepted. The remaining pairs fall
/// into three groups that mirror what the generated program does at runtime through
/// `io.weaver.runtime.Coercions`:
///
/// | Group   | Pairs                                                      | Code                    |
/// |---------|------------------------------------------------------------|-------------------------|
/// | safe    | NUMBER→STRING, BOOLEAN→STRING                              | none                    |
/// | lossy   | STRING→NUMBER, STRING→BOOLEAN, OBJECT→STRING, ARRAY→STRING | `LOSSY_TYPE_COERCION`   |
/// | unusual | NUMBER→BOOLEAN, BOOLEAN→NUMBER, STRING→OBJECT, STRING→ARRAY| `UNUSUAL_TYPE_COERCION` |
///
/// Every other pair is a `TYPE_MISMATCH`. STEP ports are not data and are checked separately.
public final class TypeCoercionPolicy {

    /// A coercion worth reporting.
    ///
    /// @param code `LOSSY_TYPE_COERCION`, `UNUSUAL_TYPE_COERCION` or `TYPE_MISMATCH`
    /// @param reason what the conversion does at runtime, may be null
    public record Finding(DiagnosticCode code, String reason) {}

    private static final Map<DataType, Map<DataType, Finding>> RULES = new EnumMap<>(DataType.class);

    static {
        lossy(DataType.STRING, DataType.NUMBER, "Fails at runtime if the string is not a valid number");
        lossy(DataType.STRING, DataType.BOOLEAN, "Only \"true\" (ignoring case) converts to true");
        lossy(DataType.OBJECT, DataType.STRING, "Uses the object's toString()");
        lossy(DataType.ARRAY, DataType.STRING, "Uses the collection's toString()");
        unusual(DataType.NUMBER, DataType.BOOLEAN, "Zero converts to false, any other number to true");
        unusual(DataType.BOOLEAN, DataType.NUMBER, "Converts false to 0 and true to 1");
        unusual(DataType.STRING, DataType.OBJECT, "Fails at runtime unless the parameter accepts a string");
        unusual(DataType.STRING, DataType.ARRAY, "Fails at runtime unless the parameter accepts a string");
    }

    private TypeCoercionPolicy() {}

    /// Classifies a connection from a `source` typed output to a `target` typed input.
    ///
    /// @param source type of the output port, not null
    /// @param target type of the input port, not null
    /// @return the finding, empty when the pair converts silently
    public static Optional<Finding> classify(DataType source, DataType target) {
        if (source == target || source == DataType.ANY || target == DataType.ANY) {
            return Optional.empty();
        }
        if (target == DataType.STRING && (source == DataType.NUMBER || source == DataType.BOOLEAN)) {
            return Optional.empty();
        }
        Finding rule = RULES.getOrDefault(source, Map.of()).get(target);
        return Optional.of(rule != null ? rule : new Finding(DiagnosticCode.TYPE_MISMATCH, null));
    }

    private static void lossy(DataType source, DataType target, String reason) {
        rule(source, target, new Finding(DiagnosticCode.LOSSY_TYPE_COERCION, reason));
    }

    private static void unusual(DataType source, DataType target, String reason) {
        rule(source, target, new Finding(DiagnosticCode.UNUSUAL_TYPE_COERCION, reason));
    }

    private static void rule(DataType source, DataType target, Finding finding) {
        RULES.computeIfAbsent(source, k -> new EnumMap<>(DataType.class)).put(target, finding);
    }
}
