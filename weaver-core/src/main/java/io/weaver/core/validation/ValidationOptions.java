package io.weaver.core.validation;

/// Options of one validation run.
///
/// @param strict report type-coercion findings as errors
/// @param draft report stub nodes as warnings instead of errors
public record ValidationOptions(boolean strict, boolean draft) {

    public static final ValidationOptions DEFAULTS = new ValidationOptions(false, false);

    public static ValidationOptions strictMode() {
        return new ValidationOptions(true, false);
    }

    public static ValidationOptions draftMode() {
        return new ValidationOptions(false, true);
    }
}
