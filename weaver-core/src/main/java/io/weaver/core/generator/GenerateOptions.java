package io.weaver.core.generator;

import io.weaver.core.validation.ValidationOptions;
import java.util.Objects;

/// Options of one code generation run.
///
/// @param production omit trace events (listener calls) from the generated program
/// @param validation options the graphs are validated with before generation, not null
public record GenerateOptions(boolean production, ValidationOptions validation) {

    public static final GenerateOptions DEFAULTS =
            new GenerateOptions(false, ValidationOptions.DEFAULTS);

    public GenerateOptions {
        Objects.requireNonNull(validation, "validation must not be null");
    }

    public GenerateOptions withProduction(boolean production) {
        return new GenerateOptions(production, validation);
    }

    public GenerateOptions withValidation(ValidationOptions validation) {
        return new GenerateOptions(production, validation);
    }
}
