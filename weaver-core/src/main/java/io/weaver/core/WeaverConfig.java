package io.weaver.core;

import io.weaver.core.generator.GenerateOptions;
import io.weaver.core.validation.ValidationOptions;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Configuration options for a {@link Weaver} pipeline.
///
/// Controls validation strictness, external type resolution and the shape of generated code.
/// Use the {@link Builder} for fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `strictTypes`: `false` (lossy coercions are warnings)
/// - `draftMode`: `false` (stub nodes are errors)
/// - `strictExternalResolution`: `false` (unresolved imports are skipped silently)
/// - `production`: `false` (generated code reports to the execution listener)
/// - `sourceRoots`: empty (no external type resolution)
///
/// @implNote **Not thread-safe**. Configure before passing to {@link WeaverFactory};
/// do not modify after the pipeline is created.
///
/// @see WeaverFactory#create(WeaverConfig)
public class WeaverConfig {
    private boolean strictTypes;
    private boolean draftMode;
    private boolean strictExternalResolution;
    private boolean production;
    private List<Path> sourceRoots = new ArrayList<>();

    /// Creates a configuration with default values.
    public WeaverConfig() {}

    /// Returns whether lossy type coercions are reported as errors.
    public boolean isStrictTypes() {
        return strictTypes;
    }

    public void setStrictTypes(boolean strictTypes) {
        this.strictTypes = strictTypes;
    }

    /// Returns whether stub nodes are tolerated with a warning.
    public boolean isDraftMode() {
        return draftMode;
    }

    public void setDraftMode(boolean draftMode) {
        this.draftMode = draftMode;
    }

    /// Returns whether imports without a discoverable shape are reported.
    ///
    /// @return `true` to report `UNRESOLVED_IMPORT` warnings, `false` to skip them silently
    public boolean isStrictExternalResolution() {
        return strictExternalResolution;
    }

    public void setStrictExternalResolution(boolean strictExternalResolution) {
        this.strictExternalResolution = strictExternalResolution;
    }

    /// Returns whether generated code omits listener callbacks and status reports.
    public boolean isProduction() {
        return production;
    }

    public void setProduction(boolean production) {
        this.production = production;
    }

    /// Returns the source roots searched for imported node types.
    ///
    /// @return mutable list of roots, never null
    public List<Path> getSourceRoots() {
        return sourceRoots;
    }

    /// Replaces the source roots searched for imported node types.
    ///
    /// @param sourceRoots roots to search in order, not null
    public void setSourceRoots(List<Path> sourceRoots) {
        this.sourceRoots = new ArrayList<>(sourceRoots);
    }

    /// Derives the validator options from this configuration.
    ///
    /// @return options carrying `strictTypes` and `draftMode`, never null
    public ValidationOptions validationOptions() {
        return new ValidationOptions(strictTypes, draftMode);
    }

    /// Derives the generator options from this configuration.
    ///
    /// @return options carrying `production` and the validation options, never null
    public GenerateOptions generateOptions() {
        return new GenerateOptions(production, validationOptions());
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link WeaverConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final WeaverConfig config = new WeaverConfig();

        public Builder strictTypes(boolean strictTypes) {
            config.strictTypes = strictTypes;
            return this;
        }

        public Builder draftMode(boolean draftMode) {
            config.draftMode = draftMode;
            return this;
        }

        public Builder strictExternalResolution(boolean strictExternalResolution) {
            config.strictExternalResolution = strictExternalResolution;
            return this;
        }

        public Builder production(boolean production) {
            config.production = production;
            return this;
        }

        /// Appends a source root searched for imported node types.
        ///
        /// @param sourceRoot directory holding `package/Class.java` files, not null
        /// @return this builder for chaining, never null
        public Builder sourceRoot(Path sourceRoot) {
            config.sourceRoots.add(sourceRoot);
            return this;
        }

        public Builder sourceRoots(List<Path> sourceRoots) {
            config.sourceRoots = new ArrayList<>(sourceRoots);
            return this;
        }

        /// Builds and returns the configured {@link WeaverConfig} instance.
        ///
        /// @return the configured instance, never null
        public WeaverConfig build() {
            return config;
        }
    }
}
