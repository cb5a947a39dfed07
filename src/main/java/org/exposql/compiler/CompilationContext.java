package org.exposql.compiler;

import java.util.Objects;
import org.exposql.model.ActionCatalog;
import org.exposql.model.TeamSettings;

/**
 * Read-only collaborators a compilation needs besides the request itself.
 */
public record CompilationContext(ActionCatalog actions, TeamSettings team, CompilerOptions options) {
    public CompilationContext {
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(team, "team");
        Objects.requireNonNull(options, "options");
    }

    public static CompilationContext defaults() {
        return new CompilationContext(ActionCatalog.empty(), TeamSettings.defaults(), CompilerOptions.defaults());
    }

    public CompilationContext withActions(final ActionCatalog catalog) {
        return new CompilationContext(catalog, team, options);
    }

    public CompilationContext withTeam(final TeamSettings settings) {
        return new CompilationContext(actions, settings, options);
    }

    public CompilationContext withOptions(final CompilerOptions value) {
        return new CompilationContext(actions, team, value);
    }
}
