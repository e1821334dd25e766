package org.stianloader.shyresolve;

import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of arbitrating the candidates of a single package.
 *
 * <p>Every decision carries a rationale which is suitable for logs and diagnostics.
 * Decisions of kind {@link DecisionKind#ABORT} have no selected candidate, all other decisions do.
 */
public final record Decision(@NotNull DecisionKind kind, @NotNull String packageName, @Nullable ResolvedCandidate selected, @NotNull String rationale) {

    public Decision {
        Objects.requireNonNull(kind, "kind may not be null");
        Objects.requireNonNull(packageName, "packageName may not be null");
        Objects.requireNonNull(rationale, "rationale may not be null");
        if (rationale.isBlank()) {
            throw new IllegalArgumentException("A decision requires a rationale");
        }
        if ((kind == DecisionKind.ABORT) != (selected == null)) {
            throw new IllegalArgumentException("Only aborting decisions may (and must) lack a selected candidate. Kind: " + kind + ", selected: " + selected);
        }
    }

    @NotNull
    @Contract(pure = true)
    public static Decision abort(@NotNull String packageName, @NotNull String rationale) {
        return new Decision(DecisionKind.ABORT, packageName, null, rationale);
    }

    @NotNull
    @Contract(pure = true)
    public static Decision allowTrusted(@NotNull ResolvedCandidate selected, @NotNull String rationale) {
        return new Decision(DecisionKind.ALLOW_TRUSTED, selected.packageName(), selected, rationale);
    }

    @NotNull
    @Contract(pure = true)
    public static Decision allowUntrusted(@NotNull ResolvedCandidate selected, @NotNull String rationale) {
        return new Decision(DecisionKind.ALLOW_UNTRUSTED, selected.packageName(), selected, rationale);
    }

    @NotNull
    @Contract(pure = true)
    public Optional<ResolvedCandidate> getSelected() {
        return Optional.ofNullable(this.selected);
    }

    @Contract(pure = true)
    public boolean isAbort() {
        return this.kind == DecisionKind.ABORT;
    }

    @Override
    public String toString() {
        return this.kind + " " + (this.selected == null ? this.packageName : this.selected.toString()) + ": " + this.rationale;
    }
}
