package org.stianloader.shyresolve.prompt;

import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.stianloader.shyresolve.Decision;
import org.stianloader.shyresolve.ResolvedCandidate;
import org.stianloader.shyresolve.logging.AuditLog;
import org.stianloader.shyresolve.logging.LoggingAdapter;

/**
 * Chooses between a version-superior, popular candidate of untrusted origin and the best trusted candidate
 * by asking a {@link ConfirmationPrompt}. Only the answer "yes" (ignoring case and surrounding whitespace)
 * selects the untrusted candidate. If the prompt cannot answer, the trusted candidate is chosen.
 */
public class DecisionMediator {
    @NotNull
    private final AuditLog auditLog;
    @NotNull
    private final ConfirmationPrompt prompt;

    public DecisionMediator(@NotNull ConfirmationPrompt prompt, @NotNull AuditLog auditLog) {
        this.prompt = Objects.requireNonNull(prompt, "prompt may not be null");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog may not be null");
    }

    public static boolean isAffirmative(@NotNull String answer) {
        return answer.trim().toLowerCase(Locale.ROOT).equals("yes");
    }

    @NotNull
    public Decision resolve(@NotNull ResolvedCandidate trusted, @NotNull ResolvedCandidate untrusted) {
        String packageName = untrusted.packageName();
        String question = "shyresolve: installation candidate " + packageName + " " + untrusted.version()
                + " from " + untrusted.originDomain() + " satisfies the popularity threshold and is newer than "
                + trusted.version() + " from " + trusted.originDomain() + "; allow (yes/no)? ";

        String answer;
        try {
            answer = this.prompt.ask(question);
        } catch (PromptUnavailableException e) {
            LoggingAdapter.getDefaultLogger().warn(DecisionMediator.class, "Unable to confirm the installation of {} {} from {}: {}. Falling back to {} from {}.",
                    packageName, untrusted.version(), untrusted.originDomain(), e.getMessage(), trusted.version(), trusted.originDomain());
            this.auditLog.record(DecisionMediator.class, "prompt unavailable for {} (trusted {}, untrusted {}); chose trusted origin {}",
                    packageName, trusted.version(), untrusted.version(), trusted.originDomain());
            return Decision.allowTrusted(trusted, "confirmation prompt unavailable (" + e.getMessage() + "), falling back to the trusted candidate");
        }

        if (DecisionMediator.isAffirmative(answer)) {
            this.auditLog.record(DecisionMediator.class, "answer '{}' for {} (trusted {}, untrusted {}); chose untrusted origin {}",
                    answer.trim(), packageName, trusted.version(), untrusted.version(), untrusted.originDomain());
            return Decision.allowUntrusted(untrusted, "explicitly allowed the untrusted candidate " + untrusted.version() + " from " + untrusted.originDomain());
        }

        this.auditLog.record(DecisionMediator.class, "answer '{}' for {} (trusted {}, untrusted {}); chose trusted origin {}",
                answer.trim(), packageName, trusted.version(), untrusted.version(), trusted.originDomain());
        return Decision.allowTrusted(trusted, "declined the untrusted candidate " + untrusted.version() + " from " + untrusted.originDomain());
    }
}
