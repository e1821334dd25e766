package org.stianloader.shyresolve.prompt;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Answers every question with the same preconfigured answer, without any I/O.
 * Used for non-interactive runs.
 */
public class CannedPrompt implements ConfirmationPrompt {
    @NotNull
    private final String answer;

    public CannedPrompt(@NotNull String answer) {
        this.answer = Objects.requireNonNull(answer, "answer may not be null");
    }

    @Override
    @NotNull
    public String ask(@NotNull String question) {
        return this.answer;
    }

    @Override
    public String toString() {
        return "CannedPrompt[" + this.answer + "]";
    }
}
