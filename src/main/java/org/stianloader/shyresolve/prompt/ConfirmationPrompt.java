package org.stianloader.shyresolve.prompt;

import org.jetbrains.annotations.NotNull;

/**
 * Capability to ask the operator a yes/no question.
 */
public interface ConfirmationPrompt {

    /**
     * Asks a question and waits for the answer.
     *
     * @param question The question, ending with the expected answer format
     * @return The raw answer, never null
     * @throws PromptUnavailableException If no answer can be obtained
     */
    @NotNull
    String ask(@NotNull String question) throws PromptUnavailableException;
}
