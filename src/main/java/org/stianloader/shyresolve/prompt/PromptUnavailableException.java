package org.stianloader.shyresolve.prompt;

/**
 * Thrown by a {@link ConfirmationPrompt} that cannot obtain an answer, for example because
 * the process has no controlling terminal or its input was closed.
 */
public class PromptUnavailableException extends Exception {

    private static final long serialVersionUID = 1L;

    public PromptUnavailableException(String message) {
        super(message);
    }
}
