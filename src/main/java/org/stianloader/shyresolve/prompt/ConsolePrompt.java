package org.stianloader.shyresolve.prompt;

import java.io.Console;

import org.jetbrains.annotations.NotNull;

/**
 * Asks questions on the controlling terminal of the process, as given by {@link System#console()}.
 */
public class ConsolePrompt implements ConfirmationPrompt {

    @Override
    @NotNull
    public String ask(@NotNull String question) throws PromptUnavailableException {
        Console console = System.console();
        if (console == null) {
            throw new PromptUnavailableException("No terminal is attached to the process");
        }
        String answer = console.readLine("%s", question);
        if (answer == null) {
            throw new PromptUnavailableException("The terminal input was closed before an answer was given");
        }
        return answer;
    }
}
