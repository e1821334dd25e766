package org.stianloader.shyresolve.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used throughout shyresolve.
 *
 * <p>shyresolve is meant to be embedded into resolvers and installers which
 * bring their own logging setup, so it does not hard-depend on any logging backend.
 * The default implementation uses SLF4J as the log sink if it exists,
 * otherwise it will fall back to using JUL as the logger, as defined by
 * {@link java.util.logging.Logger}.
 *
 * <p>This facade supports "standard" SLF4J placeholders via "{}".
 * Not all arguments may map to a placeholder and in case they do not then they
 * are appended to the end of the message. Leftover "{}" placeholders are kept as-is.
 * If the last argument is a {@link Throwable}, it's stacktrace should be logged.
 */
public abstract class LoggingAdapter {

    /**
     * The currently active default logger.
     */
    @NotNull
    static LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    /**
     * Substitutes the "{}" placeholders of a message the way SLF4J would.
     * Used by sinks which do not understand SLF4J placeholders on their own,
     * such as JUL or the {@link AuditLog} file.
     *
     * @param message The message pattern
     * @param args The arguments to insert
     * @return The formatted message
     */
    @NotNull
    @Contract(pure = true)
    public static String formatMessage(@NotNull String message, Object @NotNull... args) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            int replaceHead = message.indexOf("{}");
            if (replaceHead == -1) {
                builder.append(message);
                message = "";
                if (i == (args.length - 1) && args[i] instanceof Throwable) {
                    builder.append('\n');
                    StringWriter sw = new StringWriter();
                    ((Throwable) args[i]).printStackTrace(new PrintWriter(sw));
                    builder.append(sw.toString());
                } else {
                    builder.append(' ').append(Objects.toString(args[i]));
                }
            } else {
                builder.append(message.subSequence(0, replaceHead)).append(Objects.toString(args[i]));
                message = message.substring(replaceHead + 2);
            }
        }

        builder.append(message);
        return builder.toString();
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance);
    }

    public abstract void debug(Class<?> clazz, String message, Object... args);
    public abstract void error(Class<?> clazz, String message, Object... args);
    public abstract void info(Class<?> clazz, String message, Object... args);
    public abstract void warn(Class<?> clazz, String message, Object... args);
}
