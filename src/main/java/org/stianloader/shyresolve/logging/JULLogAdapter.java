package org.stianloader.shyresolve.logging;

import java.util.logging.Level;
import java.util.logging.Logger;

class JULLogAdapter extends LoggingAdapter {

    private static void log(Class<?> clazz, Level level, String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, LoggingAdapter.formatMessage(message, args));
        }
    }

    @Override
    public void debug(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
