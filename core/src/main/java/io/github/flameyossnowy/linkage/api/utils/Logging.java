package io.github.flameyossnowy.linkage.api.utils;

import org.jetbrains.annotations.ApiStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.util.function.Supplier;

@ApiStatus.Internal
public final class Logging {
    public static boolean ENABLED = false;
    public static boolean DEEP = false;

    private static final Logger LOGGER;
    private static final java.util.logging.Logger FALLBACK;

    static {
        Logger detected;
        try {
            Logger logger = LoggerFactory.getLogger(Logging.class);
            detected = logger instanceof NOPLogger ? null : logger;
        } catch (NoClassDefFoundError e) {
            detected = null;
        }
        LOGGER = detected;

        if (LOGGER == null) {
            FALLBACK = java.util.logging.Logger.getLogger(Logging.class.getName());
        } else {
            FALLBACK = null;
        }
    }

    private Logging() {}

    /**
     * Logs an error message, regardless of {@link #ENABLED}.
     * @param string the message
     */
    public static void error(String string) {
        if (LOGGER != null) LOGGER.error(string);
        else FALLBACK.severe(string);
    }

    /**
     * Logs an error message with its cause, regardless of {@link #ENABLED}.
     * @param string the message
     * @param throwable the throwable that caused the error
     */
    public static void error(String string, Throwable throwable) {
        if (LOGGER != null) LOGGER.error(string, throwable);
        else FALLBACK.log(java.util.logging.Level.SEVERE, string, throwable);
    }

    /**
     * Logs a warning, regardless of {@link #ENABLED}.
     * @param string the message
     */
    public static void warn(String string) {
        if (LOGGER != null) LOGGER.warn(string);
        else FALLBACK.warning(string);
    }

    /**
     * Logs an info message if {@link #ENABLED} is set.
     * @param string the message
     */
    public static void info(String string) {
        if (ENABLED) {
            if (LOGGER != null) LOGGER.info(string);
            else FALLBACK.info(string);
        }
    }

    /**
     * Logs an info message only if {@link #DEEP} is enabled.
     * @param string the message
     */
    public static void deepInfo(String string) {
        if (DEEP) {
            if (LOGGER != null) LOGGER.info(string);
            else FALLBACK.info(string);
        }
    }

    /**
     * Same as {@link #deepInfo(String)}, the message is only built when {@link #DEEP} is enabled.
     * @param message the message supplier
     */
    public static void deepInfo(Supplier<String> message) {
        if (DEEP) deepInfo(message.get());
    }
}
