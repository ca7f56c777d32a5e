package com.meltwater.rabbitkeeper.util;

import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Logger which outputs a message followed by key/value pairs.
 *
 * <p>
 * Example usage:
 * <code><pre>
 * Logger log = new Logger(ChannelSupervisor.class);
 * log.infoWithParams("Channel re-established.", "channelNr", 3, "attempt", 2);
 * </pre></code>
 * Which would output something like this (depending on the slf4j backend configuration):
 * <pre>INFO ChannelSupervisor - Channel re-established. [ channelNr=3, attempt=2 ]</pre>
 * </p>
 *
 * <p>Values must have a sane toString() method. Arguments must come in pairs.</p>
 */
public class Logger {

    private enum Level {TRACE, DEBUG, INFO, WARN, ERROR}

    private static final List<Class<?>> UNQUOTED_TYPES = Arrays.asList(
            Boolean.class, Byte.class, Character.class, Double.class, Float.class,
            Integer.class, Long.class, Short.class);

    private final org.slf4j.Logger logger;

    public Logger(Class<?> clazz) {
        this(LoggerFactory.getLogger(clazz));
    }

    public Logger(String loggerName) {
        this(LoggerFactory.getLogger(loggerName));
    }

    protected Logger(org.slf4j.Logger logger) {
        this.logger = logger;
    }

    public String getName() {
        return logger.getName();
    }

    public void traceWithParams(String message, Object... arguments) {
        log(Level.TRACE, message, null, arguments);
    }

    public void traceWithParams(String message, Throwable t, Object... arguments) {
        log(Level.TRACE, message, t, arguments);
    }

    public void debugWithParams(String message, Object... arguments) {
        log(Level.DEBUG, message, null, arguments);
    }

    public void debugWithParams(String message, Throwable t, Object... arguments) {
        log(Level.DEBUG, message, t, arguments);
    }

    public void infoWithParams(String message, Object... arguments) {
        log(Level.INFO, message, null, arguments);
    }

    public void infoWithParams(String message, Throwable t, Object... arguments) {
        log(Level.INFO, message, t, arguments);
    }

    public void warnWithParams(String message, Object... arguments) {
        log(Level.WARN, message, null, arguments);
    }

    public void warnWithParams(String message, Throwable t, Object... arguments) {
        log(Level.WARN, message, t, arguments);
    }

    public void errorWithParams(String message, Object... arguments) {
        log(Level.ERROR, message, null, arguments);
    }

    public void errorWithParams(String message, Throwable t, Object... arguments) {
        log(Level.ERROR, message, t, arguments);
    }

    private void log(Level level, String message, Throwable t, Object[] arguments) {
        if (!isEnabled(level)) {
            return;
        }
        String text;
        try {
            text = buildLogMessage(message, arguments);
        } catch (IllegalArgumentException e) {
            logger.error("Failed to assemble log message for logger {}! Arguments must be declared in pairs! message={}, arguments={}",
                    getName(), message, Arrays.toString(arguments));
            text = message;
        }
        switch (level) {
            case TRACE: logger.trace(text, t); break;
            case DEBUG: logger.debug(text, t); break;
            case INFO:  logger.info(text, t); break;
            case WARN:  logger.warn(text, t); break;
            case ERROR: logger.error(text, t); break;
        }
    }

    private boolean isEnabled(Level level) {
        switch (level) {
            case TRACE: return logger.isTraceEnabled();
            case DEBUG: return logger.isDebugEnabled();
            case INFO:  return logger.isInfoEnabled();
            case WARN:  return logger.isWarnEnabled();
            default:    return logger.isErrorEnabled();
        }
    }

    protected String buildLogMessage(String message, Object[] arguments) {
        if (arguments.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Arguments must be declared in pairs: (message, key, value, key2, value2, ...)");
        }
        if (arguments.length == 0) {
            return message;
        }
        final StringBuilder sb = new StringBuilder(message).append(" [ ");
        for (int i = 0; i < arguments.length; i += 2) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments[i]).append('=');
            Object value = arguments[i + 1];
            if (value == null || UNQUOTED_TYPES.contains(value.getClass())) {
                sb.append(value);
            } else {
                sb.append('"').append(value).append('"');
            }
        }
        return sb.append(" ]").toString();
    }
}
