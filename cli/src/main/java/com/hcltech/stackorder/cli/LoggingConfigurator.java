package com.hcltech.stackorder.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.hcltech.stackorder.common.IEnvGetter;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Applies {@code LOG_LEVEL} to the root logger. Besides logback's own names it accepts
 * {@code WARNING} as {@code WARN} and {@code CRITICAL}/{@code FATAL} as {@code ERROR}.
 * Anything else falls back to {@code ERROR}.
 */
public final class LoggingConfigurator {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String LOG_LEVEL = "LOG_LEVEL";

    private static final Map<String, Level> ALIASES = Map.of(
            "WARNING", Level.WARN,
            "CRITICAL", Level.ERROR,
            "FATAL", Level.ERROR);

    private LoggingConfigurator() {}

    public static Level configure(IEnvGetter env) {
        String requested = IEnvGetter.getStringOr(env, LOG_LEVEL, "ERROR").toUpperCase(Locale.ROOT);
        Level level = resolve(requested);
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(level);
        // at ERROR so the notice survives the fallback level
        if (!isKnown(requested)) {
            log.error("Unknown {} '{}', using {}", LOG_LEVEL, requested, level);
        }
        return level;
    }

    static Level resolve(String requested) {
        Level alias = ALIASES.get(requested);
        return alias != null ? alias : Level.toLevel(requested, Level.ERROR);
    }

    private static boolean isKnown(String requested) {
        return ALIASES.containsKey(requested) || Level.toLevel(requested, null) != null;
    }
}
