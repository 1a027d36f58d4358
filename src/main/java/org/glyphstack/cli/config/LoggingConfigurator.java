package org.glyphstack.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pushes the {@code logging} block of the application configuration into Logback.
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "WARN"
 *   levels {
 *     "org.glyphstack.runtime.VirtualMachine" = "DEBUG"
 *   }
 * }
 * </pre>
 * The block is read into {@link LoggingSettings} first and applied in one go, so a malformed
 * block leaves Logback untouched.
 */
public final class LoggingConfigurator {

    /** System and context property read by {@code logback.xml} to pick the console appender. */
    public static final String FORMAT_PROPERTY = "glyphstack.logging.format";
    public static final String JSON_APPENDER = LogFormat.JSON.appender();
    public static final String PLAIN_APPENDER = LogFormat.PLAIN.appender();

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_PATH = "logging";
    private static final AtomicBoolean APPLIED = new AtomicBoolean(false);

    private LoggingConfigurator() {}

    /**
     * The console layouts defined in {@code logback.xml}.
     */
    public enum LogFormat {
        PLAIN("STDOUT_PLAIN"),
        JSON("STDOUT");

        private final String appender;

        LogFormat(String appender) {
            this.appender = appender;
        }

        public String appender() {
            return appender;
        }

        /**
         * @param name A format name, case-insensitive.
         * @return {@link #PLAIN} for "plain", {@link #JSON} for anything else.
         */
        public static LogFormat fromName(String name) {
            return "PLAIN".equals(name.trim().toUpperCase(Locale.ROOT)) ? PLAIN : JSON;
        }
    }

    /**
     * A parsed {@code logging} block.
     *
     * @param format The console layout.
     * @param rootLevel The root logger level, if configured.
     * @param levels Per-logger levels; unknown level names are dropped.
     */
    public record LoggingSettings(LogFormat format, Optional<Level> rootLevel, Map<String, Level> levels) {

        public LoggingSettings {
            levels = Collections.unmodifiableMap(new LinkedHashMap<>(levels));
        }

        /**
         * Reads a {@code logging} block.
         * @param logging The block itself, not the root configuration.
         * @return The settings.
         * @throws ConfigException if a key has the wrong type.
         */
        public static LoggingSettings from(Config logging) {
            LogFormat format = logging.hasPath("format")
                    ? LogFormat.fromName(logging.getString("format"))
                    : LogFormat.PLAIN;
            Optional<Level> root = logging.hasPath("default-level")
                    ? parseLevel(logging.getString("default-level"), Logger.ROOT_LOGGER_NAME)
                    : Optional.empty();

            Map<String, Level> levels = new LinkedHashMap<>();
            if (logging.hasPath("levels")) {
                for (Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                    String name = String.valueOf(entry.getValue().unwrapped());
                    parseLevel(name, entry.getKey()).ifPresent(level -> levels.put(entry.getKey(), level));
                }
            }
            return new LoggingSettings(format, root, levels);
        }

        private static Optional<Level> parseLevel(String name, String loggerName) {
            Level level = Level.toLevel(name, null);
            if (level == null) {
                LOG.warn("Ignoring unknown level '{}' for logger '{}'", name, loggerName);
            }
            return Optional.ofNullable(level);
        }
    }

    /**
     * Applies the configuration once; later calls are ignored until {@link #reset()}.
     * A block with keys of the wrong type is logged and skipped.
     *
     * @param config The root application configuration.
     */
    public static void configure(final Config config) {
        if (!APPLIED.compareAndSet(false, true)) {
            LOG.debug("Logging already configured, skipping.");
            return;
        }
        if (!config.hasPath(LOGGING_PATH)) {
            LOG.debug("No logging block, keeping Logback defaults.");
            return;
        }

        final LoggingSettings settings;
        try {
            settings = LoggingSettings.from(config.getConfig(LOGGING_PATH));
        } catch (final ConfigException e) {
            LOG.error("Invalid logging configuration, keeping Logback defaults: {}", e.getMessage());
            return;
        }
        apply(settings, (LoggerContext) LoggerFactory.getILoggerFactory());
    }

    /**
     * Applies parsed settings to a logger context.
     * @param settings The settings.
     * @param context The Logback context.
     */
    public static void apply(final LoggingSettings settings, final LoggerContext context) {
        final String appender = settings.format().appender();
        context.putProperty(FORMAT_PROPERTY, appender);
        System.setProperty(FORMAT_PROPERTY, appender);

        settings.rootLevel().ifPresent(level ->
                context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level));
        settings.levels().forEach((name, level) -> context.getLogger(name).setLevel(level));

        LOG.debug("Logging configured: format={}, root={}, {} logger override(s)",
                settings.format(), settings.rootLevel().map(Level::toString).orElse("unchanged"),
                settings.levels().size());
    }

    /**
     * Maps a configured format name to the appender selected in {@code logback.xml}.
     * @param format {@code PLAIN} or {@code JSON}, case-insensitive; anything else means JSON.
     * @return The appender name.
     */
    public static String appenderFor(final String format) {
        return LogFormat.fromName(format).appender();
    }

    /**
     * Lets the next {@link #configure(Config)} apply again. For tests.
     */
    public static void reset() {
        APPLIED.set(false);
    }
}
