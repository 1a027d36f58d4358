package org.glyphstack.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.glyphstack.runtime.model.RationalBackend;

import java.util.Objects;

/**
 * Typed view of the {@code runtime} configuration block.
 * <pre>
 * runtime {
 *   numeric-backend = "arbitrary-precision"  # or "bounded"
 *   max-steps = 0                             # 0 = unlimited
 *   trace = false
 * }
 * </pre>
 *
 * @param backend The numeric backend for all values of a run.
 * @param maxSteps The host-enforced step limit, 0 for none.
 * @param traceEnabled Whether every executed instruction is logged at DEBUG.
 */
public record RuntimeOptions(RationalBackend backend, long maxSteps, boolean traceEnabled) {

    private static final String BACKEND_KEY = "numeric-backend";
    private static final String MAX_STEPS_KEY = "max-steps";
    private static final String TRACE_KEY = "trace";

    public RuntimeOptions {
        Objects.requireNonNull(backend, "backend");
        if (maxSteps < 0) {
            throw new IllegalArgumentException("max-steps must not be negative, got " + maxSteps);
        }
    }

    public static RuntimeOptions defaults() {
        return new RuntimeOptions(org.glyphstack.runtime.Config.DEFAULT_BACKEND, 0L, false);
    }

    /**
     * Reads the runtime block of an application configuration. Missing keys fall back to
     * {@link #defaults()}.
     *
     * @param config The root configuration.
     * @return The options.
     * @throws ConfigException.BadValue if the numeric backend is not recognized.
     */
    public static RuntimeOptions fromConfig(Config config) {
        RuntimeOptions defaults = defaults();
        String path = org.glyphstack.runtime.Config.RUNTIME_CONFIG_PATH;
        if (!config.hasPath(path)) {
            return defaults;
        }
        Config runtime = config.getConfig(path);

        RationalBackend backend = defaults.backend();
        if (runtime.hasPath(BACKEND_KEY)) {
            try {
                backend = RationalBackend.fromConfigValue(runtime.getString(BACKEND_KEY));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(runtime.origin(), path + "." + BACKEND_KEY, e.getMessage(), e);
            }
        }
        long maxSteps = runtime.hasPath(MAX_STEPS_KEY) ? runtime.getLong(MAX_STEPS_KEY) : defaults.maxSteps();
        boolean trace = runtime.hasPath(TRACE_KEY) ? runtime.getBoolean(TRACE_KEY) : defaults.traceEnabled();
        return new RuntimeOptions(backend, maxSteps, trace);
    }

    public RuntimeOptions withBackend(RationalBackend newBackend) {
        return new RuntimeOptions(newBackend, maxSteps, traceEnabled);
    }

    public RuntimeOptions withMaxSteps(long newMaxSteps) {
        return new RuntimeOptions(backend, newMaxSteps, traceEnabled);
    }

    public RuntimeOptions withTraceEnabled(boolean enabled) {
        return new RuntimeOptions(backend, maxSteps, enabled);
    }
}
