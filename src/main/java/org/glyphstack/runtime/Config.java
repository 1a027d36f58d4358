package org.glyphstack.runtime;

import org.glyphstack.runtime.model.RationalBackend;

/**
 * Provides centralized constants for the interpreter. This final class is not meant to be
 * instantiated; tunable settings live in {@link RuntimeOptions}.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The largest value OUTPUT_CHAR accepts as a code point.
     */
    public static final int MAX_CODE_POINT = Character.MAX_CODE_POINT;

    /**
     * The numeric backend used when nothing else is configured.
     */
    public static final RationalBackend DEFAULT_BACKEND = RationalBackend.ARBITRARY_PRECISION;

    /**
     * The HOCON path of the runtime settings block.
     */
    public static final String RUNTIME_CONFIG_PATH = "runtime";
}
