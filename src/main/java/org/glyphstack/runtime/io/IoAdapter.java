package org.glyphstack.runtime.io;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * The boundary between the interpreter and the outside world. Implementations own all
 * buffering, encoding and stream lifecycle; the interpreter only issues these four calls.
 * <p>
 * Reads block until a token, a code point or the end of input is available. Failures of the
 * underlying stream are reported as {@link java.io.UncheckedIOException}.
 */
public interface IoAdapter {

    /**
     * Reads the next whitespace-delimited token.
     * @return The token text, or empty at end of input.
     */
    Optional<String> readNumber();

    /**
     * Reads the next Unicode code point.
     * @return The code point, or empty at end of input.
     */
    OptionalInt readCodepoint();

    void writeText(String text);

    void writeCodepoint(int codePoint);
}
