package org.glyphstack.runtime.io;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * An {@link IoAdapter} over a character {@link Reader} and {@link Writer}.
 * <p>
 * Number tokens are whitespace-delimited; code points are decoded from UTF-16 surrogate pairs
 * where needed. Both kinds of read share one pushback buffer, so mixing them consumes the input
 * in order. Output is buffered by the caller's writer; call {@link #flush()} at the end of a run.
 */
public class StreamIoAdapter implements IoAdapter, Flushable, Closeable {

    private final PushbackReader in;
    private final Writer out;

    public StreamIoAdapter(Reader in, Writer out) {
        this.in = new PushbackReader(Objects.requireNonNull(in, "in"), 2);
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Creates an adapter over byte streams decoded and encoded as UTF-8.
     * @param in The input stream.
     * @param out The output stream.
     * @return The adapter.
     */
    public static StreamIoAdapter utf8(InputStream in, OutputStream out) {
        return new StreamIoAdapter(
                new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)),
                new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));
    }

    @Override
    public Optional<String> readNumber() {
        try {
            int c = in.read();
            while (c != -1 && Character.isWhitespace(c)) {
                c = in.read();
            }
            if (c == -1) {
                return Optional.empty();
            }
            StringBuilder token = new StringBuilder();
            while (c != -1 && !Character.isWhitespace(c)) {
                token.append((char) c);
                c = in.read();
            }
            return Optional.of(token.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read number token", e);
        }
    }

    @Override
    public OptionalInt readCodepoint() {
        try {
            int high = in.read();
            if (high == -1) {
                return OptionalInt.empty();
            }
            if (Character.isHighSurrogate((char) high)) {
                int low = in.read();
                if (low != -1 && Character.isLowSurrogate((char) low)) {
                    return OptionalInt.of(Character.toCodePoint((char) high, (char) low));
                }
                if (low != -1) {
                    in.unread(low);
                }
            }
            // lone surrogates are passed through as their own code unit
            return OptionalInt.of(high);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read code point", e);
        }
    }

    @Override
    public void writeText(String text) {
        try {
            out.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output", e);
        }
    }

    @Override
    public void writeCodepoint(int codePoint) {
        try {
            out.write(Character.toChars(codePoint));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output", e);
        }
    }

    @Override
    public void flush() {
        try {
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush output", e);
        }
    }

    /**
     * Flushes the output and closes both streams.
     */
    @Override
    public void close() throws IOException {
        try {
            out.flush();
        } finally {
            in.close();
            out.close();
        }
    }
}
