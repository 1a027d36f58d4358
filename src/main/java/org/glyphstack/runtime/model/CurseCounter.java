package org.glyphstack.runtime.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Counts the recoverable faults of one run. The counter only ever grows, by exactly one per
 * fault; it is the sole channel through which soft errors become observable.
 */
public class CurseCounter {

    private static final Logger LOG = LoggerFactory.getLogger(CurseCounter.class);

    private final Map<FaultKind, Long> byKind = new EnumMap<>(FaultKind.class);
    private long total = 0L;
    private FaultKind lastKind = null;

    /**
     * Records one fault.
     * @param kind The fault that occurred.
     * @param instructionIndex The index of the instruction that caused it, for diagnostics.
     */
    public void curse(FaultKind kind, int instructionIndex) {
        Objects.requireNonNull(kind, "kind");
        total++;
        byKind.merge(kind, 1L, Long::sum);
        lastKind = kind;
        LOG.debug("Curse #{} at instruction {}: {}", total, instructionIndex, kind);
    }

    /**
     * @return The number of faults recorded so far.
     */
    public long total() {
        return total;
    }

    public long count(FaultKind kind) {
        return byKind.getOrDefault(kind, 0L);
    }

    /**
     * @return The counts per fault kind; kinds that never occurred are absent.
     */
    public Map<FaultKind, Long> breakdown() {
        return Collections.unmodifiableMap(new EnumMap<>(byKind));
    }

    /**
     * @return The kind of the most recent fault, or {@code null} if none occurred.
     */
    public FaultKind lastKind() {
        return lastKind;
    }

    @Override
    public String toString() {
        return "CurseCounter{total=" + total + ", byKind=" + byKind + '}';
    }
}
